package com.github.bnbjava.search;

import com.github.bnbjava.bound.BoundOracle;
import com.github.bnbjava.bound.BruteForce;
import com.github.bnbjava.bound.LinearRelaxationBound;
import com.github.bnbjava.bound.SlackBound;
import com.github.bnbjava.branch.BranchingDecision;
import com.github.bnbjava.branch.BranchingStrategy;
import com.github.bnbjava.branch.FirstUnassigned;
import com.github.bnbjava.knapsack.KnapsackProblem;
import com.github.bnbjava.model.Assignment;
import com.github.bnbjava.model.LinearConstraint;
import com.github.bnbjava.model.LinearProblem;
import com.github.bnbjava.model.Problem;
import com.github.bnbjava.model.Sense;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Random;

import static com.github.bnbjava.search.BranchAndBoundSolver.Result.State.INFEASIBLE;
import static com.github.bnbjava.search.BranchAndBoundSolver.Result.State.OPTIMAL;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

/**
 * Behaviour every solver configuration must share.
 */
public abstract class AbstractSolverTest {
    static final KnapsackProblem SCENARIO_A = new KnapsackProblem(new double[]{2, 3, 4}, new double[]{3, 4, 5}, 5);

    @Test
    void knapsack() {
        try (var solver = newSolver(new LinearRelaxationBound())) {
            var result = solver.solve(SCENARIO_A);

            assertEquals(OPTIMAL, result.state());
            assertEquals(7.0, result.objective());
            assertEquals(Assignment.complete(1, 1, 0), result.incumbent().assignment());
            assertEquals(7.0, result.bestBound());
            assertEquals(0.0, result.gap());
            assertEquals(List.of(0, 1), KnapsackProblem.packedItems(result.incumbent().assignment().values()));
        }
    }

    @Test
    void emptyDomainIsInfeasible() {
        try (var solver = newSolver(new SlackBound())) {
            var result = solver.solve(new KnapsackProblem(new double[]{1, 1}, new double[]{1, 1}, 1) {
                @Override
                public int[] domain(int variable) {
                    return variable == 1 ? new int[0] : super.domain(variable);
                }
            });

            assertEquals(INFEASIBLE, result.state());
            assertNull(result.incumbent());
            assertTrue(Double.isNaN(result.objective()));
            assertEquals(Double.NEGATIVE_INFINITY, result.bestBound());
            assertEquals(0L, result.statistics().nodesSelected());
        }
    }

    /**
     * <code>x0 + x1 = 1</code> and <code>x0 = x1</code> over binary variables. The root passes the interval test, so
     * the search has to prove infeasibility by exhausting the tree.
     */
    @Test
    void infeasibleAfterSearch() {
        var problem = new LinearProblem() {
            @Override
            public double[] objectiveCoefficients() {
                return new double[]{1, 1};
            }

            @Override
            public List<LinearConstraint> constraints() {
                return List.of(new LinearConstraint("sum", new double[]{1, 1}, 1, 1),
                        new LinearConstraint("equal", new double[]{1, -1}, 0, 0));
            }

            @Override
            public int size() {
                return 2;
            }

            @Override
            public int[] domain(int variable) {
                return new int[]{0, 1};
            }

            @Override
            public Sense sense() {
                return Sense.MINIMIZE;
            }
        };

        try (var solver = newSolver(new SlackBound())) {
            var result = solver.solve(problem);

            assertEquals(INFEASIBLE, result.state());
            assertNull(result.incumbent());
            assertEquals(Double.POSITIVE_INFINITY, result.bestBound());
            assertTrue(result.statistics().nodesInfeasible() > 0);
        }
    }

    @Test
    void noVariables() {
        try (var solver = newSolver(new SlackBound())) {
            var result = solver.solve(new KnapsackProblem(new double[0], new double[0], 3));

            assertEquals(OPTIMAL, result.state());
            assertEquals(0.0, result.objective());
            assertEquals(0, result.incumbent().assignment().size());
        }
    }

    @Test
    void matchesBruteForce() {
        var rand = new Random(1234);

        try (var solver = newSolver(new LinearRelaxationBound())) {
            for (var i = 0; i < 20; i++) {
                var problem = BruteForce.randomKnapsack(rand, 8);
                var expected = BruteForce.bestCompletion(problem, Assignment.root(problem));
                var result = solver.solve(problem);

                assertEquals(OPTIMAL, result.state());
                assertNotNull(expected);
                assertEquals(expected, result.objective(), 1e-9);
                assertTrue(problem.isFeasible(result.incumbent().assignment()));
            }
        }
    }

    @Test
    void pruningLosesNothing() {
        var rand = new Random(99);

        try (var solver = newSolver(new SlackBound())) {
            for (var i = 0; i < 10; i++) {
                var problem = BruteForce.randomKnapsack(rand, 7);

                solver.setPruning(true);
                var pruned = solver.solve(problem);
                solver.setPruning(false);
                var exhaustive = solver.solve(problem);

                assertEquals(exhaustive.objective(), pruned.objective());
                assertEquals(0L, exhaustive.statistics().nodesPruned());
                assertTrue(pruned.statistics().nodesSelected() <= exhaustive.statistics().nodesSelected());
            }
        }
    }

    @Test
    void evaluationFailureAbortsSearch() {
        var problem = new KnapsackProblem(new double[]{1, 2}, new double[]{1, 2}, 3) {
            @Override
            public double objective(Assignment assignment) {
                throw new IllegalStateException("boom");
            }
        };

        try (var solver = newSolver(new SlackBound())) {
            var e = assertThrows(SearchException.class, () -> solver.solve(problem));

            assertInstanceOf(IllegalStateException.class, e.getCause());
            assertEquals(2, e.getDepth());
            assertEquals(List.of(0, 1), e.getBranchingPath());
            assertTrue(e.getAssignment().isComplete());
        }
    }

    @Test
    void invalidBranchingDecisionAbortsSearch() {
        BranchingStrategy dropsValue = new FirstUnassigned() {
            @Override
            public BranchingDecision branch(Problem problem, Assignment assignment, int variable) {
                return new BranchingDecision(variable, List.of(new int[]{1}));
            }
        };
        BranchingStrategy overlaps = new FirstUnassigned() {
            @Override
            public BranchingDecision branch(Problem problem, Assignment assignment, int variable) {
                return new BranchingDecision(variable, List.of(new int[]{1}, new int[]{1, 0}));
            }
        };

        for (var strategy : List.of(dropsValue, overlaps)) {
            try (var solver = newSolver(new SlackBound())) {
                solver.setBranchingStrategy(strategy);

                var e = assertThrows(SearchException.class, () -> solver.solve(SCENARIO_A));

                assertInstanceOf(IllegalArgumentException.class, e.getCause());
                assertEquals(0, e.getDepth());
                assertEquals(List.of(), e.getBranchingPath());
            }
        }
    }

    @Test
    void invalidBound() {
        BoundOracle nan = (problem, assignment) -> assignment.decidedCount() == 0 ? 10.0 : Double.NaN;

        try (var solver = newSolver(nan)) {
            var e = assertThrows(InvalidBoundException.class, () -> solver.solve(SCENARIO_A));

            assertEquals(1, e.getDepth());
            assertEquals(List.of(0), e.getBranchingPath());
        }
        try (var solver = newSolver((problem, assignment) -> Double.POSITIVE_INFINITY)) {
            var e = assertThrows(InvalidBoundException.class, () -> solver.solve(SCENARIO_A));

            assertEquals(0, e.getDepth());
            assertEquals(List.of(), e.getBranchingPath());
        }
    }

    /**
     * @return a new solver using the given bound oracle, configured for the test at hand
     */
    protected abstract BranchAndBoundSolver newSolver(BoundOracle boundOracle);
}
