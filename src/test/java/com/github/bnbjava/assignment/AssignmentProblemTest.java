package com.github.bnbjava.assignment;

import com.github.bnbjava.bound.BruteForce;
import com.github.bnbjava.branch.MostConstrained;
import com.github.bnbjava.model.Assignment;
import com.github.bnbjava.model.InvalidInputException;
import com.github.bnbjava.search.BranchAndBoundSolver;
import org.junit.jupiter.api.Test;

import java.util.Random;

import static com.github.bnbjava.search.BranchAndBoundSolver.Result.State.OPTIMAL;
import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

class AssignmentProblemTest {
    private static final double[][] COSTS = {
            {9, 2, 7, 8},
            {6, 4, 3, 7},
            {5, 8, 1, 8},
            {7, 6, 9, 4}};

    private static AssignmentProblem randomProblem(Random rand, int size) {
        var costs = new double[size][size];

        for (var agent = 0; agent < size; agent++) {
            for (var task = 0; task < size; task++) {
                costs[agent][task] = rand.nextInt(20) / 4.0;
            }
        }
        return new AssignmentProblem(costs);
    }

    /**
     * The classic 4x4 example: 2 + 6 + 1 + 4 = 13.
     */
    @Test
    void solvesSmallInstance() {
        var problem = new AssignmentProblem(COSTS);
        var result = new BranchAndBoundSolver(new MinimumCostBound()).solve(problem);

        assertEquals(OPTIMAL, result.state());
        assertEquals(13.0, result.objective());
        assertArrayEquals(new int[]{1, 0, 2, 3}, result.incumbent().assignment().values());
    }

    @Test
    void rootBound() {
        var problem = new AssignmentProblem(COSTS);

        // row minimums 2 + 3 + 1 + 4 = 10; column minimums 5 + 2 + 1 + 4 = 12.
        assertEquals(12.0, new MinimumCostBound().bound(problem, Assignment.root(problem)));
        assertEquals(13.0, new MinimumCostBound().bound(problem, Assignment.complete(1, 0, 2, 3)));
    }

    @Test
    void validation() {
        assertThrows(InvalidInputException.class, () -> new AssignmentProblem(new double[][]{{1, 2}, {3}}));
        assertThrows(InvalidInputException.class, () ->
                new AssignmentProblem(new double[][]{{1, Double.NaN}, {3, 4}}));
    }

    @Test
    void admissibleOnRandomInstances() {
        var rand = new Random(8);

        for (var i = 0; i < 8; i++) {
            BruteForce.assertAdmissible(new MinimumCostBound(), randomProblem(rand, 4));
        }
    }

    @Test
    void solverMatchesBruteForce() {
        var rand = new Random(19);
        var solver = new BranchAndBoundSolver(new MinimumCostBound());
        solver.setBranchingStrategy(new MostConstrained());

        for (var i = 0; i < 10; i++) {
            var problem = randomProblem(rand, 5);

            assertEquals(BruteForce.bestCompletion(problem, Assignment.root(problem)), solver.solve(problem).objective(),
                    1e-9);
        }
    }
}
