package com.github.bnbjava.scheduling;

import com.github.bnbjava.bound.BruteForce;
import com.github.bnbjava.knapsack.KnapsackProblem;
import com.github.bnbjava.model.Assignment;
import com.github.bnbjava.search.BranchAndBoundSolver;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.Random;

import static com.github.bnbjava.scheduling.SingleMachineProblem.Objective.WEIGHTED_COMPLETION_TIME;
import static com.github.bnbjava.scheduling.SingleMachineProblem.Objective.WEIGHTED_TARDINESS;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

class SequencingBoundTest {
    private final SequencingBound oracle = new SequencingBound();

    private static SingleMachineProblem randomProblem(Random rand, int size, SingleMachineProblem.Objective objective) {
        var jobs = new ArrayList<SchedulingJob>();

        for (var j = 0; j < size; j++) {
            jobs.add(new SchedulingJob("j" + j, (1 + rand.nextInt(18)) / 2.0,
                    rand.nextBoolean() ? null : (double) rand.nextInt(12), 1 + rand.nextInt(4), rand.nextInt(6)));
        }
        return new SingleMachineProblem(jobs, objective);
    }

    @Test
    void smithsRuleAtRoot() {
        var problem = new SingleMachineProblem(List.of(
                new SchedulingJob("J1", 3, 1),
                new SchedulingJob("J2", 2, 2),
                new SchedulingJob("J3", 1, 3)));

        // without release dates the relaxation is exact.
        assertEquals(15.0, oracle.bound(problem, Assignment.root(problem)));
        // J1 first: 3 * 1, then J3 and J2 by Smith's rule: 4 * 3 + 6 * 2.
        assertEquals(27.0, oracle.bound(problem, Assignment.root(problem).restrict(0, new int[]{0})));
        assertEquals(15.0, oracle.bound(problem, Assignment.complete(2, 1, 0)));
    }

    @Test
    void duplicatePrefixHasNoCompletion() {
        var problem = new SingleMachineProblem(List.of(new SchedulingJob("a", 1), new SchedulingJob("b", 1)));

        assertEquals(Double.POSITIVE_INFINITY, oracle.bound(problem, Assignment.complete(0, 0)));
    }

    @Test
    void requiresSingleMachineProblem() {
        var knapsack = new KnapsackProblem(new double[]{1}, new double[]{1}, 1);

        assertThrows(IllegalArgumentException.class, () -> oracle.bound(knapsack, Assignment.complete(1)));
    }

    @Test
    void admissibleOnRandomInstances() {
        var rand = new Random(2024);

        for (var i = 0; i < 6; i++) {
            BruteForce.assertAdmissible(oracle, randomProblem(rand, 4, WEIGHTED_COMPLETION_TIME));
            BruteForce.assertAdmissible(oracle, randomProblem(rand, 4, WEIGHTED_TARDINESS));
        }
    }

    @Test
    void solverMatchesBruteForce() {
        var rand = new Random(77);
        var solver = new BranchAndBoundSolver(oracle);

        for (var i = 0; i < 10; i++) {
            var objective = i % 2 == 0 ? WEIGHTED_COMPLETION_TIME : WEIGHTED_TARDINESS;
            var problem = randomProblem(rand, 5, objective);

            assertEquals(BruteForce.bestCompletion(problem, Assignment.root(problem)), solver.solve(problem).objective(),
                    1e-9);
        }
    }
}
