package com.github.bnbjava.assignment;

import com.github.bnbjava.bound.BoundOracle;
import com.github.bnbjava.model.AllDifferent;
import com.github.bnbjava.model.Assignment;
import com.github.bnbjava.model.Problem;

import java.util.Arrays;

import static com.github.bnbjava.Util.maxScale;
import static com.github.bnbjava.Util.roundBound;
import static com.github.bnbjava.model.Sense.MINIMIZE;

/**
 * Lower bound for an {@link AssignmentProblem}: the cost of the decided pairs, plus the larger of two relaxations of
 * the rest. Either every undecided agent takes its cheapest free task (tasks may be shared), or every free task goes
 * to its cheapest undecided agent (agents may be shared.)
 */
public class MinimumCostBound implements BoundOracle {
    /**
     * Default constructor.
     */
    public MinimumCostBound() {
    }

    @Override
    public double bound(Problem problem, Assignment assignment) {
        if (!(problem instanceof AssignmentProblem assignmentProblem)) {
            throw new IllegalArgumentException("MinimumCostBound requires an AssignmentProblem.");
        }
        if (assignment.isComplete()) {
            return problem.objective(assignment);
        }
        var used = AllDifferent.used(assignment);
        if (used == null) {
            return problem.sense().worst();
        }

        var size = assignment.size();
        var fixed = 0.0;
        var rows = 0.0;
        var columns = new double[size];
        Arrays.fill(columns, Double.POSITIVE_INFINITY);

        for (var agent = 0; agent < size; agent++) {
            if (assignment.isDecided(agent)) {
                fixed += assignmentProblem.cost(agent, assignment.value(agent));
                continue;
            }
            var cheapest = Double.POSITIVE_INFINITY;

            for (var i = 0; i < assignment.domainSize(agent); i++) {
                var task = assignment.valueAt(agent, i);

                if (!used[task]) {
                    var cost = assignmentProblem.cost(agent, task);
                    cheapest = Math.min(cheapest, cost);
                    columns[task] = Math.min(columns[task], cost);
                }
            }
            if (cheapest == Double.POSITIVE_INFINITY) {
                return problem.sense().worst();
            }
            rows += cheapest;
        }

        var columnTotal = 0.0;
        for (var task = 0; task < size; task++) {
            if (!used[task]) {
                // a free task that no undecided agent can take leaves some agent without a task.
                if (columns[task] == Double.POSITIVE_INFINITY) {
                    return problem.sense().worst();
                }
                columnTotal += columns[task];
            }
        }
        return roundBound(fixed + Math.max(rows, columnTotal), scale(assignmentProblem, size), MINIMIZE);
    }

    private static int scale(AssignmentProblem problem, int size) {
        var costs = new double[size * size];

        for (var agent = 0; agent < size; agent++) {
            for (var task = 0; task < size; task++) {
                costs[agent * size + task] = problem.cost(agent, task);
            }
        }
        return maxScale(costs);
    }
}
