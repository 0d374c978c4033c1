package com.github.bnbjava.assignment;

import com.github.bnbjava.model.AllDifferent;
import com.github.bnbjava.model.Assignment;
import com.github.bnbjava.model.InvalidInputException;
import com.github.bnbjava.model.Problem;
import com.github.bnbjava.model.Sense;

import java.util.Arrays;

/**
 * The linear assignment problem: assign each of <code>n</code> agents to a different one of <code>n</code> tasks,
 * minimizing the total cost. Variable <code>i</code> is the task given to agent <code>i</code>.
 *
 * @see MinimumCostBound
 */
public class AssignmentProblem implements Problem {
    private final double[][] costs;

    /**
     * Constructor.
     *
     * @param costs a square matrix; <code>costs[agent][task]</code> is the cost of the pair
     * @throws InvalidInputException if the matrix is not square or has non-finite entries
     */
    public AssignmentProblem(double[][] costs) {
        var size = costs.length;

        if (Arrays.stream(costs).anyMatch(row -> row.length != size)) {
            throw new InvalidInputException("costs must be square.");
        }
        if (Arrays.stream(costs).flatMapToDouble(Arrays::stream).anyMatch(c -> !Double.isFinite(c))) {
            throw new InvalidInputException("costs must be finite.");
        }
        this.costs = Arrays.stream(costs).map(double[]::clone).toArray(double[][]::new);
    }

    @Override
    public int size() {
        return costs.length;
    }

    @Override
    public int[] domain(int variable) {
        return AllDifferent.identity(costs.length);
    }

    @Override
    public Sense sense() {
        return Sense.MINIMIZE;
    }

    @Override
    public boolean isFeasible(Assignment assignment) {
        return AllDifferent.isConsistent(assignment);
    }

    @Override
    public double objective(Assignment assignment) {
        var total = 0.0;

        for (var agent = 0; agent < costs.length; agent++) {
            total += costs[agent][assignment.value(agent)];
        }
        return total;
    }

    /**
     * @param agent an agent
     * @param task  a task
     * @return the cost of the pair
     */
    public double cost(int agent, int task) {
        return costs[agent][task];
    }
}
