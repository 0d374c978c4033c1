package com.github.bnbjava.bound;

import com.github.bnbjava.model.Assignment;
import com.github.bnbjava.model.LinearProblem;
import com.github.bnbjava.model.Problem;

import static com.github.bnbjava.model.Sense.MINIMIZE;

/**
 * Trivial combinatorial bound for a {@link LinearProblem}: every variable contributes the best value of its objective
 * term over its remaining domain, and the constraints are ignored. Equal to the objective on complete assignments.
 */
public class SlackBound implements BoundOracle {
    /**
     * Default constructor.
     */
    public SlackBound() {
    }

    @Override
    public double bound(Problem problem, Assignment assignment) {
        if (!(problem instanceof LinearProblem linear)) {
            throw new IllegalArgumentException("SlackBound requires a LinearProblem.");
        }
        var minimize = linear.sense() == MINIMIZE;
        var c = linear.objectiveCoefficients();
        var total = linear.objectiveConstant();

        // same summation order as LinearProblem.objective(), so complete assignments give the exact objective.
        for (var v = 0; v < c.length; v++) {
            var low = c[v] * assignment.min(v);
            var high = c[v] * assignment.max(v);
            total += minimize ? Math.min(low, high) : Math.max(low, high);
        }
        return total;
    }
}
