package com.github.bnbjava.model;

import java.util.List;

/**
 * A {@link Problem} whose objective and constraints are linear in the variables:
 * minimize or maximize <code>objectiveConstant() + sum(objectiveCoefficients()[v] * x[v])</code> subject to
 * {@link #constraints()}. Variables are integers restricted to their domains.
 * <p>
 * This is the shape consumed by the default bound oracles.
 */
public interface LinearProblem extends Problem {
    /**
     * Relative tolerance applied when testing constraint limits, to absorb floating-point summation error.
     */
    double TOLERANCE = 1e-9;

    /**
     * @return one objective coefficient per variable
     */
    double[] objectiveCoefficients();

    /**
     * @return the constant term of the objective
     */
    default double objectiveConstant() {
        return 0.0;
    }

    /**
     * @return the linear constraints; each has one coefficient per variable
     */
    List<LinearConstraint> constraints();

    /**
     * Interval-arithmetic feasibility: rejects the assignment only if some constraint is violated for every choice of
     * values from the remaining domains. Exact on complete assignments.
     */
    @Override
    default boolean isFeasible(Assignment assignment) {
        if (assignment.hasEmptyDomain()) {
            return false;
        }
        for (var constraint : constraints()) {
            var range = constraint.range(assignment);

            if (range[0] > constraint.upper() + slack(constraint.upper()) ||
                    range[1] < constraint.lower() - slack(constraint.lower())) {
                return false;
            }
        }
        return true;
    }

    @Override
    default double objective(Assignment assignment) {
        var c = objectiveCoefficients();
        var total = objectiveConstant();

        for (var v = 0; v < c.length; v++) {
            total += c[v] * assignment.value(v);
        }
        return total;
    }

    /**
     * Validate the dimensions of the objective and constraints against {@link #size()}.
     *
     * @param problem the problem to check
     * @throws InvalidInputException if any dimension differs
     */
    static void validate(LinearProblem problem) {
        var size = problem.size();

        if (problem.objectiveCoefficients().length != size) {
            throw new InvalidInputException("objective must have one coefficient per variable.");
        }
        for (var constraint : problem.constraints()) {
            if (constraint.coefficients().length != size) {
                throw new InvalidInputException("constraint " + constraint.name() +
                        " must have one coefficient per variable.");
            }
        }
    }

    private static double slack(double limit) {
        return Double.isInfinite(limit) ? 0.0 : TOLERANCE * Math.max(1.0, Math.abs(limit));
    }
}
