package com.github.bnbjava.model;

import java.util.Arrays;

/**
 * A linear constraint <code>lower &lt;= sum(coefficients[v] * x[v]) &lt;= upper</code>. Use infinities for a
 * missing side.
 *
 * @param name         used in diagnostics and as the expression name in relaxation models
 * @param coefficients one coefficient per variable
 * @param lower        the lower limit, or negative infinity
 * @param upper        the upper limit, or positive infinity
 */
public record LinearConstraint(String name, double[] coefficients, double lower, double upper) {
    /**
     * Validating constructor.
     */
    public LinearConstraint {
        if (Double.isNaN(lower) || Double.isNaN(upper) || lower > upper) {
            throw new InvalidInputException("constraint " + name + " has invalid limits.");
        }
        if (Arrays.stream(coefficients).anyMatch(c -> !Double.isFinite(c))) {
            throw new InvalidInputException("constraint " + name + " has non-finite coefficients.");
        }
        coefficients = coefficients.clone();
    }

    /**
     * @return a copy of the coefficients
     */
    @Override
    public double[] coefficients() {
        return coefficients.clone();
    }

    /**
     * Convenience factory for <code>sum(coefficients[v] * x[v]) &lt;= upper</code>.
     *
     * @param name         the constraint name
     * @param coefficients one coefficient per variable
     * @param upper        the upper limit
     * @return the constraint
     */
    public static LinearConstraint atMost(String name, double[] coefficients, double upper) {
        return new LinearConstraint(name, coefficients, Double.NEGATIVE_INFINITY, upper);
    }

    /**
     * The smallest and largest value of the left-hand side over the remaining domains, by interval arithmetic.
     *
     * @param assignment the assignment providing the domains
     * @return a two-element array <code>{min, max}</code>
     */
    double[] range(Assignment assignment) {
        var min = 0.0;
        var max = 0.0;

        for (var v = 0; v < coefficients.length; v++) {
            var c = coefficients[v];

            if (c != 0.0) {
                var a = c * assignment.min(v);
                var b = c * assignment.max(v);
                min += Math.min(a, b);
                max += Math.max(a, b);
            }
        }
        return new double[]{min, max};
    }

    @Override
    public boolean equals(Object o) {
        return o instanceof LinearConstraint other && name.equals(other.name) &&
                Arrays.equals(coefficients, other.coefficients) &&
                Double.compare(lower, other.lower) == 0 && Double.compare(upper, other.upper) == 0;
    }

    @Override
    public int hashCode() {
        return 31 * name.hashCode() + Arrays.hashCode(coefficients);
    }

    @Override
    public String toString() {
        return lower + " <= " + name + Arrays.toString(coefficients) + " <= " + upper;
    }
}
