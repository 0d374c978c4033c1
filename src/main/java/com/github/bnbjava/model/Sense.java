package com.github.bnbjava.model;

import static java.lang.Double.NEGATIVE_INFINITY;
import static java.lang.Double.POSITIVE_INFINITY;

/**
 * Direction of optimisation.
 */
public enum Sense {
    /**
     * Smaller objective values are better.
     */
    MINIMIZE(1),
    /**
     * Larger objective values are better.
     */
    MAXIMIZE(-1);

    private final int sign;

    Sense(int sign) {
        this.sign = sign;
    }

    /**
     * Strict numeric comparison in the direction of this sense. Zeros of either sign are equal, and NaN is never
     * better or worse than anything.
     *
     * @param a candidate value
     * @param b reference value
     * @return true if <code>a</code> is strictly better than <code>b</code>
     */
    public boolean isBetter(double a, double b) {
        return sign < 0 ? a > b : a < b;
    }

    /**
     * Compare two values so that the better one sorts first.
     *
     * @param a first value
     * @param b second value
     * @return negative if <code>a</code> is better, positive if <code>b</code> is better, zero if equal
     */
    public int compare(double a, double b) {
        return sign * Double.compare(a, b);
    }

    /**
     * The worst possible value: positive infinity when minimizing, negative infinity when maximizing.
     * A bound oracle returns this to declare that an assignment has no feasible completion.
     *
     * @return an infinite value
     */
    public double worst() {
        return this == MINIMIZE ? POSITIVE_INFINITY : NEGATIVE_INFINITY;
    }

    /**
     * The best possible value, which is never an acceptable bound.
     *
     * @return an infinite value
     */
    public double best() {
        return -worst();
    }
}
