package com.github.bnbjava.model;

import java.util.Arrays;
import java.util.HashSet;
import java.util.StringJoiner;

/**
 * <p>
 * An immutable partial assignment: the remaining ordered domain of every variable.
 * </p><p>
 * A variable is decided once its domain holds a single value, and the assignment is complete once every variable is
 * decided. Narrowing a variable with {@link #restrict(int, int[])} returns a new instance which shares the unchanged
 * domains with this one, so domain arrays are never written after construction.
 * </p>
 */
public final class Assignment {
    private final int[][] domains;
    private final int decided;

    private Assignment(int[][] domains, int decided) {
        this.domains = domains;
        this.decided = decided;
    }

    /**
     * Build the root assignment of a problem, where every variable still has its full domain.
     *
     * @param problem the problem instance
     * @return the root assignment
     * @throws InvalidInputException if the problem reports a negative size, a null domain, or a domain with
     *                               duplicate values
     */
    public static Assignment root(Problem problem) {
        var size = problem.size();

        if (size < 0) {
            throw new InvalidInputException("problem size must not be negative.");
        }
        var domains = new int[size][];

        for (var v = 0; v < size; v++) {
            var domain = problem.domain(v);

            if (domain == null) {
                throw new InvalidInputException("domain of variable " + v + " is null.");
            }
            if (Arrays.stream(domain).distinct().count() != domain.length) {
                throw new InvalidInputException("domain of variable " + v + " has duplicate values.");
            }
            domains[v] = domain.clone();
        }
        return of(domains);
    }

    /**
     * Build an assignment directly from its domains, which are copied.
     *
     * @param domains one ordered domain per variable
     * @return the assignment
     */
    public static Assignment of(int[]... domains) {
        var copy = new int[domains.length][];
        var decided = 0;

        for (var v = 0; v < domains.length; v++) {
            copy[v] = domains[v].clone();
            if (copy[v].length == 1) {
                decided++;
            }
        }
        return new Assignment(copy, decided);
    }

    /**
     * Build a complete assignment from one value per variable.
     *
     * @param values the value of each variable
     * @return the complete assignment
     */
    public static Assignment complete(int... values) {
        var domains = new int[values.length][];

        for (var v = 0; v < values.length; v++) {
            domains[v] = new int[]{values[v]};
        }
        return new Assignment(domains, values.length);
    }

    /**
     * @return the number of variables
     */
    public int size() {
        return domains.length;
    }

    /**
     * @return the number of decided variables
     */
    public int decidedCount() {
        return decided;
    }

    /**
     * @return true if every variable is decided
     */
    public boolean isComplete() {
        return decided == domains.length;
    }

    /**
     * @param variable a variable index
     * @return true if the variable's domain has exactly one value
     */
    public boolean isDecided(int variable) {
        return domains[variable].length == 1;
    }

    /**
     * @return true if some variable has no value left
     */
    public boolean hasEmptyDomain() {
        return Arrays.stream(domains).anyMatch(d -> d.length == 0);
    }

    /**
     * @param variable a decided variable
     * @return its value
     * @throws IllegalStateException if the variable is not decided
     */
    public int value(int variable) {
        var domain = domains[variable];

        if (domain.length != 1) {
            throw new IllegalStateException("variable " + variable + " is not decided.");
        }
        return domain[0];
    }

    /**
     * @return the value of every variable, in variable order
     * @throws IllegalStateException if the assignment is not complete
     */
    public int[] values() {
        var values = new int[domains.length];

        for (var v = 0; v < values.length; v++) {
            values[v] = value(v);
        }
        return values;
    }

    /**
     * @param variable a variable index
     * @return a copy of the variable's remaining domain, in order
     */
    public int[] domain(int variable) {
        return domains[variable].clone();
    }

    /**
     * @param variable a variable index
     * @return the number of values left in the variable's domain
     */
    public int domainSize(int variable) {
        return domains[variable].length;
    }

    /**
     * @param variable a variable index
     * @param index    a position in the variable's remaining domain
     * @return the value at that position
     */
    public int valueAt(int variable, int index) {
        return domains[variable][index];
    }

    /**
     * @param variable a variable index
     * @param value    a candidate value
     * @return true if the value is still in the variable's domain
     */
    public boolean contains(int variable, int value) {
        for (var v : domains[variable]) {
            if (v == value) {
                return true;
            }
        }
        return false;
    }

    /**
     * @param variable a variable index with a non-empty domain
     * @return the smallest remaining value
     */
    public int min(int variable) {
        return Arrays.stream(domains[variable]).min().orElseThrow();
    }

    /**
     * @param variable a variable index with a non-empty domain
     * @return the largest remaining value
     */
    public int max(int variable) {
        return Arrays.stream(domains[variable]).max().orElseThrow();
    }

    /**
     * Narrow a variable to a subset of its current domain.
     *
     * @param variable the variable to narrow
     * @param subset   the values to keep; every one must be in the current domain
     * @return a new assignment
     * @throws IllegalArgumentException if <code>subset</code> is not a subset of the current domain
     */
    public Assignment restrict(int variable, int[] subset) {
        var seen = new HashSet<Integer>();

        for (var value : subset) {
            if (!contains(variable, value) || !seen.add(value)) {
                throw new IllegalArgumentException("value " + value + " is not a distinct member of the domain of " +
                        "variable " + variable + ".");
            }
        }
        var copy = domains.clone();
        copy[variable] = subset.clone();

        var decided = this.decided;
        if (domains[variable].length == 1) {
            decided--;
        }
        if (subset.length == 1) {
            decided++;
        }
        return new Assignment(copy, decided);
    }

    @Override
    public boolean equals(Object o) {
        return o instanceof Assignment other && Arrays.deepEquals(domains, other.domains);
    }

    @Override
    public int hashCode() {
        return Arrays.deepHashCode(domains);
    }

    @Override
    public String toString() {
        var joiner = new StringJoiner(", ", "[", "]");

        for (var v = 0; v < domains.length; v++) {
            var domain = domains[v];
            joiner.add(domain.length == 1 ? v + "=" + domain[0] : v + "=" + Arrays.toString(domain));
        }
        return joiner.toString();
    }
}
