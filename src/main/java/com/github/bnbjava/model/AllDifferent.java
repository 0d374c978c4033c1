package com.github.bnbjava.model;

/**
 * Helpers for problems whose variables must take pairwise different values from <code>0..n-1</code>, such as
 * sequences and one-to-one assignments.
 */
public final class AllDifferent {
    private AllDifferent() {
    }

    /**
     * Test whether an assignment can still be completed into a permutation: no two decided variables share a value,
     * and every undecided variable still has a value that no decided variable has taken.
     *
     * @param assignment an assignment whose values are in <code>0..assignment.size()-1</code>
     * @return false if no completion can have pairwise different values
     */
    public static boolean isConsistent(Assignment assignment) {
        var used = used(assignment);

        if (used == null) {
            return false;
        }
        for (var v = 0; v < assignment.size(); v++) {
            if (!assignment.isDecided(v) && !hasFreeValue(assignment, v, used)) {
                return false;
            }
        }
        return true;
    }

    /**
     * @param assignment an assignment whose values are in <code>0..assignment.size()-1</code>
     * @return for every value, whether a decided variable has taken it; null if two decided variables share a value
     */
    public static boolean[] used(Assignment assignment) {
        var used = new boolean[assignment.size()];

        for (var v = 0; v < assignment.size(); v++) {
            if (assignment.isDecided(v)) {
                var value = assignment.value(v);

                if (used[value]) {
                    return null;
                }
                used[value] = true;
            }
        }
        return used;
    }

    private static boolean hasFreeValue(Assignment assignment, int variable, boolean[] used) {
        for (var i = 0; i < assignment.domainSize(variable); i++) {
            if (!used[assignment.valueAt(variable, i)]) {
                return true;
            }
        }
        return false;
    }

    /**
     * @param size the number of variables and values
     * @return the domain <code>0..size-1</code>
     */
    public static int[] identity(int size) {
        var domain = new int[size];

        for (var i = 0; i < size; i++) {
            domain[i] = i;
        }
        return domain;
    }
}
