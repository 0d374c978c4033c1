package com.github.bnbjava.branch;

import com.github.bnbjava.model.Assignment;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.HashSet;
import java.util.List;

/**
 * A branching decision: a variable, and a partition of its current domain into non-empty, disjoint subsets which
 * together cover the whole domain. Each subset yields one child assignment, so no feasible solution is lost.
 *
 * @param variable  the variable to branch on
 * @param partition the subsets, in the order the children should be explored
 */
public record BranchingDecision(int variable, List<int[]> partition) {
    /**
     * Copying constructor. The partition can only be checked against a domain by
     * {@link #of(Assignment, int, List)}, which the solver applies to every decision before using it.
     */
    public BranchingDecision {
        partition = partition.stream().map(int[]::clone).toList();
    }

    /**
     * @return a copy of the subsets, in exploration order
     */
    @Override
    public List<int[]> partition() {
        return partition.stream().map(int[]::clone).toList();
    }

    /**
     * Build a decision and check that its partition is exhaustive and non-overlapping with respect to the variable's
     * current domain in <code>parent</code>.
     *
     * @param parent    the assignment being branched
     * @param variable  an undecided variable of <code>parent</code>
     * @param partition the subsets
     * @return the decision
     * @throws IllegalArgumentException if the variable is decided, a subset is empty, or the subsets do not partition
     *                                  the domain
     */
    public static BranchingDecision of(Assignment parent, int variable, List<int[]> partition) {
        if (variable < 0 || variable >= parent.size() || parent.isDecided(variable)) {
            throw new IllegalArgumentException("cannot branch on variable " + variable + " of " + parent);
        }
        var seen = new HashSet<Integer>();

        for (var subset : partition) {
            if (subset.length == 0) {
                throw new IllegalArgumentException("empty subset in partition of variable " + variable);
            }
            for (var value : subset) {
                if (!parent.contains(variable, value) || !seen.add(value)) {
                    throw new IllegalArgumentException("partition of variable " + variable +
                            " is overlapping or outside the domain: " + format(partition));
                }
            }
        }
        if (seen.size() != parent.domainSize(variable)) {
            throw new IllegalArgumentException("partition of variable " + variable + " does not cover the domain: " +
                    format(partition));
        }
        return new BranchingDecision(variable, partition);
    }

    /**
     * One singleton subset per remaining value, in domain order.
     *
     * @param parent   the assignment being branched
     * @param variable an undecided variable
     * @return the decision
     */
    public static BranchingDecision enumerate(Assignment parent, int variable) {
        var partition = new ArrayList<int[]>();

        for (var i = 0; i < parent.domainSize(variable); i++) {
            partition.add(new int[]{parent.valueAt(variable, i)});
        }
        return of(parent, variable, partition);
    }

    /**
     * Apply the decision.
     *
     * @param parent the assignment being branched
     * @return one child assignment per subset, in partition order
     */
    public List<Assignment> children(Assignment parent) {
        return partition.stream().map(subset -> parent.restrict(variable, subset)).toList();
    }

    private static String format(List<int[]> partition) {
        return partition.stream().map(Arrays::toString).toList().toString();
    }

    @Override
    public boolean equals(Object o) {
        if (!(o instanceof BranchingDecision other) || variable != other.variable ||
                partition.size() != other.partition.size()) {
            return false;
        }
        for (var i = 0; i < partition.size(); i++) {
            if (!Arrays.equals(partition.get(i), other.partition.get(i))) {
                return false;
            }
        }
        return true;
    }

    @Override
    public int hashCode() {
        return 31 * variable + partition.stream().mapToInt(Arrays::hashCode).reduce(0, (a, b) -> 31 * a + b);
    }

    @Override
    public String toString() {
        return "x" + variable + " in " + format(partition);
    }
}
