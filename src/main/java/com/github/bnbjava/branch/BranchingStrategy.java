package com.github.bnbjava.branch;

import com.github.bnbjava.model.Assignment;
import com.github.bnbjava.model.Problem;

/**
 * Chooses where to branch and how to split the chosen variable's domain. Implementations must be deterministic and
 * thread-safe.
 */
public interface BranchingStrategy {
    /**
     * @param problem    the problem instance
     * @param assignment an incomplete assignment
     * @return an undecided variable of <code>assignment</code>
     */
    int selectVariable(Problem problem, Assignment assignment);

    /**
     * Split the variable's domain. The default creates one child per remaining value, in domain order.
     *
     * @param problem    the problem instance
     * @param assignment the assignment being branched
     * @param variable   the variable chosen by {@link #selectVariable(Problem, Assignment)}
     * @return the decision, whose partition must be exhaustive and non-overlapping
     */
    default BranchingDecision branch(Problem problem, Assignment assignment, int variable) {
        return BranchingDecision.enumerate(assignment, variable);
    }
}
