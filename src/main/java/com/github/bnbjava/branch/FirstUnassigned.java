package com.github.bnbjava.branch;

import com.github.bnbjava.model.Assignment;
import com.github.bnbjava.model.Problem;

/**
 * Branch on the undecided variable with the lowest index.
 */
public class FirstUnassigned implements BranchingStrategy {
    /**
     * Default constructor.
     */
    public FirstUnassigned() {
    }

    @Override
    public int selectVariable(Problem problem, Assignment assignment) {
        for (var v = 0; v < assignment.size(); v++) {
            if (!assignment.isDecided(v)) {
                return v;
            }
        }
        throw new IllegalStateException("no undecided variable in " + assignment);
    }
}
