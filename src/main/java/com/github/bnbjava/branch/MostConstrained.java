package com.github.bnbjava.branch;

import com.github.bnbjava.model.Assignment;
import com.github.bnbjava.model.Problem;

/**
 * Branch on the undecided variable with the fewest remaining values (the "fail-first" rule.) Ties go to the variable
 * declared first, so the choice is deterministic.
 */
public class MostConstrained implements BranchingStrategy {
    /**
     * Default constructor.
     */
    public MostConstrained() {
    }

    @Override
    public int selectVariable(Problem problem, Assignment assignment) {
        var best = -1;

        for (var v = 0; v < assignment.size(); v++) {
            var size = assignment.domainSize(v);

            if (size > 1 && (best < 0 || size < assignment.domainSize(best))) {
                best = v;
            }
        }
        if (best < 0) {
            throw new IllegalStateException("no undecided variable in " + assignment);
        }
        return best;
    }
}
