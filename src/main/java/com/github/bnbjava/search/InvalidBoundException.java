package com.github.bnbjava.search;

import com.github.bnbjava.model.Assignment;

import java.util.List;

/**
 * A bound oracle returned NaN or an infinity in the better direction, or a problem returned a non-finite objective.
 * The search never substitutes a default value, since that could silently break admissibility.
 */
public class InvalidBoundException extends SearchException {
    /**
     * Constructor.
     *
     * @param message       the invalid value and where it came from
     * @param depth         depth of the offending node
     * @param assignment    assignment of the offending node
     * @param branchingPath variables branched on from the root to the offending node
     */
    public InvalidBoundException(String message, int depth, Assignment assignment, List<Integer> branchingPath) {
        super(message, depth, assignment, branchingPath, null);
    }
}
