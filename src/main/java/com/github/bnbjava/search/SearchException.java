package com.github.bnbjava.search;

import com.github.bnbjava.model.Assignment;

import java.util.List;

/**
 * Aborts a search when evaluating a node fails. Identifies the node, so that the failure can be reproduced.
 */
public class SearchException extends RuntimeException {
    private final int depth;
    private final transient Assignment assignment;
    private final List<Integer> branchingPath;

    /**
     * Constructor.
     *
     * @param message       what failed
     * @param depth         depth of the offending node
     * @param assignment    assignment of the offending node
     * @param branchingPath variables branched on from the root to the offending node
     * @param cause         the underlying exception, or null
     */
    public SearchException(String message, int depth, Assignment assignment, List<Integer> branchingPath,
                           Throwable cause) {
        super(message + " (depth " + depth + ", path " + branchingPath + ", assignment " + assignment + ")", cause);
        this.depth = depth;
        this.assignment = assignment;
        this.branchingPath = List.copyOf(branchingPath);
    }

    /**
     * @return depth of the offending node
     */
    public int getDepth() {
        return depth;
    }

    /**
     * @return assignment of the offending node
     */
    public Assignment getAssignment() {
        return assignment;
    }

    /**
     * @return variables branched on from the root to the offending node
     */
    public List<Integer> getBranchingPath() {
        return branchingPath;
    }
}
