package com.github.bnbjava.bound;

import com.github.bnbjava.model.Assignment;
import com.github.bnbjava.model.Problem;

/**
 * <p>
 * Computes an admissible bound for a partial assignment: for every complete, feasible extension of the assignment,
 * the objective is no better than the bound (no lower when minimizing, no higher when maximizing.)
 * </p><p>
 * A tighter bound prunes more nodes without affecting correctness. Returning {@link
 * com.github.bnbjava.model.Sense#worst()} declares that the assignment has no feasible completion. NaN, or infinity in
 * the better direction, is rejected by the search as a numeric error.
 * </p><p>
 * Implementations must be thread-safe; the parallel search calls them concurrently.
 * </p>
 */
@FunctionalInterface
public interface BoundOracle {
    /**
     * @param problem    the problem instance
     * @param assignment a feasible (partial) assignment of that problem
     * @return the bound
     */
    double bound(Problem problem, Assignment assignment);
}
