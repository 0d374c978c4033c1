package com.github.bnbjava.search;

import com.github.bnbjava.model.Assignment;
import com.github.bnbjava.model.Sense;

import java.util.function.Consumer;

/**
 * The best complete, feasible solution found so far.
 * <p>
 * Updates go through the single synchronized {@link #tryUpdate(Assignment, double)}, so two workers racing to report
 * improving solutions are serialized and only a strict improvement wins. Readers see an immutable {@link Solution}
 * through a volatile reference, never a half-written value.
 */
final class Incumbent {
    private final Sense sense;
    private final Consumer<Solution> listener;
    private volatile Solution solution;

    /**
     * @param sense    the optimisation sense
     * @param listener notified of every improvement, in order, while the update lock is held; may be null
     */
    Incumbent(Sense sense, Consumer<Solution> listener) {
        this.sense = sense;
        this.listener = listener;
    }

    /**
     * Replace the incumbent if <code>objective</code> is strictly better, or if there is no incumbent yet.
     *
     * @return true if the incumbent was replaced
     */
    synchronized boolean tryUpdate(Assignment assignment, double objective) {
        var current = solution;

        if (current != null && !sense.isBetter(objective, current.objective())) {
            return false;
        }
        solution = new Solution(assignment, objective);
        if (listener != null) {
            listener.accept(solution);
        }
        return true;
    }

    /**
     * @return the current incumbent, or null if none was found yet
     */
    Solution get() {
        return solution;
    }

    /**
     * The PRUNE test: a node can only lead to a better solution if its bound is strictly better than the incumbent.
     *
     * @param bound a node bound
     * @return true if there is no incumbent, or the bound is strictly better
     */
    boolean isImprovedBy(double bound) {
        var current = solution;
        return current == null || sense.isBetter(bound, current.objective());
    }
}
