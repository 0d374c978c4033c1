package com.github.bnbjava.search;

import com.github.bnbjava.bound.BoundOracle;
import com.github.bnbjava.branch.BranchingStrategy;
import com.github.bnbjava.branch.FirstUnassigned;
import com.github.bnbjava.branch.MostConstrained;
import com.github.bnbjava.model.InvalidInputException;
import com.github.bnbjava.model.LinearProblem;
import com.github.bnbjava.model.Problem;
import com.google.errorprone.annotations.concurrent.GuardedBy;
import org.ojalgo.netio.BasicLogger;

import java.time.Duration;
import java.time.format.DateTimeParseException;
import java.util.Properties;
import java.util.function.Consumer;

/**
 * <p>
 * Exact branch-and-bound solver for discrete optimisation problems.
 * </p><p>
 * The solver repeatedly takes the most promising open node from the frontier, discards it if its bound cannot beat
 * the incumbent, records it as the new incumbent if it is a complete solution, and otherwise branches on it, queueing
 * the children whose bounds can still beat the incumbent. When the frontier runs empty the incumbent is optimal. A node
 * limit or time limit stops the search early with an {@link Result.State#UNPROVEN} result and the optimality gap.
 * </p><p>
 * The {@link BoundOracle} is injected on construction; everything else is configured through setters or
 * {@link #configure(Properties)} before calling {@link #solve(Problem)}. With a worker count above one, nodes are
 * expanded by a pool of threads which is owned by this solver, so close it when done.
 * </p>
 *
 * @see com.github.bnbjava.bound.LinearRelaxationBound
 * @see com.github.bnbjava.bound.SlackBound
 */
public class BranchAndBoundSolver implements AutoCloseable {
    /**
     * Use as a node limit to disable it.
     */
    public static final long UNBOUNDED = Long.MAX_VALUE;

    private final BoundOracle boundOracle;
    private BranchingStrategy branchingStrategy = new FirstUnassigned();
    private SearchOrder searchOrder = SearchOrder.BEST_BOUND_FIRST;
    private long nodeLimit = UNBOUNDED;
    private Duration timeLimit;
    private int workerCount = 1;
    private boolean pruning = true;
    private boolean debug;
    private Consumer<Solution> listener;

    @GuardedBy("this")
    private Scheduler scheduler;

    /**
     * Constructor.
     *
     * @param boundOracle computes admissible bounds for the problems this solver will be given
     */
    public BranchAndBoundSolver(BoundOracle boundOracle) {
        this.boundOracle = boundOracle;
    }

    /**
     * Result of a search.
     *
     * @param state      {@link State#OPTIMAL}, {@link State#INFEASIBLE} or {@link State#UNPROVEN}
     * @param incumbent  the best solution found, or null if there is none
     * @param bestBound  the best bound on the optimum still open at termination: equal to the incumbent's objective
     *                   when optimal, and {@link com.github.bnbjava.model.Sense#worst()} when infeasible
     * @param statistics search counters
     */
    public record Result(State state, Solution incumbent, double bestBound, Statistics statistics) {
        /**
         * @return the incumbent's objective, or NaN if there is no incumbent
         */
        public double objective() {
            return incumbent == null ? Double.NaN : incumbent.objective();
        }

        /**
         * The optimality gap: the distance between the incumbent and the best open bound.
         *
         * @return zero when optimal, positive infinity when there is no incumbent
         */
        public double gap() {
            if (incumbent == null) {
                return Double.POSITIVE_INFINITY;
            }
            return Math.abs(incumbent.objective() - bestBound);
        }

        /**
         * Status of a search.
         */
        public enum State {
            /**
             * The frontier was exhausted; the incumbent is a proven optimum.
             */
            OPTIMAL,
            /**
             * The frontier was exhausted, or the root rejected, without finding any feasible solution.
             */
            INFEASIBLE,
            /**
             * A node or time limit stopped the search. The incumbent (if any) is the best found, and the gap is
             * reported.
             */
            UNPROVEN
        }

        /**
         * Search counters.
         *
         * @param nodesSelected    nodes taken from the frontier
         * @param nodesExpanded    nodes branched on
         * @param nodesPruned      nodes discarded because their bound could not beat the incumbent
         * @param nodesInfeasible  nodes discarded by the feasibility test, or declared without feasible completion
         *                         by the bound oracle
         * @param solutionsFound   complete feasible nodes reached
         * @param peakFrontierSize the largest number of open nodes
         * @param elapsedMillis    wall-clock time
         */
        public record Statistics(long nodesSelected,
                                 long nodesExpanded,
                                 long nodesPruned,
                                 long nodesInfeasible,
                                 long solutionsFound,
                                 int peakFrontierSize,
                                 long elapsedMillis) {
            /**
             * @return a copy with the elapsed time zeroed, for comparing otherwise reproducible runs
             */
            public Statistics withoutTime() {
                return new Statistics(nodesSelected, nodesExpanded, nodesPruned, nodesInfeasible, solutionsFound,
                        peakFrontierSize, 0L);
            }
        }
    }

    /**
     * Solve a problem to optimality, or until a configured limit is reached.
     *
     * @param problem the problem instance, which is only read
     * @return the result; infeasibility and limits are reported through {@link Result#state()}
     * @throws InvalidInputException  if the instance is malformed
     * @throws InvalidBoundException  if the bound oracle produces an invalid bound
     * @throws SearchException        if evaluating a node fails for any other reason
     */
    public final Result solve(Problem problem) {
        if (problem == null || problem.sense() == null) {
            throw new InvalidInputException("problem and its sense must not be null.");
        }
        if (problem instanceof LinearProblem linear) {
            LinearProblem.validate(linear);
        }
        return new Job(this, problem).run();
    }

    /**
     * Apply the recognized options from a {@link Properties} object. Options that are absent keep their current
     * values. Recognized names: <code>search_order</code> (<code>best_bound_first</code>, <code>depth_first</code>),
     * <code>branching_strategy</code> (<code>first_unassigned</code>, <code>most_constrained</code>),
     * <code>node_limit</code> (positive integer or <code>unbounded</code>), <code>time_limit</code> (ISO-8601 duration,
     * milliseconds, or <code>unbounded</code>), <code>worker_count</code> (positive integer), <code>pruning</code> and
     * <code>debug</code> (booleans.)
     *
     * @param properties the options
     * @return this solver
     * @throws IllegalArgumentException if a value is not valid for its option
     */
    public BranchAndBoundSolver configure(Properties properties) {
        var value = properties.getProperty("search_order");
        if (value != null) {
            setSearchOrder(SearchOrder.parse(value));
        }
        value = properties.getProperty("branching_strategy");
        if (value != null) {
            setBranchingStrategy(parseBranchingStrategy(value));
        }
        value = properties.getProperty("node_limit");
        if (value != null) {
            setNodeLimit(isUnbounded(value) ? UNBOUNDED : parseLong("node_limit", value));
        }
        value = properties.getProperty("time_limit");
        if (value != null) {
            setTimeLimit(isUnbounded(value) ? null : parseDuration(value));
        }
        value = properties.getProperty("worker_count");
        if (value != null) {
            setWorkerCount((int) parseLong("worker_count", value));
        }
        value = properties.getProperty("pruning");
        if (value != null) {
            setPruning(parseBoolean("pruning", value));
        }
        value = properties.getProperty("debug");
        if (value != null) {
            setDebug(parseBoolean("debug", value));
        }
        return this;
    }

    private static BranchingStrategy parseBranchingStrategy(String value) {
        return switch (value.trim().toLowerCase()) {
            case "first_unassigned" -> new FirstUnassigned();
            case "most_constrained" -> new MostConstrained();
            default -> throw new IllegalArgumentException("unknown branching strategy: " + value);
        };
    }

    private static boolean isUnbounded(String value) {
        return "unbounded".equalsIgnoreCase(value.trim());
    }

    private static long parseLong(String name, String value) {
        try {
            return Long.parseLong(value.trim());
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException(name + " must be an integer: " + value, e);
        }
    }

    private static Duration parseDuration(String value) {
        var trimmed = value.trim();

        if (trimmed.chars().allMatch(Character::isDigit)) {
            return Duration.ofMillis(parseLong("time_limit", trimmed));
        }
        try {
            return Duration.parse(trimmed);
        } catch (DateTimeParseException e) {
            throw new IllegalArgumentException("time_limit must be an ISO-8601 duration or milliseconds: " + value, e);
        }
    }

    private static boolean parseBoolean(String name, String value) {
        var trimmed = value.trim();

        if ("true".equalsIgnoreCase(trimmed)) {
            return true;
        }
        if ("false".equalsIgnoreCase(trimmed)) {
            return false;
        }
        throw new IllegalArgumentException(name + " must be true or false: " + value);
    }

    void debug(String s) {
        if (debug) {
            BasicLogger.debug(s);
        }
    }

    /**
     * Get the worker pool, starting it if necessary. Only used when the worker count is above one.
     */
    synchronized Scheduler getScheduler() {
        if (scheduler == null) {
            scheduler = new Scheduler(workerCount);
        }
        return scheduler;
    }

    /**
     * Shut down the worker pool, if it was started. Searches in progress are allowed to finish.
     */
    @Override
    public void close() {
        Scheduler s;

        synchronized (this) {
            s = scheduler;
            scheduler = null;
        }
        if (s != null) {
            s.close();
        }
    }

    /**
     * @return the bound oracle given on construction
     */
    public BoundOracle getBoundOracle() {
        return boundOracle;
    }

    /**
     * @return the branching strategy
     * @see #setBranchingStrategy(BranchingStrategy)
     */
    public BranchingStrategy getBranchingStrategy() {
        return branchingStrategy;
    }

    /**
     * Set the branching strategy. The default is {@link FirstUnassigned}.
     *
     * @param branchingStrategy the strategy
     */
    public void setBranchingStrategy(BranchingStrategy branchingStrategy) {
        if (branchingStrategy == null) {
            throw new IllegalArgumentException("branchingStrategy must not be null.");
        }
        this.branchingStrategy = branchingStrategy;
    }

    /**
     * @return the search order
     */
    public SearchOrder getSearchOrder() {
        return searchOrder;
    }

    /**
     * Set the search order. The default is {@link SearchOrder#BEST_BOUND_FIRST}.
     *
     * @param searchOrder the order
     */
    public void setSearchOrder(SearchOrder searchOrder) {
        if (searchOrder == null) {
            throw new IllegalArgumentException("searchOrder must not be null.");
        }
        this.searchOrder = searchOrder;
    }

    /**
     * @return the maximum number of nodes taken from the frontier, or {@link #UNBOUNDED}
     */
    public long getNodeLimit() {
        return nodeLimit;
    }

    /**
     * Limit the number of nodes taken from the frontier. When reached, the search stops with
     * {@link Result.State#UNPROVEN}.
     *
     * @param nodeLimit a positive count, or {@link #UNBOUNDED}
     */
    public void setNodeLimit(long nodeLimit) {
        if (nodeLimit <= 0) {
            throw new IllegalArgumentException("nodeLimit must be positive.");
        }
        this.nodeLimit = nodeLimit;
    }

    /**
     * @return the wall-clock limit, or null if unbounded
     */
    public Duration getTimeLimit() {
        return timeLimit;
    }

    /**
     * Limit the wall-clock time of a search. When reached, the search stops with {@link Result.State#UNPROVEN}.
     * The limit is checked each time a node is selected, so a slow bound oracle may overrun it by one node.
     *
     * @param timeLimit a non-negative duration, or null for no limit
     */
    public void setTimeLimit(Duration timeLimit) {
        if (timeLimit != null && timeLimit.isNegative()) {
            throw new IllegalArgumentException("timeLimit must not be negative.");
        }
        this.timeLimit = timeLimit;
    }

    /**
     * @return the number of worker threads
     */
    public int getWorkerCount() {
        return workerCount;
    }

    /**
     * Set the number of worker threads. One (the default) runs the search on the calling thread, and is reproducible.
     * Changing it shuts down any pool already started.
     *
     * @param workerCount a positive count
     */
    public void setWorkerCount(int workerCount) {
        if (workerCount <= 0) {
            throw new IllegalArgumentException("workerCount must be positive.");
        }
        if (workerCount != this.workerCount) {
            close();
        }
        this.workerCount = workerCount;
    }

    /**
     * @return true if nodes are discarded when their bound cannot beat the incumbent
     */
    public boolean isPruning() {
        return pruning;
    }

    /**
     * Enable or disable pruning by bound. Disabling it never changes the optimum found, only the work done, so this is
     * only useful to verify a bound oracle. Enabled by default.
     *
     * @param pruning true to prune
     */
    public void setPruning(boolean pruning) {
        this.pruning = pruning;
    }

    /**
     * Get the debug property
     *
     * @return true if debug logging is enabled
     */
    public boolean isDebug() {
        return debug;
    }

    /**
     * Set the debug property. If enabled, logging works via ojAlgo's {@link BasicLogger} mechanism.
     *
     * @param debug true if debug logging is enabled
     */
    public void setDebug(boolean debug) {
        this.debug = debug;
    }

    /**
     * @return the incumbent listener, or null
     */
    public Consumer<Solution> getListener() {
        return listener;
    }

    /**
     * Set a listener notified of every new incumbent, in order of improvement. It is called while the incumbent is
     * locked, possibly from a worker thread, so it should return quickly.
     *
     * @param listener the listener, or null
     */
    public void setListener(Consumer<Solution> listener) {
        this.listener = listener;
    }
}
