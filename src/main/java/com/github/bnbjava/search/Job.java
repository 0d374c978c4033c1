package com.github.bnbjava.search;

import com.github.bnbjava.bound.BoundOracle;
import com.github.bnbjava.branch.BranchingStrategy;
import com.github.bnbjava.model.Assignment;
import com.github.bnbjava.model.Problem;
import com.github.bnbjava.model.Sense;
import com.github.bnbjava.search.BranchAndBoundSolver.Result;
import com.google.errorprone.annotations.concurrent.GuardedBy;

import java.math.BigDecimal;
import java.time.Duration;
import java.util.List;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;

import static com.github.bnbjava.Util.toSeconds;
import static com.github.bnbjava.search.NodeArena.NONE;

/**
 * A single search. Owns the frontier, the incumbent and the counters, and functions as the coordination point for
 * worker threads when the search runs on a {@link Scheduler}.
 */
class Job {
    private final BranchAndBoundSolver solver;
    private final Problem problem;
    private final BoundOracle boundOracle;
    private final BranchingStrategy branchingStrategy;
    private final boolean pruning;
    private final long nodeLimit;
    private final long start;
    // longer limits would overflow the nanosecond deadline; this one is about 146 years.
    private static final Duration MAX_TIME_LIMIT = Duration.ofNanos(Long.MAX_VALUE / 2);

    private final long deadline;
    private final boolean timeLimited;
    private final Incumbent incumbent;
    private final NodeArena arena = new NodeArena();
    private final Worker worker = new Worker();

    @GuardedBy("this")
    private final Frontier frontier;
    @GuardedBy("this")
    private boolean done;
    private volatile boolean cancelled;
    private volatile Throwable failure;
    private volatile Scheduler scheduler;

    private final AtomicInteger nodesInFlight = new AtomicInteger();
    private final AtomicLong totalTime = new AtomicLong();
    private final AtomicLong selected = new AtomicLong();
    private final AtomicLong expanded = new AtomicLong();
    private final AtomicLong pruned = new AtomicLong();
    private final AtomicLong infeasible = new AtomicLong();
    private final AtomicLong solutions = new AtomicLong();

    Job(BranchAndBoundSolver solver, Problem problem) {
        this.start = System.nanoTime();
        this.solver = solver;
        this.problem = problem;
        this.boundOracle = solver.getBoundOracle();
        this.branchingStrategy = solver.getBranchingStrategy();
        this.pruning = solver.isPruning();
        this.nodeLimit = solver.getNodeLimit();
        this.timeLimited = solver.getTimeLimit() != null;
        this.deadline = timeLimited ? start + min(solver.getTimeLimit(), MAX_TIME_LIMIT).toNanos() : 0L;
        this.incumbent = new Incumbent(problem.sense(), solver.getListener());
        this.frontier = new Frontier(solver.getSearchOrder(), problem.sense());
    }

    Result run() {
        var root = Assignment.root(problem);

        if (root.hasEmptyDomain() || !worker.isRootFeasible(this, root)) {
            infeasible.incrementAndGet();
            solver.debug("Root node is infeasible.");
            return buildResult();
        }
        var rootBound = worker.rootBound(this, root);

        if (rootBound == problem.sense().worst()) {
            infeasible.incrementAndGet();
            solver.debug("Root bound " + rootBound + "; no feasible completion.");
            return buildResult();
        }
        solver.debug("Root bound " + rootBound);

        synchronized (this) {
            frontier.insert(new Node(arena.add(NONE, NONE), NONE, 0, rootBound, root));
        }

        if (solver.getWorkerCount() <= 1) {
            for (Node node; (node = nextNode()) != null; ) {
                try {
                    worker.process(this, node);
                } finally {
                    nodesInFlight.decrementAndGet();
                }
            }
        } else {
            awaitWorkers(solver.getScheduler());
        }

        var f = failure;
        if (f instanceof Error e) {
            throw e;
        }
        if (f != null) {
            throw (RuntimeException) f;
        }
        return buildResult();
    }

    private void awaitWorkers(Scheduler scheduler) {
        var interrupted = false;

        this.scheduler = scheduler;
        scheduler.register(this);
        try {
            synchronized (this) {
                while (!done) {
                    try {
                        if (timeLimited && !cancelled) {
                            var remaining = TimeUnit.NANOSECONDS.toMillis(deadline - System.nanoTime());

                            if (remaining <= 0L) {
                                cancel();
                                continue;
                            }
                            wait(remaining);
                        } else {
                            // once cancelled, the last worker in flight wakes us.
                            wait();
                        }
                    } catch (InterruptedException e) {
                        interrupted = true;
                        cancel();
                    }
                }
            }
        } finally {
            scheduler.deregister(this);
            if (interrupted) {
                Thread.currentThread().interrupt();
            }
        }
    }

    /**
     * The SELECT step: check the limits, then take the next node from the frontier.
     *
     * @return the node, or null if the search is finished or cancelled
     */
    synchronized Node nextNode() {
        if (!hasWork()) {
            return null;
        }
        nodesInFlight.incrementAndGet();
        selected.incrementAndGet();
        return frontier.extractBest();
    }

    /**
     * @return true if the frontier has a node to hand out and no limit has been reached. Cancels the job if a limit
     * has been reached.
     */
    synchronized boolean hasWork() {
        if (cancelled || frontier.isEmpty()) {
            return false;
        }
        if (selected.get() >= nodeLimit || timeLimited && System.nanoTime() - deadline >= 0L) {
            solver.debug("[" + elapsedSeconds() + "s]: Limit reached after " + selected.get() + " nodes, " +
                    frontier.size() + " open.");
            cancel();
            return false;
        }
        return true;
    }

    /**
     * Queue the children of a node, waking idle worker threads if the job runs on a {@link Scheduler}.
     */
    void queueNodes(List<Node> nodes) {
        var s = scheduler;

        if (s == null) {
            insertNodes(nodes);
        } else {
            s.queueNodes(this, nodes);
        }
    }

    synchronized void insertNodes(List<Node> nodes) {
        frontier.insertAll(nodes);
    }

    /**
     * The ACCEPT step: offer a complete, feasible solution to the incumbent.
     */
    void reportSolution(Assignment assignment, double objective) {
        solutions.incrementAndGet();

        if (incumbent.tryUpdate(assignment, objective)) {
            double open;

            synchronized (this) {
                open = frontier.bestBound();
            }
            solver.debug("[" + elapsedSeconds() + "s]: New solution " + objective + ". Best open bound " + open +
                    "; " + selected.get() + " nodes.");
        }
    }

    /**
     * Stop handing out nodes. Nodes already in flight are completed normally.
     */
    synchronized void cancel() {
        cancelled = true;
        if (nodesInFlight.get() <= 0) {
            setDone();
        }
    }

    /**
     * Record the first failure raised by a worker, and cancel the job.
     */
    void fail(Throwable t) {
        synchronized (this) {
            if (failure == null) {
                failure = t;
            }
        }
        cancel();
    }

    @GuardedBy("this")
    private void setDone() {
        done = true;
        notifyAll();
    }

    /**
     * Called after each node is processed by a worker thread, to record the runtime for scheduling fairness.
     * <p>
     * Also decrements the counter of nodes in flight, and if there is nothing left to do, handles the completion
     * logic.
     */
    void nodeComplete(long elapsedTime) {
        totalTime.getAndAdd(elapsedTime);
        if (nodesInFlight.decrementAndGet() <= 0) {
            synchronized (this) {
                if (nodesInFlight.get() <= 0 && (cancelled || frontier.isEmpty())) {
                    setDone();
                }
            }
        }
    }

    private Result buildResult() {
        var sense = problem.sense();
        var best = incumbent.get();
        Result.State state;
        double bestBound;
        int peak;

        synchronized (this) {
            peak = frontier.peakSize();

            if (!frontier.isEmpty()) {
                state = Result.State.UNPROVEN;
                var open = frontier.bestBound();
                bestBound = best == null || sense.isBetter(open, best.objective()) ? open : best.objective();
                frontier.clear();
            } else if (best != null) {
                state = Result.State.OPTIMAL;
                bestBound = best.objective();
            } else {
                state = Result.State.INFEASIBLE;
                bestBound = sense.worst();
            }
        }

        var statistics = new Result.Statistics(selected.get(), expanded.get(), pruned.get(), infeasible.get(),
                solutions.get(), peak, TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - start));
        solver.debug("[" + elapsedSeconds() + "s]: " + state + " " + (best == null ? null : best.objective()) +
                ", bound " + bestBound + "; " + statistics + ", " + arena.size() + " nodes created");

        return new Result(state, best, bestBound, statistics);
    }

    private static Duration min(Duration a, Duration b) {
        return a.compareTo(b) <= 0 ? a : b;
    }

    private BigDecimal elapsedSeconds() {
        return toSeconds(TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - start));
    }

    Problem getProblem() {
        return problem;
    }

    BoundOracle getBoundOracle() {
        return boundOracle;
    }

    BranchingStrategy getBranchingStrategy() {
        return branchingStrategy;
    }

    Sense getSense() {
        return problem.sense();
    }

    Incumbent getIncumbent() {
        return incumbent;
    }

    NodeArena getArena() {
        return arena;
    }

    Worker getWorker() {
        return worker;
    }

    boolean isPruning() {
        return pruning;
    }

    void countExpanded() {
        expanded.incrementAndGet();
    }

    void countPruned() {
        pruned.incrementAndGet();
    }

    void countInfeasible() {
        infeasible.incrementAndGet();
    }

    long totalTime() {
        return totalTime.get();
    }

    void resetTime() {
        totalTime.set(0);
    }
}
