package com.github.bnbjava.search;

import com.github.bnbjava.branch.BranchingDecision;
import com.github.bnbjava.model.Assignment;

import java.util.ArrayList;
import java.util.List;
import java.util.function.Supplier;

import static com.github.bnbjava.search.NodeArena.NONE;

/**
 * Processes one node at a time: the BOUND, PRUNE, ACCEPT and BRANCH steps of the search. Stateless, so one instance
 * may be shared by any number of threads.
 */
final class Worker {
    /**
     * Where an evaluation happens, for diagnostics: a queued node (<code>variable == NONE</code>), or a child of the
     * queued node <code>parentId</code> created by branching on <code>variable</code>.
     */
    private record Location(int depth, Assignment assignment, int parentId, int variable) {
        static final Location ROOT_PARENT = new Location(-1, null, NONE, NONE);

        static Location of(Node node) {
            return new Location(node.depth(), node.assignment(), node.id(), NONE);
        }

        Location child(Assignment child, int variable) {
            return new Location(depth + 1, child, parentId, variable);
        }

        List<Integer> path(NodeArena arena) {
            var path = new ArrayList<>(arena.path(parentId));
            if (variable != NONE) {
                path.add(variable);
            }
            return path;
        }
    }

    void process(Job job, Node node) {
        var incumbent = job.getIncumbent();

        // double-check the node's bound before we go any further; the incumbent may have improved since it was queued.
        if (job.isPruning() && !incumbent.isImprovedBy(node.bound())) {
            job.countPruned();
            return; // fathom the node.
        }

        var problem = job.getProblem();
        var assignment = node.assignment();
        var here = Location.of(node);

        if (guard(job, here, () -> problem.isComplete(assignment))) {
            double objective = guard(job, here, () -> problem.objective(assignment));

            if (!Double.isFinite(objective)) {
                throw new InvalidBoundException("objective " + objective + " is not finite", here.depth(),
                        assignment, here.path(job.getArena()));
            }
            job.reportSolution(assignment, objective);
            return;
        }

        var strategy = job.getBranchingStrategy();
        // strategies are pluggable: check the partition against this node's domain before applying it.
        BranchingDecision decision = guard(job, here, () -> {
            var d = strategy.branch(problem, assignment, strategy.selectVariable(problem, assignment));
            return BranchingDecision.of(assignment, d.variable(), d.partition());
        });
        List<Assignment> children = guard(job, here, () -> decision.children(assignment));

        job.countExpanded();

        var queued = new ArrayList<Node>(children.size());

        for (var child : children) {
            var there = here.child(child, decision.variable());

            if (!isFeasible(job, there)) {
                job.countInfeasible();
                continue;
            }
            var bound = bound(job, there);

            if (bound == job.getSense().worst()) {
                job.countInfeasible();
            } else if (job.isPruning() && !incumbent.isImprovedBy(bound)) {
                job.countPruned();
            } else {
                var id = job.getArena().add(node.id(), decision.variable());
                queued.add(new Node(id, node.id(), there.depth(), bound, child));
            }
        }

        // queue siblings together, in the order the decision lists them.
        if (!queued.isEmpty()) {
            job.queueNodes(queued);
        }
    }

    boolean isRootFeasible(Job job, Assignment root) {
        return isFeasible(job, Location.ROOT_PARENT.child(root, NONE));
    }

    double rootBound(Job job, Assignment root) {
        return bound(job, Location.ROOT_PARENT.child(root, NONE));
    }

    private static boolean isFeasible(Job job, Location location) {
        return guard(job, location, () -> job.getProblem().isFeasible(location.assignment()));
    }

    /**
     * @throws InvalidBoundException if the bound is NaN or infinite in the better direction
     */
    private static double bound(Job job, Location location) {
        double bound = guard(job, location, () ->
                job.getBoundOracle().bound(job.getProblem(), location.assignment()));

        if (Double.isNaN(bound) || bound == job.getSense().best()) {
            throw new InvalidBoundException("bound oracle returned " + bound, location.depth(),
                    location.assignment(), location.path(job.getArena()));
        }
        return bound;
    }

    /**
     * Run a step of the evaluation, wrapping any failure in a {@link SearchException} which identifies the node.
     */
    private static <T> T guard(Job job, Location location, Supplier<T> step) {
        try {
            return step.get();
        } catch (SearchException e) {
            throw e;
        } catch (RuntimeException e) {
            throw new SearchException("evaluation failed: " + e, location.depth(), location.assignment(),
                    location.path(job.getArena()), e);
        }
    }
}
