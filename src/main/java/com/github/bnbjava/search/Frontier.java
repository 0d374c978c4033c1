package com.github.bnbjava.search;

import com.github.bnbjava.model.Sense;

import java.util.ArrayDeque;
import java.util.Collections;
import java.util.Comparator;
import java.util.List;
import java.util.PriorityQueue;
import java.util.Queue;

/**
 * The open nodes. Either a priority queue ordered by bound ({@link SearchOrder#BEST_BOUND_FIRST}) or a LIFO queue
 * ({@link SearchOrder#DEPTH_FIRST}); the policy is fixed on construction.
 * <p>
 * Not thread-safe: the owning {@link Job} guards it.
 */
final class Frontier {
    private final Queue<Node> queue;
    private final Sense sense;
    private final boolean lifo;
    private int peakSize;

    Frontier(SearchOrder order, Sense sense) {
        this.sense = sense;
        this.lifo = order == SearchOrder.DEPTH_FIRST;
        this.queue = lifo ? Collections.asLifoQueue(new ArrayDeque<>()) : new PriorityQueue<>(bestBoundFirst(sense));
    }

    /**
     * Best bound first; on equal bounds, prefer the deeper node, since it is closer to a complete solution; then the
     * node created first.
     */
    static Comparator<Node> bestBoundFirst(Sense sense) {
        return (a, b) -> {
            var v = sense.compare(a.bound(), b.bound());
            if (v != 0) {
                return v;
            }
            v = Integer.compare(b.depth(), a.depth());
            return v != 0 ? v : Integer.compare(a.id(), b.id());
        };
    }

    void insert(Node node) {
        queue.add(node);
        peakSize = Math.max(peakSize, queue.size());
    }

    /**
     * Insert sibling nodes so that, in depth-first mode, the first one is explored first.
     */
    void insertAll(List<Node> nodes) {
        if (lifo) {
            for (var i = nodes.size() - 1; i >= 0; i--) {
                insert(nodes.get(i));
            }
        } else {
            nodes.forEach(this::insert);
        }
    }

    Node extractBest() {
        return queue.remove();
    }

    boolean isEmpty() {
        return queue.isEmpty();
    }

    int size() {
        return queue.size();
    }

    int peakSize() {
        return peakSize;
    }

    /**
     * @return the most promising bound among the open nodes, or {@link Sense#worst()} if there are none
     */
    double bestBound() {
        if (!lifo) {
            var peek = queue.peek();
            return peek == null ? sense.worst() : peek.bound();
        }
        return queue.stream().mapToDouble(Node::bound).reduce(sense.worst(),
                (a, b) -> sense.isBetter(b, a) ? b : a);
    }

    void clear() {
        queue.clear();
    }
}
