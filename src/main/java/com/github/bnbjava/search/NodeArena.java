package com.github.bnbjava.search;

import com.google.errorprone.annotations.concurrent.GuardedBy;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;

/**
 * Records the shape of the search tree as parent links addressed by index, rather than references between nodes.
 * For every queued node it keeps the parent's index and the variable branched on to create it, which is enough to
 * reconstruct the path from the root for diagnostics.
 */
final class NodeArena {
    static final int NONE = -1;

    @GuardedBy("this")
    private int[] parents = new int[256];
    @GuardedBy("this")
    private int[] variables = new int[256];
    @GuardedBy("this")
    private int size;

    /**
     * @param parent   index of the parent, or {@link #NONE} for the root
     * @param variable the variable branched on, or {@link #NONE} for the root
     * @return the index of the new node
     */
    synchronized int add(int parent, int variable) {
        if (size == parents.length) {
            parents = Arrays.copyOf(parents, size * 2);
            variables = Arrays.copyOf(variables, size * 2);
        }
        parents[size] = parent;
        variables[size] = variable;
        return size++;
    }

    synchronized int size() {
        return size;
    }

    /**
     * @param id a node index, or {@link #NONE}
     * @return the variables branched on from the root down to the node
     */
    synchronized List<Integer> path(int id) {
        var path = new ArrayList<Integer>();

        for (var i = id; i != NONE && parents[i] != NONE; i = parents[i]) {
            path.add(variables[i]);
        }
        Collections.reverse(path);
        return path;
    }
}
