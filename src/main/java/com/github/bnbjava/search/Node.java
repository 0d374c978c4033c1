package com.github.bnbjava.search;

import com.github.bnbjava.model.Assignment;

/**
 * A search node. The bound is computed once, when the node is created, and never changes.
 *
 * @param id         index in the {@link NodeArena}
 * @param parent     arena index of the parent, or -1 for the root
 * @param depth      number of branching decisions from the root
 * @param bound      admissible bound of the assignment
 * @param assignment the partial assignment
 */
record Node(int id, int parent, int depth, double bound, Assignment assignment) {
}
