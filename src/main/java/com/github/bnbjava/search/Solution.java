package com.github.bnbjava.search;

import com.github.bnbjava.model.Assignment;

/**
 * A complete, feasible assignment and its objective value.
 *
 * @param assignment the complete assignment
 * @param objective  its objective value
 */
public record Solution(Assignment assignment, double objective) {
}
