package com.github.bnbjava.search;

import java.util.Arrays;

/**
 * The order in which the frontier hands out nodes.
 */
public enum SearchOrder {
    /**
     * Most promising bound first; ties go to the deeper node. Expands the fewest nodes for a given bound oracle.
     */
    BEST_BOUND_FIRST("best_bound_first"),
    /**
     * Most recently inserted node first. Finds feasible solutions quickly and keeps the frontier small.
     */
    DEPTH_FIRST("depth_first");

    private final String option;

    SearchOrder(String option) {
        this.option = option;
    }

    /**
     * @return the configuration name of this order
     */
    public String option() {
        return option;
    }

    /**
     * @param option a configuration name, such as <code>depth_first</code>
     * @return the matching order
     * @throws IllegalArgumentException if the name is not recognized
     */
    public static SearchOrder parse(String option) {
        return Arrays.stream(values())
                .filter(order -> order.option.equalsIgnoreCase(option.trim()))
                .findFirst()
                .orElseThrow(() -> new IllegalArgumentException("unknown search order: " + option));
    }
}
