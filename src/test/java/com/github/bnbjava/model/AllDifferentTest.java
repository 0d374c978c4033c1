package com.github.bnbjava.model;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

class AllDifferentTest {
    @Test
    void identity() {
        assertArrayEquals(new int[]{0, 1, 2}, AllDifferent.identity(3));
        assertArrayEquals(new int[0], AllDifferent.identity(0));
    }

    @Test
    void consistency() {
        var root = Assignment.of(AllDifferent.identity(3), AllDifferent.identity(3), AllDifferent.identity(3));

        assertTrue(AllDifferent.isConsistent(root));
        assertTrue(AllDifferent.isConsistent(root.restrict(0, new int[]{1})));
        assertFalse(AllDifferent.isConsistent(root.restrict(0, new int[]{1}).restrict(2, new int[]{1})));
        assertNull(AllDifferent.used(Assignment.complete(0, 0, 1)));
    }

    @Test
    void undecidedVariableWithoutFreeValue() {
        var assignment = Assignment.of(new int[]{0}, new int[]{1}, new int[]{0, 1});

        assertFalse(AllDifferent.isConsistent(assignment));
    }
}
