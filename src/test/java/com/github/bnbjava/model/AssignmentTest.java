package com.github.bnbjava.model;

import com.github.bnbjava.knapsack.KnapsackProblem;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class AssignmentTest {
    @Test
    void rootHasFullDomains() {
        var root = Assignment.root(new KnapsackProblem(new double[]{2, 3}, new double[]{3, 4}, 5));

        assertEquals(2, root.size());
        assertEquals(0, root.decidedCount());
        assertFalse(root.isComplete());
        assertArrayEquals(new int[]{1, 0}, root.domain(0));
        assertEquals(0, root.min(1));
        assertEquals(1, root.max(1));
    }

    @Test
    void restrictNarrowsOneVariable() {
        var root = Assignment.of(new int[]{0, 1, 2}, new int[]{5, 6});
        var child = root.restrict(0, new int[]{2});

        assertTrue(child.isDecided(0));
        assertEquals(2, child.value(0));
        assertEquals(1, child.decidedCount());
        assertArrayEquals(new int[]{5, 6}, child.domain(1));
        // the parent is unchanged.
        assertEquals(3, root.domainSize(0));
        assertEquals(0, root.decidedCount());

        var complete = child.restrict(1, new int[]{6});
        assertTrue(complete.isComplete());
        assertArrayEquals(new int[]{2, 6}, complete.values());
        assertEquals(Assignment.complete(2, 6), complete);
        assertEquals(Assignment.complete(2, 6).hashCode(), complete.hashCode());
    }

    @Test
    void restrictRejectsValuesOutsideTheDomain() {
        var root = Assignment.of(new int[]{0, 1, 2});

        assertThrows(IllegalArgumentException.class, () -> root.restrict(0, new int[]{3}));
        assertThrows(IllegalArgumentException.class, () -> root.restrict(0, new int[]{1, 1}));
    }

    @Test
    void valueOfUndecidedVariableFails() {
        var assignment = Assignment.of(new int[]{0, 1}, new int[]{4});

        assertThrows(IllegalStateException.class, () -> assignment.value(0));
        assertThrows(IllegalStateException.class, assignment::values);
        assertEquals(4, assignment.value(1));
    }

    @Test
    void emptyDomain() {
        var assignment = Assignment.of(new int[]{0, 1}, new int[0]);

        assertTrue(assignment.hasEmptyDomain());
        assertFalse(assignment.isComplete());
    }

    @Test
    void rootRejectsDuplicateValues() {
        var problem = new Problem() {
            @Override
            public int size() {
                return 1;
            }

            @Override
            public int[] domain(int variable) {
                return new int[]{1, 1};
            }

            @Override
            public Sense sense() {
                return Sense.MINIMIZE;
            }

            @Override
            public boolean isFeasible(Assignment assignment) {
                return true;
            }

            @Override
            public double objective(Assignment assignment) {
                return assignment.value(0);
            }
        };

        assertThrows(InvalidInputException.class, () -> Assignment.root(problem));
    }

    @Test
    void formatsDecidedAndOpenVariables() {
        assertEquals("[0=1, 1=[0, 1]]", Assignment.of(new int[]{1}, new int[]{0, 1}).toString());
        assertNotEquals(Assignment.of(new int[]{0, 1}), Assignment.of(new int[]{1, 0}));
    }
}
