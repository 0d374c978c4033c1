package com.github.bnbjava;

import org.junit.jupiter.api.Test;

import java.math.BigDecimal;

import static com.github.bnbjava.model.Sense.MAXIMIZE;
import static com.github.bnbjava.model.Sense.MINIMIZE;
import static org.junit.jupiter.api.Assertions.assertEquals;

class UtilTest {
    @Test
    void maxScale() {
        assertEquals(0, Util.maxScale());
        assertEquals(0, Util.maxScale(3, 40, 500));
        assertEquals(2, Util.maxScale(1.0, 2.5, 0.25));
        assertEquals(-1, Util.maxScale(1.0, Double.NaN));
        assertEquals(-1, Util.maxScale(Double.POSITIVE_INFINITY));
        // not a short decimal
        assertEquals(-1, Util.maxScale(0.1 + 0.2));
    }

    @Test
    void roundBound() {
        // rounded towards the worse side
        assertEquals(7.0, Util.roundBound(7.5, 0, MAXIMIZE));
        assertEquals(4.0, Util.roundBound(3.2, 0, MINIMIZE));
        assertEquals(3.3, Util.roundBound(3.25, 1, MINIMIZE));

        // floating-point noise never costs a whole unit
        assertEquals(7.0, Util.roundBound(7.0, 0, MAXIMIZE));
        assertEquals(7.0, Util.roundBound(6.9999999999, 0, MAXIMIZE));
        assertEquals(3.0, Util.roundBound(3.0000000001, 0, MINIMIZE));

        // no rounding scale: loosened only
        assertEquals(2.0 - 2e-7, Util.roundBound(2.0, -1, MINIMIZE), 1e-12);
        assertEquals(Double.POSITIVE_INFINITY, Util.roundBound(Double.POSITIVE_INFINITY, 0, MINIMIZE));
    }

    @Test
    void toSeconds() {
        assertEquals(new BigDecimal("1.500"), Util.toSeconds(1500L));
        assertEquals(new BigDecimal("0.007"), Util.toSeconds(7L));
    }
}
