package com.github.bnbjava;

import com.github.bnbjava.model.Sense;
import org.ojalgo.optimisation.ExpressionsBasedModel;
import org.ojalgo.optimisation.Optimisation;
import org.ojalgo.type.context.NumberContext;

import java.math.BigDecimal;
import java.math.RoundingMode;

import static com.github.bnbjava.model.Sense.MINIMIZE;

/**
 * Miscellaneous utilities.
 */
public class Util {
    private Util() {
    }

    /**
     * Scales above this are treated as "not a short decimal", and bounds are not rounded.
     */
    static final int MAX_ROUNDING_SCALE = 9;

    /**
     * Relative tolerance used to loosen a floating-point bound before rounding it.
     */
    static final double BOUND_TOLERANCE = 1e-7;

    /**
     * Find the largest number of decimal places among the given values. If all objective coefficients (and the
     * constant) have at most this many decimals, then every objective value over integer variables is a multiple of
     * <code>10^-scale</code>, and bounds may be rounded to that precision.
     *
     * @param values objective coefficients and constants
     * @return the largest scale (at least zero), or -1 if some value is not a short, finite decimal
     */
    public static int maxScale(double... values) {
        var max = 0;

        for (var value : values) {
            if (!Double.isFinite(value)) {
                return -1;
            }
            var scale = BigDecimal.valueOf(value).stripTrailingZeros().scale();
            if (scale > MAX_ROUNDING_SCALE) {
                return -1;
            }
            max = Math.max(max, scale);
        }
        return max;
    }

    /**
     * Tighten a bound computed in floating point. The bound is first loosened by a small relative tolerance, so that
     * solver noise can never make it inadmissible, and then rounded towards the worse direction of <code>sense</code>
     * to <code>scale</code> decimals (ceiling when minimizing, floor when maximizing.) Infinite values are returned
     * unchanged.
     *
     * @param bound a bound from a continuous relaxation
     * @param scale see {@link #maxScale(double...)}; a negative value skips the rounding
     * @param sense the optimisation sense
     * @return the adjusted bound
     */
    public static double roundBound(double bound, int scale, Sense sense) {
        if (!Double.isFinite(bound)) {
            return bound;
        }
        var slack = BOUND_TOLERANCE * Math.max(1.0, Math.abs(bound));
        var loosened = sense == MINIMIZE ? bound - slack : bound + slack;

        if (scale < 0) {
            return loosened;
        }
        return BigDecimal.valueOf(loosened)
                .setScale(scale, sense == MINIMIZE ? RoundingMode.CEILING : RoundingMode.FLOOR)
                .doubleValue();
    }

    /**
     * Helper to build a new {@link ExpressionsBasedModel} for ojAlgo, with the rounding options used for relaxations.
     *
     * @return the built model
     */
    public static ExpressionsBasedModel newModel() {
        var options = new Optimisation.Options();
        options.solution = NumberContext.of(14, 9);
        return new ExpressionsBasedModel(options);
    }

    /**
     * Format milliseconds as seconds for log messages.
     *
     * @param millis elapsed milliseconds
     * @return seconds, with three decimals
     */
    public static BigDecimal toSeconds(long millis) {
        return BigDecimal.valueOf(millis).divide(BigDecimal.valueOf(1000L), 3, RoundingMode.HALF_EVEN);
    }
}
