package com.fvgscanner.domain.model;

import java.time.Instant;

/**
 * A bar that wicked through a prior swing level and closed back on the other side.
 *
 * @param pivot       the swing level whose resting liquidity was taken
 * @param sweepIndex  index of the sweeping bar
 * @param wickExtreme the low (for a swept LOW) or high (for a swept HIGH) of the sweep bar
 */
public record LiquiditySweep(SwingPivot pivot, int sweepIndex, Instant sweepTime, double wickExtreme) {

    /** Distance the wick travelled past the pivot level. */
    public double penetration() {
        return Math.abs(wickExtreme - pivot.price());
    }
}
