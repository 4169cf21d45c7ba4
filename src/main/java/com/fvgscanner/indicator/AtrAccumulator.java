package com.fvgscanner.indicator;

import com.fvgscanner.domain.enums.AtrMode;
import com.fvgscanner.domain.model.Bar;

/**
 * Incremental Average True Range over a fixed period.
 *
 * <p>True range uses the previous bar's close; the first bar has none, so its true
 * range is simply {@code high - low}. A value is produced from the bar at index
 * {@code period} onward, i.e. once {@code period} true ranges that each had a prior
 * close are available. Earlier calls return null.
 *
 * <p>SIMPLE keeps a ring buffer and a running sum; EXPONENTIAL seeds with the first
 * simple mean and then applies Wilder smoothing. Both are O(1) per bar.
 */
public class AtrAccumulator {

    private final int period;
    private final AtrMode mode;
    private final double[] window;

    private int barsSeen;
    private int filled;
    private int cursor;
    private double sum;
    private double previousClose;
    private Double current;

    public AtrAccumulator(int period, AtrMode mode) {
        if (period < 1) {
            throw new IllegalArgumentException("ATR period must be positive, got " + period);
        }
        this.period = period;
        this.mode = mode;
        this.window = new double[period];
    }

    /**
     * Folds the next bar into the average.
     *
     * @return the ATR at this bar, or null while warming up
     */
    public Double update(Bar bar) {
        double trueRange = barsSeen == 0 ? bar.range() : trueRange(bar, previousClose);
        previousClose = bar.close();
        int index = barsSeen++;

        if (filled == period) {
            sum -= window[cursor];
        } else {
            filled++;
        }
        window[cursor] = trueRange;
        cursor = (cursor + 1) % period;
        sum += trueRange;

        if (index < period) {
            return null;
        }

        double simple = Math.max(0.0, sum) / period;
        if (mode == AtrMode.SIMPLE || current == null) {
            current = simple;
        } else {
            current = (current * (period - 1) + trueRange) / period;
        }
        return current;
    }

    static double trueRange(Bar bar, double previousClose) {
        double highLow = bar.high() - bar.low();
        double highClose = Math.abs(bar.high() - previousClose);
        double lowClose = Math.abs(bar.low() - previousClose);
        return Math.max(highLow, Math.max(highClose, lowClose));
    }
}
