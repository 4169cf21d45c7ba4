package com.fvgscanner.indicator;

/**
 * Incremental relative volume: current volume over the mean volume of the preceding
 * {@code period} bars, the current bar excluded.
 *
 * <p>Volumes are summed as longs, so the trailing mean is exact and independent of
 * the order bars were added. Returns null during warmup and when the trailing mean
 * is zero.
 */
public class RelativeVolumeAccumulator {

    private final int period;
    private final long[] window;

    private int filled;
    private int cursor;
    private long sum;

    public RelativeVolumeAccumulator(int period) {
        if (period < 1) {
            throw new IllegalArgumentException("RVOL period must be positive, got " + period);
        }
        this.period = period;
        this.window = new long[period];
    }

    public Double update(long volume) {
        Double rvol = null;
        if (filled == period && sum > 0) {
            double average = (double) sum / period;
            rvol = volume / average;
        }

        if (filled == period) {
            sum -= window[cursor];
        } else {
            filled++;
        }
        window[cursor] = volume;
        cursor = (cursor + 1) % period;
        sum += volume;
        return rvol;
    }
}
