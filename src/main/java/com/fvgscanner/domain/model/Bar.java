package com.fvgscanner.domain.model;

import java.time.Instant;

/**
 * One minute of OHLCV data for a single symbol.
 *
 * <p>The timestamp is the absolute start of the minute; local market time is derived
 * from the configured market timezone wherever it matters (session tagging, VWAP
 * anchoring). Bars of one symbol must be strictly ascending by timestamp.
 */
public record Bar(Instant timestamp, double open, double high, double low, double close, long volume) {

    /** Typical price {@code (high + low + close) / 3}, used for VWAP. */
    public double typicalPrice() {
        return (high + low + close) / 3.0;
    }

    public double range() {
        return high - low;
    }

    public double body() {
        return Math.abs(close - open);
    }

    public boolean isBullish() {
        return close > open;
    }

    public boolean isBearish() {
        return close < open;
    }
}
