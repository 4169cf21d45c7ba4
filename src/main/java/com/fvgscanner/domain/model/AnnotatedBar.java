package com.fvgscanner.domain.model;

import java.time.Instant;
import java.time.LocalDate;

/**
 * A {@link Bar} with the indicator values computed for it.
 *
 * <p>{@code atr} and {@code rvol} are null until their warmup has elapsed; {@code rvol}
 * is also null when the trailing average volume is zero. {@code vwap} is always set
 * and restarts at the first bar of every trading day.
 *
 * @param index      position of the bar in the symbol's series
 * @param tradingDay session id the bar belongs to
 */
public record AnnotatedBar(int index, Bar bar, LocalDate tradingDay, Double atr, Double rvol, double vwap) {

    public Instant timestamp() {
        return bar.timestamp();
    }

    public double open() {
        return bar.open();
    }

    public double high() {
        return bar.high();
    }

    public double low() {
        return bar.low();
    }

    public double close() {
        return bar.close();
    }

    public long volume() {
        return bar.volume();
    }

    public boolean hasAtr() {
        return atr != null;
    }
}
