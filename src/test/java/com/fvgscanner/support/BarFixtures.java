package com.fvgscanner.support;

import com.fvgscanner.domain.model.AnnotatedBar;
import com.fvgscanner.domain.model.Bar;
import java.time.Instant;
import java.time.LocalDate;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.List;

/**
 * Hand-built one-minute bar series for tests. Minute 0 is 09:30 New York time on
 * 2024-03-05 (EST, UTC-5).
 */
public final class BarFixtures {

    public static final Instant SESSION_OPEN = Instant.parse("2024-03-05T14:30:00Z");
    public static final LocalDate TRADING_DAY = LocalDate.of(2024, 3, 5);
    public static final long DEFAULT_VOLUME = 1_000L;

    private BarFixtures() {}

    public static Bar bar(int minute, double open, double high, double low, double close) {
        return bar(minute, open, high, low, close, DEFAULT_VOLUME);
    }

    public static Bar bar(int minute, double open, double high, double low, double close, long volume) {
        return new Bar(SESSION_OPEN.plus(minute, ChronoUnit.MINUTES), open, high, low, close, volume);
    }

    /** Identical bars with a true range of 1.0 around 100. */
    public static List<Bar> steady(int count) {
        List<Bar> bars = new ArrayList<>();
        for (int i = 0; i < count; i++) {
            bars.add(bar(i, 100.0, 100.5, 99.5, 100.0));
        }
        return bars;
    }

    /**
     * 25 bars: swing low at 2 (99.00), swept by bar 6 (low 98.90, close 99.50), then a
     * bullish gap between bar 9's high 100.00 and bar 11's low 100.50. Every later bar
     * stays above 100.70, so the gap is untouched at its evaluation bar 16.
     */
    public static List<Bar> sweepThenBullishGap() {
        List<Bar> bars = new ArrayList<>();
        bars.add(bar(0, 99.80, 100.00, 99.60, 99.90));
        bars.add(bar(1, 99.90, 100.00, 99.50, 99.70));
        bars.add(bar(2, 99.70, 99.80, 99.00, 99.20));
        bars.add(bar(3, 99.40, 99.70, 99.30, 99.60));
        bars.add(bar(4, 99.60, 99.90, 99.40, 99.80));
        bars.add(bar(5, 99.80, 99.95, 99.50, 99.70));
        bars.add(bar(6, 99.70, 99.80, 98.90, 99.50));
        bars.add(bar(7, 99.50, 99.90, 99.40, 99.80));
        bars.add(bar(8, 99.80, 99.95, 99.60, 99.90));
        bars.add(bar(9, 99.90, 100.00, 99.70, 99.95));
        bars.add(bar(10, 99.95, 100.90, 99.90, 100.80));
        bars.add(bar(11, 100.80, 101.20, 100.50, 101.10));
        bars.add(bar(12, 101.10, 101.30, 100.70, 101.00));
        bars.add(bar(13, 101.00, 101.25, 100.80, 101.10));
        bars.add(bar(14, 101.10, 101.30, 100.75, 101.00));
        bars.add(bar(15, 101.00, 101.20, 100.70, 101.10));
        for (int i = 16; i < 25; i++) {
            bars.add(i % 2 == 0
                    ? bar(i, 101.00, 101.30, 100.70, 101.10)
                    : bar(i, 101.10, 101.25, 100.75, 101.00));
        }
        return bars;
    }

    /** {@link #sweepThenBullishGap()} with bar 15's low dipping to 100.20, inside the gap. */
    public static List<Bar> sweepThenBullishGapTouchedAt15() {
        List<Bar> bars = new ArrayList<>(sweepThenBullishGap());
        bars.set(15, bar(15, 101.00, 101.20, 100.20, 101.10));
        return bars;
    }

    /** Mirror image of {@link #sweepThenBullishGap()} reflected around 100. */
    public static List<Bar> sweepThenBearishGap() {
        List<Bar> mirrored = new ArrayList<>();
        for (Bar b : sweepThenBullishGap()) {
            mirrored.add(new Bar(
                    b.timestamp(), 200.0 - b.open(), 200.0 - b.low(), 200.0 - b.high(), 200.0 - b.close(), b.volume()));
        }
        return mirrored;
    }

    /** Wraps bars without indicators: ATR and RVOL null, VWAP the typical price. */
    public static List<AnnotatedBar> annotate(List<Bar> bars) {
        return annotate(bars, null);
    }

    /** Wraps bars with the same ATR on every bar. */
    public static List<AnnotatedBar> annotate(List<Bar> bars, Double atr) {
        List<AnnotatedBar> annotated = new ArrayList<>(bars.size());
        for (int i = 0; i < bars.size(); i++) {
            Bar b = bars.get(i);
            annotated.add(new AnnotatedBar(i, b, TRADING_DAY, atr, null, b.typicalPrice()));
        }
        return annotated;
    }
}
