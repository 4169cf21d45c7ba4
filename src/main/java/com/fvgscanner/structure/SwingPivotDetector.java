package com.fvgscanner.structure;

import com.fvgscanner.domain.enums.PivotType;
import com.fvgscanner.domain.model.AnnotatedBar;
import com.fvgscanner.domain.model.SwingPivot;
import java.util.ArrayList;
import java.util.List;

/**
 * Finds (2,2) fractal swing pivots.
 *
 * <p>A bar is a swing high when its high is strictly greater than the highs of the
 * two bars before and the two bars after it; a swing low mirrors this with lows.
 * The first and last two bars can never be confirmed. When a bar is both, the high
 * is listed first.
 */
public final class SwingPivotDetector {

    static final int LEFT_BARS = 2;
    static final int RIGHT_BARS = 2;

    private SwingPivotDetector() {}

    public static List<SwingPivot> detect(List<AnnotatedBar> bars) {
        List<SwingPivot> pivots = new ArrayList<>();
        for (int i = LEFT_BARS; i < bars.size() - RIGHT_BARS; i++) {
            AnnotatedBar bar = bars.get(i);
            if (isSwingHigh(bars, i)) {
                pivots.add(new SwingPivot(i, PivotType.HIGH, bar.high()));
            }
            if (isSwingLow(bars, i)) {
                pivots.add(new SwingPivot(i, PivotType.LOW, bar.low()));
            }
        }
        return pivots;
    }

    private static boolean isSwingHigh(List<AnnotatedBar> bars, int i) {
        double high = bars.get(i).high();
        for (int j = i - LEFT_BARS; j <= i + RIGHT_BARS; j++) {
            if (j != i && bars.get(j).high() >= high) {
                return false;
            }
        }
        return true;
    }

    private static boolean isSwingLow(List<AnnotatedBar> bars, int i) {
        double low = bars.get(i).low();
        for (int j = i - LEFT_BARS; j <= i + RIGHT_BARS; j++) {
            if (j != i && bars.get(j).low() <= low) {
                return false;
            }
        }
        return true;
    }
}
