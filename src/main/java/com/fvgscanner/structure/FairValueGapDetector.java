package com.fvgscanner.structure;

import com.fvgscanner.domain.enums.GapDirection;
import com.fvgscanner.domain.model.AnnotatedBar;
import com.fvgscanner.domain.model.FairValueGap;
import java.util.ArrayList;
import java.util.List;

/**
 * Scans every three-bar window for a strict fair value gap.
 *
 * <pre>
 * bullish:  low[i+1]  &gt; high[i-1]   gap = [high[i-1], low[i+1]]
 * bearish:  high[i+1] &lt; low[i-1]    gap = [high[i+1], low[i-1]]
 * </pre>
 *
 * <p>Both comparisons are strict, so touching or overlapping outer bars never form a
 * gap. The two conditions are mutually exclusive for a well-formed bar.
 */
public final class FairValueGapDetector {

    private FairValueGapDetector() {}

    public static List<FairValueGap> detect(List<AnnotatedBar> bars) {
        List<FairValueGap> gaps = new ArrayList<>();
        for (int i = 1; i < bars.size() - 1; i++) {
            AnnotatedBar first = bars.get(i - 1);
            AnnotatedBar third = bars.get(i + 1);

            if (third.low() > first.high()) {
                gaps.add(build(GapDirection.BULLISH, first.high(), third.low(), third));
            } else if (third.high() < first.low()) {
                gaps.add(build(GapDirection.BEARISH, third.high(), first.low(), third));
            }
        }
        return gaps;
    }

    private static FairValueGap build(GapDirection direction, double lower, double upper, AnnotatedBar formation) {
        Double atr = formation.atr();
        Double sizeInAtr = atr != null && atr > 0 ? (upper - lower) / atr : null;
        return new FairValueGap(direction, lower, upper, formation.index(), atr, sizeInAtr);
    }
}
