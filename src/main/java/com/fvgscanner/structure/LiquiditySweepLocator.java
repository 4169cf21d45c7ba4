package com.fvgscanner.structure;

import com.fvgscanner.domain.enums.PivotType;
import com.fvgscanner.domain.model.AnnotatedBar;
import com.fvgscanner.domain.model.FairValueGap;
import com.fvgscanner.domain.model.LiquiditySweep;
import com.fvgscanner.domain.model.SwingPivot;
import java.util.List;
import java.util.Optional;

/**
 * Finds the liquidity sweep that preceded a fair value gap.
 *
 * <p>Candidate sweep bars are the gap's first bar and the {@code lookbackBars} bars
 * before it, searched newest first. A bullish gap needs a bar whose low pierced an
 * earlier swing LOW and whose close finished back above it; a bearish gap needs the
 * mirror image against a swing HIGH. For the newest qualifying bar, the most recent
 * qualifying pivot is reported.
 *
 * <p>Instances are bound to one symbol's series and pivot list.
 */
public class LiquiditySweepLocator {

    private final List<AnnotatedBar> bars;
    private final List<SwingPivot> highs;
    private final List<SwingPivot> lows;
    private final int lookbackBars;

    public LiquiditySweepLocator(List<AnnotatedBar> bars, List<SwingPivot> pivots, int lookbackBars) {
        this.bars = bars;
        this.highs = pivots.stream().filter(SwingPivot::isHigh).toList();
        this.lows = pivots.stream().filter(SwingPivot::isLow).toList();
        this.lookbackBars = lookbackBars;
    }

    public Optional<LiquiditySweep> locate(FairValueGap gap) {
        PivotType swept = gap.direction().sweptPivotType();
        List<SwingPivot> levels = swept == PivotType.LOW ? lows : highs;
        int newest = gap.firstIndex();
        int oldest = Math.max(0, newest - lookbackBars);

        for (int s = newest; s >= oldest; s--) {
            AnnotatedBar bar = bars.get(s);
            for (int p = countBefore(levels, s) - 1; p >= 0; p--) {
                SwingPivot pivot = levels.get(p);
                if (isSweep(bar, pivot)) {
                    double wick = pivot.isLow() ? bar.low() : bar.high();
                    return Optional.of(new LiquiditySweep(pivot, s, bar.timestamp(), wick));
                }
            }
        }
        return Optional.empty();
    }

    static boolean isSweep(AnnotatedBar bar, SwingPivot pivot) {
        if (pivot.isLow()) {
            return bar.low() < pivot.price() && bar.close() > pivot.price();
        }
        return bar.high() > pivot.price() && bar.close() < pivot.price();
    }

    /** Number of pivots with index strictly below {@code index}; pivots are index-ordered. */
    private static int countBefore(List<SwingPivot> levels, int index) {
        int lo = 0;
        int hi = levels.size();
        while (lo < hi) {
            int mid = (lo + hi) >>> 1;
            if (levels.get(mid).index() < index) {
                lo = mid + 1;
            } else {
                hi = mid;
            }
        }
        return lo;
    }
}
