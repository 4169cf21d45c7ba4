package com.fvgscanner.structure;

import com.fvgscanner.domain.enums.GapDirection;
import com.fvgscanner.domain.model.AnnotatedBar;
import com.fvgscanner.domain.model.StructureBreak;
import com.fvgscanner.domain.model.SwingPivot;
import java.util.ArrayList;
import java.util.List;

/**
 * Detects breaks of structure: a close beyond the latest confirmed swing level by
 * more than {@code atrBuffer * ATR}.
 *
 * <p>A pivot at index p is only known once its two right-hand bars have printed, so
 * it becomes breakable from bar p + 3. A newer pivot of the same type replaces the
 * older one, and each pivot breaks at most once. Bars without ATR are skipped.
 */
public final class BreakOfStructureDetector {

    private BreakOfStructureDetector() {}

    public static List<StructureBreak> detect(List<AnnotatedBar> bars, List<SwingPivot> pivots, double atrBuffer) {
        List<StructureBreak> breaks = new ArrayList<>();
        SwingPivot lastHigh = null;
        SwingPivot lastLow = null;
        int next = 0;

        for (AnnotatedBar bar : bars) {
            while (next < pivots.size()
                    && pivots.get(next).index() + SwingPivotDetector.RIGHT_BARS < bar.index()) {
                SwingPivot confirmed = pivots.get(next++);
                if (confirmed.isHigh()) {
                    lastHigh = confirmed;
                } else {
                    lastLow = confirmed;
                }
            }
            if (!bar.hasAtr()) {
                continue;
            }

            double buffer = atrBuffer * bar.atr();
            if (lastHigh != null && bar.close() > lastHigh.price() + buffer) {
                breaks.add(new StructureBreak(bar.index(), GapDirection.BULLISH, lastHigh, bar.close()));
                lastHigh = null;
            }
            if (lastLow != null && bar.close() < lastLow.price() - buffer) {
                breaks.add(new StructureBreak(bar.index(), GapDirection.BEARISH, lastLow, bar.close()));
                lastLow = null;
            }
        }
        return breaks;
    }
}
