package com.fvgscanner.structure;

import com.fvgscanner.domain.enums.TouchState;
import com.fvgscanner.domain.model.FairValueGap;

/**
 * Two-state machine tracking whether a gap has been re-entered since formation.
 *
 * <p>Bars must be fed in ascending index order, strictly after the formation bar.
 * A bar whose high/low range intersects the closed gap interval moves the tracker
 * to TOUCHED; wicks count, not only closes. TOUCHED is terminal.
 */
public final class GapTouchTracker {

    private final FairValueGap gap;
    private TouchState state = TouchState.UNTOUCHED;
    private int lastIndex;
    private Integer touchedAtIndex;

    public GapTouchTracker(FairValueGap gap) {
        this.gap = gap;
        this.lastIndex = gap.formationIndex();
    }

    public TouchState observe(int index, double low, double high) {
        if (index <= lastIndex) {
            throw new IllegalArgumentException(
                    "Bars must be observed after index " + lastIndex + " in ascending order, got " + index);
        }
        lastIndex = index;
        if (state == TouchState.TOUCHED) {
            return state;
        }
        if (gap.intersects(low, high)) {
            state = TouchState.TOUCHED;
            touchedAtIndex = index;
        }
        return state;
    }

    public TouchState getState() {
        return state;
    }

    public Integer getTouchedAtIndex() {
        return touchedAtIndex;
    }

    public boolean isTouched() {
        return state == TouchState.TOUCHED;
    }
}
