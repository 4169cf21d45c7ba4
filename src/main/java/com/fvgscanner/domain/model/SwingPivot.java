package com.fvgscanner.domain.model;

import com.fvgscanner.domain.enums.PivotType;

/**
 * A (2,2) fractal swing point: the bar at {@code index} has a strictly higher high
 * (HIGH) or strictly lower low (LOW) than the two bars on each side of it.
 */
public record SwingPivot(int index, PivotType type, double price) {

    public boolean isHigh() {
        return type == PivotType.HIGH;
    }

    public boolean isLow() {
        return type == PivotType.LOW;
    }
}
