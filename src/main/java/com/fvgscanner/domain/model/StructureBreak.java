package com.fvgscanner.domain.model;

import com.fvgscanner.domain.enums.GapDirection;

/**
 * A close beyond the latest confirmed swing level by more than the ATR buffer.
 * BULLISH breaks a swing HIGH, BEARISH breaks a swing LOW.
 */
public record StructureBreak(int index, GapDirection direction, SwingPivot brokenPivot, double close) {}
