package com.fvgscanner.domain.enums;

/**
 * Direction of a fair value gap, and by extension of the setup built on it.
 *
 * <p>A BULLISH gap leaves unfilled space below price (low of the third bar above the
 * high of the first); a BEARISH gap leaves it above.
 */
public enum GapDirection {
    BULLISH,
    BEARISH;

    /** The pivot type whose liquidity must be swept before a gap in this direction. */
    public PivotType sweptPivotType() {
        return this == BULLISH ? PivotType.LOW : PivotType.HIGH;
    }
}
