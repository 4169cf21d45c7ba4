package com.fvgscanner.domain.model;

import com.fvgscanner.domain.enums.GapDirection;

/**
 * Three-bar price imbalance between the first bar ({@code formationIndex - 2}) and
 * the third bar ({@code formationIndex}).
 *
 * <p>Bounds are fixed when the gap forms. The constructor rejects zero-width and
 * inverted gaps, so {@code upper > lower} holds for every instance.
 *
 * @param formationIndex index of the third bar, the one that completes the gap
 * @param atrAtFormation ATR of the formation bar, null during warmup
 * @param sizeInAtr      {@code width / atrAtFormation}, null when ATR is null or zero
 */
public record FairValueGap(
        GapDirection direction, double lower, double upper, int formationIndex, Double atrAtFormation, Double sizeInAtr) {

    public FairValueGap {
        if (!(upper > lower)) {
            throw new IllegalArgumentException(
                    "Fair value gap bounds must be strictly ordered, got lower=" + lower + " upper=" + upper);
        }
        if (formationIndex < 2) {
            throw new IllegalArgumentException("Formation index must be at least 2, got " + formationIndex);
        }
    }

    public int firstIndex() {
        return formationIndex - 2;
    }

    public int middleIndex() {
        return formationIndex - 1;
    }

    public double width() {
        return upper - lower;
    }

    /** True when the closed interval {@code [low, high]} overlaps {@code [lower, upper]}. */
    public boolean intersects(double low, double high) {
        return low <= upper && high >= lower;
    }
}
