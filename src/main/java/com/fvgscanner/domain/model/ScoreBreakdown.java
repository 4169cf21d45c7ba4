package com.fvgscanner.domain.model;

/**
 * Per-component subscores of a setup, each in {@code [0, 1]}, plus the weights that
 * combined them. {@code size} is null when ATR was undefined at formation, in which
 * case {@code sizeWeight} is recorded as zero.
 */
public record ScoreBreakdown(
        double cleanliness,
        Double size,
        double session,
        double cleanlinessWeight,
        double sizeWeight,
        double sessionWeight) {

    public boolean isSizeScored() {
        return size != null;
    }
}
