package com.fvgscanner.domain.enums;

/**
 * Smoothing applied to true range when computing ATR.
 *
 * <p>SIMPLE is a rolling arithmetic mean over the period. EXPONENTIAL is Wilder's
 * smoothing ({@code (prev * (n - 1) + tr) / n}) seeded with the first simple mean.
 */
public enum AtrMode {
    SIMPLE,
    EXPONENTIAL
}
