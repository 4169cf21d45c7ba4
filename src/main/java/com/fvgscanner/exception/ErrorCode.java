package com.fvgscanner.exception;

import lombok.Getter;
import lombok.RequiredArgsConstructor;

/**
 * Error categories reported by the scanner, with the blast radius of each.
 *
 * <p>Symbol-scoped errors fail one symbol's pipeline run and are reported in that
 * symbol's result; run-scoped errors abort the whole scan before any symbol starts.
 */
@Getter
@RequiredArgsConstructor
public enum ErrorCode {
    DATA_INTEGRITY("DATA_INTEGRITY", Scope.SYMBOL),
    BAR_SOURCE_ERROR("BAR_SOURCE_ERROR", Scope.SYMBOL),
    INTERNAL_ERROR("INTERNAL_ERROR", Scope.SYMBOL),
    CONFIGURATION_ERROR("CONFIGURATION_ERROR", Scope.RUN);

    private final String code;
    private final Scope scope;

    public enum Scope {
        SYMBOL,
        RUN
    }
}
