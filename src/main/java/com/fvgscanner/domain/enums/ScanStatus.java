package com.fvgscanner.domain.enums;

/** Per-symbol outcome of one scan run. */
public enum ScanStatus {
    SUCCESS_WITH_SETUPS,
    SUCCESS_NO_SETUPS,
    FAILED
}
