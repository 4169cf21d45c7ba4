package com.fvgscanner.exception;

/**
 * Wraps a failure raised by a {@code BarSource} while loading one symbol's bars.
 */
public class BarSourceException extends BaseException {

    public BarSourceException(String symbol, Throwable cause) {
        super(ErrorCode.BAR_SOURCE_ERROR, "Failed to load bars for " + symbol + ": " + cause.getMessage(), cause);
    }
}
