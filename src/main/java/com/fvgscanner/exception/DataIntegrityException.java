package com.fvgscanner.exception;

import java.util.Map;

/**
 * Thrown when a symbol's bar series violates ordering or price sanity rules
 * (duplicate or descending timestamps, high below low, non-finite prices).
 *
 * <p>Fatal for the affected symbol only; the orchestrator records it in that
 * symbol's result and carries on with the others.
 */
public class DataIntegrityException extends BaseException {

    public DataIntegrityException(String message, Map<String, Object> details) {
        super(ErrorCode.DATA_INTEGRITY, message, details);
    }
}
