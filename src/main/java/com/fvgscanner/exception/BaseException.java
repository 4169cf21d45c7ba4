package com.fvgscanner.exception;

import java.util.Map;
import lombok.Getter;

/**
 * Root of the scanner's failures. Each carries an {@link ErrorCode} and a details map
 * with the offending values (symbol, bar index, violations).
 *
 * <p>The code's {@link ErrorCode.Scope} decides how far a failure reaches:
 * {@code SYMBOL} failures are caught by the orchestrator and recorded as that one
 * symbol's error result while the other symbols keep scanning, {@code RUN} failures
 * abort the whole run before any symbol is processed.
 */
@Getter
public abstract class BaseException extends RuntimeException {

    private final ErrorCode errorCode;
    private final Map<String, Object> details;

    protected BaseException(ErrorCode errorCode, String message) {
        super(message);
        this.errorCode = errorCode;
        this.details = Map.of();
    }

    protected BaseException(ErrorCode errorCode, String message, Map<String, Object> details) {
        super(message);
        this.errorCode = errorCode;
        this.details = details != null ? details : Map.of();
    }

    protected BaseException(ErrorCode errorCode, String message, Throwable cause) {
        super(message, cause);
        this.errorCode = errorCode;
        this.details = Map.of();
    }

    protected BaseException(ErrorCode errorCode, String message, Map<String, Object> details, Throwable cause) {
        super(message, cause);
        this.errorCode = errorCode;
        this.details = details != null ? details : Map.of();
    }
}
