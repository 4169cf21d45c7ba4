package com.fvgscanner.exception;

import java.util.List;
import java.util.Map;

/**
 * Thrown when weights, thresholds or session windows are invalid. Raised before
 * any symbol is processed and aborts the run.
 */
public class ConfigurationException extends BaseException {

    public ConfigurationException(List<String> violations) {
        super(
                ErrorCode.CONFIGURATION_ERROR,
                "Invalid scanner configuration: " + String.join("; ", violations),
                Map.of("violations", List.copyOf(violations)));
    }

    public ConfigurationException(List<String> violations, Throwable cause) {
        super(
                ErrorCode.CONFIGURATION_ERROR,
                "Invalid scanner configuration: " + String.join("; ", violations),
                Map.of("violations", List.copyOf(violations)),
                cause);
    }

    @SuppressWarnings("unchecked")
    public List<String> getViolations() {
        return (List<String>) getDetails().get("violations");
    }
}
