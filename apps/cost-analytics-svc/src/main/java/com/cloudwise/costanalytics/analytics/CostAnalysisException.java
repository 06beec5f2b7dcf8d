package com.cloudwise.costanalytics.analytics;

import java.util.Map;

/**
 * Base of the typed failures raised by the analytics core. Each subtype has a stable
 * {@link #code()} that callers can switch on or surface verbatim.
 */
public abstract class CostAnalysisException extends RuntimeException {

    protected CostAnalysisException(String message) {
        super(message);
    }

    public abstract String code();

    public Map<String, Object> details() {
        return Map.of();
    }
}
