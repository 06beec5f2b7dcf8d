package com.cloudwise.costanalytics.analytics;

import java.util.Map;

public class InsufficientDataException extends CostAnalysisException {

    private final int required;
    private final int actual;

    public InsufficientDataException(int required, int actual) {
        super("Only " + actual + " valid cost entries available, at least " + required + " required");
        this.required = required;
        this.actual = actual;
    }

    public int required() {
        return required;
    }

    public int actual() {
        return actual;
    }

    @Override
    public String code() {
        return "INSUFFICIENT_DATA";
    }

    @Override
    public Map<String, Object> details() {
        return Map.of("required", required, "actual", actual);
    }
}
