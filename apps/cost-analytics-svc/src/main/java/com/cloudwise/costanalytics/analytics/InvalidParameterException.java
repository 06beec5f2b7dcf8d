package com.cloudwise.costanalytics.analytics;

import java.util.Map;

public class InvalidParameterException extends CostAnalysisException {

    private final String parameter;
    private final Object value;

    public InvalidParameterException(String parameter, Object value, String constraint) {
        super(parameter + " " + constraint + " (was " + value + ")");
        this.parameter = parameter;
        this.value = value;
    }

    public String parameter() {
        return parameter;
    }

    public Object value() {
        return value;
    }

    @Override
    public String code() {
        return "INVALID_PARAMETER";
    }

    @Override
    public Map<String, Object> details() {
        return Map.of("parameter", parameter, "value", String.valueOf(value));
    }
}
