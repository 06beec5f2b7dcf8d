package com.cloudwise.costanalytics.analytics;

public class MalformedBaselineException extends CostAnalysisException {

    public MalformedBaselineException(String message) {
        super(message);
    }

    @Override
    public String code() {
        return "MALFORMED_BASELINE";
    }
}
