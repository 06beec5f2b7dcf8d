package com.cloudwise.costanalytics.analytics;

public class DegenerateInputException extends CostAnalysisException {

    public DegenerateInputException(String message) {
        super(message);
    }

    @Override
    public String code() {
        return "DEGENERATE_INPUT";
    }
}
