package com.cloudwise.costanalytics.model;

public record RejectedEntry(int position, Reason reason) {

    public enum Reason {
        MISSING_FIELD,
        UNPARSEABLE_DATE,
        NON_NUMERIC_COST,
        NEGATIVE_COST
    }
}
