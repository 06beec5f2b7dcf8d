package com.cloudwise.costanalytics.model;

public record ConfidenceBand(double lower, double upper) {

    /** Inclusive on both ends. */
    public boolean contains(double value) {
        return lower <= value && value <= upper;
    }
}
