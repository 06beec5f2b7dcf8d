package com.cloudwise.costanalytics.model;

public enum TrendDirection {
    INCREASING,
    DECREASING,
    STABLE;

    /**
     * Stable when the slope magnitude is under {@code stableBelow}; a slope of exactly zero is
     * always stable, even with a zero threshold.
     */
    public static TrendDirection classify(double slope, double stableBelow) {
        if (Math.abs(slope) < stableBelow || slope == 0) {
            return STABLE;
        }
        return slope > 0 ? INCREASING : DECREASING;
    }
}
