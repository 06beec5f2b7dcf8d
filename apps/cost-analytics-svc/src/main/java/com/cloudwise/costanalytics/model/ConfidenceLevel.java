package com.cloudwise.costanalytics.model;

import java.util.Arrays;
import java.util.Optional;

/** Supported two-sided prediction interval levels and their normal z multipliers. */
public enum ConfidenceLevel {
    P80(0.80, 1.28),
    P90(0.90, 1.645),
    P95(0.95, 1.96),
    P99(0.99, 2.576);

    private final double level;
    private final double zScore;

    ConfidenceLevel(double level, double zScore) {
        this.level = level;
        this.zScore = zScore;
    }

    public double level() {
        return level;
    }

    public double zScore() {
        return zScore;
    }

    public static Optional<ConfidenceLevel> fromLevel(double level) {
        return Arrays.stream(values())
                .filter(candidate -> candidate.level == level)
                .findFirst();
    }
}
