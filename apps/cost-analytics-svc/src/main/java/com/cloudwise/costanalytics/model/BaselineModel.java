package com.cloudwise.costanalytics.model;

import java.time.DayOfWeek;
import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;
import java.util.Objects;

/**
 * Statistical description of "normal" cost over a trailing window.
 *
 * <p>{@code windowSpan} is null when the baseline was rebuilt from an external payload rather than
 * estimated from a series.
 */
public record BaselineModel(
        double mean,
        double stdDeviation,
        Map<DayOfWeek, Double> seasonalFactors,
        ConfidenceBand ci95,
        ConfidenceBand ci99,
        double coefficientOfVariation,
        Stability stability,
        int sampleSize,
        DateRange windowSpan,
        boolean seasonalAdjusted
) {
    public BaselineModel {
        Objects.requireNonNull(ci95, "ci95");
        Objects.requireNonNull(ci99, "ci99");
        Objects.requireNonNull(stability, "stability");
        EnumMap<DayOfWeek, Double> factors = new EnumMap<>(DayOfWeek.class);
        for (DayOfWeek day : DayOfWeek.values()) {
            Double factor = seasonalFactors == null ? null : seasonalFactors.get(day);
            factors.put(day, factor == null ? 1.0 : factor);
        }
        seasonalFactors = Collections.unmodifiableMap(factors);
    }

    public double seasonalFactor(DayOfWeek day) {
        return seasonalFactors.get(day);
    }

    public enum Stability {
        STABLE,
        MODERATE,
        HIGHLY_VARIABLE;

        public static Stability fromCoefficientOfVariation(double cv) {
            if (cv < 15) {
                return STABLE;
            }
            if (cv < 30) {
                return MODERATE;
            }
            return HIGHLY_VARIABLE;
        }
    }
}
