package com.cloudwise.costanalytics.controller.dto;

import java.time.DayOfWeek;
import java.time.LocalDate;
import java.util.Map;

/**
 * Wire form of a baseline. Returned by {@code /analysis/baseline} and accepted back by
 * {@code /analysis/spike}; only {@code mean} and {@code stdDeviation} are required on the way in.
 */
public record BaselineDto(
        Double mean,
        Double stdDeviation,
        Map<DayOfWeek, Double> seasonalFactors,
        ConfidenceBandDto ci95,
        ConfidenceBandDto ci99,
        Double coefficientOfVariation,
        String stability,
        Integer sampleSize,
        LocalDate windowStart,
        LocalDate windowEnd,
        Boolean seasonalAdjusted
) {
}
