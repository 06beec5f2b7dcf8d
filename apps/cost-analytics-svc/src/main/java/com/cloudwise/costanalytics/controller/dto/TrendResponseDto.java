package com.cloudwise.costanalytics.controller.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import java.time.LocalDate;

public record TrendResponseDto(
        String direction,
        double slope,
        double intercept,
        double rSquared,
        String fitQuality,
        @JsonProperty("isSignificant") boolean isSignificant,
        double confidence,
        Projections projections,
        AnalysisPeriod analysisPeriod,
        SeriesMetadataDto series,
        String summary,
        String traceId
) {
    public record Projections(double sevenDay, double thirtyDay, double ninetyDay) {
    }

    public record AnalysisPeriod(
            int daysAnalyzed,
            LocalDate startDate,
            LocalDate endDate,
            double startCost,
            double endCost,
            double totalChange
    ) {
    }
}
