package com.cloudwise.costanalytics.controller.dto;

import java.time.LocalDate;
import java.util.List;

public record ForecastResponseDto(
        List<Point> points,
        double totalForecast,
        double averageDailyForecast,
        double percentChangeVsHistorical,
        MonthlyProjection monthlyProjection,
        TrendAnalysis trend,
        HistoricalBaseline history,
        double confidenceLevel,
        List<String> riskFlags,
        SeriesMetadataDto series,
        String summary,
        String traceId
) {
    public record Point(LocalDate date, int dayOffset, double forecastCost, double lower, double upper) {
    }

    public record MonthlyProjection(double total, double lower, double upper) {
    }

    public record TrendAnalysis(String direction, String strength, double dailyChangeRate, double intercept, double rSquared) {
    }

    public record HistoricalBaseline(int daysAnalyzed, double averageDailyCost, double stdDeviation, LocalDate startDate, LocalDate endDate) {
    }
}
