package com.cloudwise.costanalytics.model;

import java.time.LocalDate;
import java.util.List;
import java.util.Optional;
import java.util.Set;

public record ForecastResult(
        List<ForecastPoint> points,
        double totalForecast,
        double averageDailyForecast,
        double percentChangeVsHistorical,
        Optional<MonthlyProjection> monthlyProjection,
        TrendDirection trendDirection,
        TrendStrength trendStrength,
        double slope,
        double intercept,
        double rSquared,
        double historicalMean,
        double historicalStdDeviation,
        int daysAnalyzed,
        DateRange historyRange,
        ConfidenceLevel confidenceLevel,
        Set<RiskFlag> riskFlags
) {
    public ForecastResult {
        points = List.copyOf(points);
        riskFlags = Set.copyOf(riskFlags);
    }

    public record ForecastPoint(
            LocalDate date,
            int dayOffset,
            double pointEstimate,
            double lowerBound,
            double upperBound
    ) {
        public double intervalWidth() {
            return upperBound - pointEstimate;
        }
    }

    /** Sums over the first thirty forecast days. */
    public record MonthlyProjection(double total, double lower, double upper) {
    }

    public enum TrendStrength {
        STRONG,
        MODERATE,
        WEAK;

        public static TrendStrength fromRSquared(double rSquared) {
            if (rSquared > 0.7) {
                return STRONG;
            }
            if (rSquared > 0.4) {
                return MODERATE;
            }
            return WEAK;
        }
    }

    public enum RiskFlag {
        LOW_FIT,
        LIMITED_HISTORY,
        HIGH_VOLATILITY,
        RAPID_TREND
    }
}
