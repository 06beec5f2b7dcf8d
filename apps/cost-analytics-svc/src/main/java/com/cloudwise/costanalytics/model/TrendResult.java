package com.cloudwise.costanalytics.model;

public record TrendResult(
        double slope,
        double intercept,
        double rSquared,
        FitQuality fitQuality,
        TrendDirection direction,
        boolean isSignificant,
        double confidence,
        double projection7,
        double projection30,
        double projection90,
        AnalysisPeriod analysisPeriod,
        int daysAnalyzed,
        double minSlopeThreshold,
        int lookbackDays
) {
    public record AnalysisPeriod(DateRange range, double startCost, double endCost, double totalChange) {
    }

    public enum FitQuality {
        VERY_STRONG,
        STRONG,
        MODERATE,
        WEAK,
        NONE;

        public static FitQuality fromRSquared(double rSquared) {
            if (rSquared >= 0.9) {
                return VERY_STRONG;
            }
            if (rSquared >= 0.7) {
                return STRONG;
            }
            if (rSquared >= 0.5) {
                return MODERATE;
            }
            if (rSquared >= 0.3) {
                return WEAK;
            }
            return NONE;
        }
    }
}
