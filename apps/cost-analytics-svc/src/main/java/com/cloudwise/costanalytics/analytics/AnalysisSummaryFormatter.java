package com.cloudwise.costanalytics.analytics;

import com.cloudwise.costanalytics.model.BaselineModel;
import com.cloudwise.costanalytics.model.ForecastResult;
import com.cloudwise.costanalytics.model.SpikeResult;
import com.cloudwise.costanalytics.model.TrendDirection;
import com.cloudwise.costanalytics.model.TrendResult;
import java.util.Locale;
import org.springframework.stereotype.Component;

/**
 * One-sentence, human-readable renderings of analysis results for alert and report text.
 * Results themselves never carry prose.
 */
@Component
public class AnalysisSummaryFormatter {

    public String describe(BaselineModel baseline) {
        StringBuilder summary = new StringBuilder();
        summary.append("Calculated baseline from ").append(baseline.sampleSize()).append(" days of cost data. ");
        summary.append(format("Mean: $%.2f, Std Dev: $%.2f, CV: %.1f%% (%s). ",
                baseline.mean(), baseline.stdDeviation(), baseline.coefficientOfVariation(), label(baseline.stability())));
        summary.append(format("95%% confidence interval: $%.2f - $%.2f. ", baseline.ci95().lower(), baseline.ci95().upper()));
        summary.append("Seasonal adjustment: ").append(baseline.seasonalAdjusted() ? "applied" : "not applied").append(".");
        return summary.toString();
    }

    public String describe(SpikeResult spike) {
        if (spike.isSpike()) {
            return format("SPIKE DETECTED: Current cost $%.2f is %.1f%% above baseline ($%.2f). Severity: %s. Z-score: %s. Confidence: %.1f%%.",
                    spike.currentValue(), spike.deviationPercent(), spike.baselineMean(), spike.severity(),
                    zScore(spike.zScore()), spike.confidence());
        }
        if (spike.deviationPercent() > 0) {
            return format("No spike detected. Current cost $%.2f is %.1f%% above baseline but within the %s%% threshold or not statistically significant.",
                    spike.currentValue(), spike.deviationPercent(), trim(spike.thresholdPercent()));
        }
        return format("No spike detected. Current cost $%.2f is %.1f%% below baseline.",
                spike.currentValue(), Math.abs(spike.deviationPercent()));
    }

    public String describe(TrendResult trend) {
        double dailyChange = Math.abs(trend.slope());
        if (trend.isSignificant()) {
            return format("SIGNIFICANT TREND DETECTED: Costs are %s at $%.2f/day. Projected 30-day impact: $%.2f. Trend strength: %s (R²=%.3f). Confidence: %.1f%%.",
                    label(trend.direction()), dailyChange, Math.abs(trend.projection30()), label(trend.fitQuality()),
                    trend.rSquared(), trend.confidence());
        }
        if (trend.direction() == TrendDirection.STABLE) {
            return format("No significant trend detected. Costs are stable with minimal daily change ($%.2f/day). R²=%.3f.",
                    dailyChange, trend.rSquared());
        }
        return format("Trend detected but not significant. Costs are %s at $%.2f/day but below threshold ($%s/day) or weakly correlated (R²=%.3f).",
                label(trend.direction()), dailyChange, trim(trend.minSlopeThreshold()), trend.rSquared());
    }

    public String describe(ForecastResult forecast) {
        int days = forecast.points().size();
        String trend = forecast.trendDirection() == TrendDirection.STABLE
                ? "stable"
                : format("%s at $%.2f/day", label(forecast.trendDirection()), Math.abs(forecast.slope()));
        String risk = forecast.riskFlags().isEmpty()
                ? " Forecast confidence: high."
                : " Risk factors: " + forecast.riskFlags().size() + " identified.";
        return format("Cost Forecast: %d-day projection totals $%.2f (avg $%.2f/day). Historical baseline: $%.2f/day. Trend: %s (%s, R²=%.2f). Change: %+.1f%% vs historical.",
                days, forecast.totalForecast(), forecast.averageDailyForecast(), forecast.historicalMean(), trend,
                label(forecast.trendStrength()), forecast.rSquared(), forecast.percentChangeVsHistorical()) + risk;
    }

    private static String zScore(double zScore) {
        return Double.isInfinite(zScore) ? "∞" : format("%.2f", zScore);
    }

    private static String trim(double value) {
        return value == Math.rint(value) ? String.valueOf((long) value) : String.valueOf(value);
    }

    private static String label(Enum<?> value) {
        return value.name().toLowerCase(Locale.ROOT).replace('_', ' ');
    }

    private static String format(String pattern, Object... args) {
        return String.format(Locale.US, pattern, args);
    }
}
