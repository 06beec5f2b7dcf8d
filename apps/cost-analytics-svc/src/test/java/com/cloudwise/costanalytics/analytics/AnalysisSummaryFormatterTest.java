package com.cloudwise.costanalytics.analytics;

import static com.cloudwise.costanalytics.analytics.CostSeriesFixtures.DEFAULTS;
import static com.cloudwise.costanalytics.analytics.CostSeriesFixtures.baseline;
import static com.cloudwise.costanalytics.analytics.CostSeriesFixtures.daily;
import static com.cloudwise.costanalytics.analytics.CostSeriesFixtures.flat;
import static com.cloudwise.costanalytics.analytics.CostSeriesFixtures.linear;
import static org.assertj.core.api.Assertions.assertThat;

import org.junit.jupiter.api.Test;

class AnalysisSummaryFormatterTest {

    private final AnalysisSummaryFormatter formatter = new AnalysisSummaryFormatter();
    private final BaselineEstimator baselineEstimator = new BaselineEstimator(DEFAULTS);
    private final SpikeDetector spikeDetector = new SpikeDetector(DEFAULTS);
    private final TrendAnalyzer trendAnalyzer = new TrendAnalyzer(DEFAULTS);
    private final Forecaster forecaster = new Forecaster(DEFAULTS);

    @Test
    void describesBaseline() {
        String summary = formatter.describe(baselineEstimator.estimate(flat(14, 100)));

        assertThat(summary)
                .startsWith("Calculated baseline from 14 days of cost data.")
                .contains("Mean: $100.00, Std Dev: $0.00, CV: 0.0% (stable)")
                .contains("95% confidence interval: $100.00 - $100.00")
                .endsWith("Seasonal adjustment: applied.");
    }

    @Test
    void describesDetectedSpike() {
        String summary = formatter.describe(spikeDetector.detect(1400, baseline(1000, 50)));

        assertThat(summary).isEqualTo(
                "SPIKE DETECTED: Current cost $1400.00 is 40.0% above baseline ($1000.00). "
                        + "Severity: MEDIUM. Z-score: 8.00. Confidence: 100.0%.");
    }

    @Test
    void rendersInfiniteZScore() {
        String summary = formatter.describe(spikeDetector.detect(1500, baseline(1000, 0)));

        assertThat(summary).contains("Z-score: ∞");
    }

    @Test
    void describesIncreaseWithinThreshold() {
        String summary = formatter.describe(spikeDetector.detect(1100, baseline(1000, 50)));

        assertThat(summary).isEqualTo(
                "No spike detected. Current cost $1100.00 is 10.0% above baseline but within the 20% threshold "
                        + "or not statistically significant.");
    }

    @Test
    void describesDecrease() {
        String summary = formatter.describe(spikeDetector.detect(900, baseline(1000, 50)));

        assertThat(summary).isEqualTo("No spike detected. Current cost $900.00 is 10.0% below baseline.");
    }

    @Test
    void describesSignificantTrend() {
        String summary = formatter.describe(trendAnalyzer.analyze(linear(14, 100, 10)));

        assertThat(summary)
                .startsWith("SIGNIFICANT TREND DETECTED: Costs are increasing at $10.00/day.")
                .contains("Projected 30-day impact: $300.00")
                .contains("Trend strength: very strong");
    }

    @Test
    void describesStableTrend() {
        String summary = formatter.describe(trendAnalyzer.analyze(flat(14, 400)));

        assertThat(summary).startsWith("No significant trend detected. Costs are stable with minimal daily change ($0.00/day).");
    }

    @Test
    void describesInsignificantTrend() {
        String summary = formatter.describe(trendAnalyzer.analyze(linear(14, 100, 3), 14, 1.0));

        assertThat(summary).startsWith("Trend detected but not significant. Costs are increasing at $3.00/day but below threshold ($1/day)");
    }

    @Test
    void describesConfidentForecast() {
        String summary = formatter.describe(forecaster.forecast(linear(60, 1000, 5)));

        assertThat(summary)
                .startsWith("Cost Forecast: 30-day projection totals $41175.00 (avg $1372.50/day).")
                .contains("Historical baseline: $1147.50/day")
                .contains("Trend: stable (strong, R²=1.00)")
                .contains("Change: +19.6% vs historical.")
                .endsWith("Forecast confidence: high.");
    }

    @Test
    void countsForecastRisks() {
        String summary = formatter.describe(forecaster.forecast(daily(30, day -> day % 2 == 0 ? 100 : 1000)));

        assertThat(summary).endsWith("Risk factors: 3 identified.");
    }
}
