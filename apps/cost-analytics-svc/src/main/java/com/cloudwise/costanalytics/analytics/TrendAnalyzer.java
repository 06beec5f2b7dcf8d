package com.cloudwise.costanalytics.analytics;

import com.cloudwise.costanalytics.config.CostAnalyticsProperties;
import com.cloudwise.costanalytics.model.CostSeries;
import com.cloudwise.costanalytics.model.TrendDirection;
import com.cloudwise.costanalytics.model.TrendResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Fits a straight line through the most recent {@code lookbackDays} observations and decides
 * whether the drift is material: a good fit, a slope above the configured floor and more than
 * $100 of projected change over thirty days.
 */
@Component
public class TrendAnalyzer {

    private static final Logger log = LoggerFactory.getLogger(TrendAnalyzer.class);

    static final int MIN_LOOKBACK_DAYS = 7;
    private static final double SIGNIFICANT_R_SQUARED = 0.5;
    private static final double SIGNIFICANT_MONTHLY_IMPACT = 100.0;
    private static final int FULL_CONFIDENCE_SAMPLE = 14;

    private final CostAnalyticsProperties.Trend defaults;

    public TrendAnalyzer(CostAnalyticsProperties properties) {
        this.defaults = properties.trend();
    }

    public TrendResult analyze(CostSeries series) {
        return analyze(series, defaults.lookbackDays(), defaults.minSlopeThreshold());
    }

    public TrendResult analyze(CostSeries series, int lookbackDays, double minSlopeThreshold) {
        checkParameters(lookbackDays, minSlopeThreshold);
        int available = series == null ? 0 : series.size();
        if (available < SeriesValidator.TREND_MINIMUM) {
            throw new InsufficientDataException(SeriesValidator.TREND_MINIMUM, available);
        }

        CostSeries window = series.tail(Math.min(lookbackDays, available));
        double[] costs = window.costs();
        LinearRegression.Fit fit = LinearRegression.fit(costs);
        int n = fit.sampleSize();

        double slope = fit.slope();
        double projection7 = slope * 7;
        double projection30 = slope * 30;
        double projection90 = slope * 90;

        boolean significant = fit.rSquared() > SIGNIFICANT_R_SQUARED
                && Math.abs(slope) >= minSlopeThreshold
                && Math.abs(projection30) > SIGNIFICANT_MONTHLY_IMPACT;
        double confidence = fit.rSquared() * 70
                + Math.min(30, (double) n / FULL_CONFIDENCE_SAMPLE * 30);

        double startCost = costs[0];
        double endCost = costs[n - 1];
        TrendResult.AnalysisPeriod period = new TrendResult.AnalysisPeriod(
                window.dateRange(), startCost, endCost, endCost - startCost);

        TrendDirection direction = TrendDirection.classify(slope, minSlopeThreshold);
        log.debug("trend_analyzed days={} slope={} rSquared={} direction={} significant={}",
                n, slope, fit.rSquared(), direction, significant);
        return new TrendResult(
                slope,
                fit.intercept(),
                fit.rSquared(),
                TrendResult.FitQuality.fromRSquared(fit.rSquared()),
                direction,
                significant,
                confidence,
                projection7,
                projection30,
                projection90,
                period,
                n,
                minSlopeThreshold,
                lookbackDays
        );
    }

    public void checkParameters(int lookbackDays, double minSlopeThreshold) {
        if (lookbackDays < MIN_LOOKBACK_DAYS) {
            throw new InvalidParameterException("lookbackDays", lookbackDays, "must be at least " + MIN_LOOKBACK_DAYS);
        }
        if (!Double.isFinite(minSlopeThreshold) || minSlopeThreshold < 0) {
            throw new InvalidParameterException("minSlopeThreshold", minSlopeThreshold, "must not be negative");
        }
    }
}
