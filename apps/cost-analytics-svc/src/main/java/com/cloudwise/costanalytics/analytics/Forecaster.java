package com.cloudwise.costanalytics.analytics;

import com.cloudwise.costanalytics.config.CostAnalyticsProperties;
import com.cloudwise.costanalytics.model.ConfidenceLevel;
import com.cloudwise.costanalytics.model.CostSeries;
import com.cloudwise.costanalytics.model.ForecastResult;
import com.cloudwise.costanalytics.model.TrendDirection;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.EnumSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Projects the least-squares line of the whole history forward. Interval half-width is
 * {@code z * stdDev * (1 + d / 30)} for day offset {@code d}, so uncertainty grows with the horizon.
 */
@Component
public class Forecaster {

    private static final Logger log = LoggerFactory.getLogger(Forecaster.class);

    static final int MAX_FORECAST_DAYS = 90;
    private static final int MONTH_DAYS = 30;
    private static final int RECOMMENDED_HISTORY = 60;
    private static final double STABLE_SLOPE_RATIO = 0.01;
    private static final double RAPID_SLOPE_RATIO = 0.05;
    private static final double LOW_FIT_R_SQUARED = 0.5;
    private static final double HIGH_VOLATILITY_CV = 30.0;

    private final CostAnalyticsProperties.Forecast defaults;

    public Forecaster(CostAnalyticsProperties properties) {
        this.defaults = properties.forecast();
    }

    public ForecastResult forecast(CostSeries series) {
        return forecast(series, defaults.forecastDays(), defaults.confidenceLevel());
    }

    public ForecastResult forecast(CostSeries series, int forecastDays, double confidenceLevel) {
        ConfidenceLevel level = checkParameters(forecastDays, confidenceLevel);
        int available = series == null ? 0 : series.size();
        if (available < SeriesValidator.FORECAST_MINIMUM) {
            throw new InsufficientDataException(SeriesValidator.FORECAST_MINIMUM, available);
        }

        double[] costs = series.costs();
        int n = costs.length;
        double mean = SampleStatistics.mean(costs);
        double stdDeviation = SampleStatistics.stdDeviation(costs, mean);
        LinearRegression.Fit fit = LinearRegression.fit(costs);

        LocalDate lastDate = series.lastDate();
        List<ForecastResult.ForecastPoint> points = new ArrayList<>(forecastDays);
        double total = 0d;
        for (int day = 1; day <= forecastDays; day++) {
            double point = fit.predict(n + day - 1);
            double width = level.zScore() * stdDeviation * (1 + day / (double) MONTH_DAYS);
            points.add(new ForecastResult.ForecastPoint(
                    lastDate.plusDays(day),
                    day,
                    point,
                    Math.max(0, point - width),
                    point + width
            ));
            total += point;
        }
        double averageDaily = total / forecastDays;
        double percentChange = mean > 0 ? (averageDaily - mean) / mean * 100 : 0d;

        double slope = fit.slope();
        double cv = SampleStatistics.coefficientOfVariation(stdDeviation, mean);
        Set<ForecastResult.RiskFlag> risks = EnumSet.noneOf(ForecastResult.RiskFlag.class);
        if (fit.rSquared() < LOW_FIT_R_SQUARED) {
            risks.add(ForecastResult.RiskFlag.LOW_FIT);
        }
        if (n < RECOMMENDED_HISTORY) {
            risks.add(ForecastResult.RiskFlag.LIMITED_HISTORY);
        }
        if (cv > HIGH_VOLATILITY_CV) {
            risks.add(ForecastResult.RiskFlag.HIGH_VOLATILITY);
        }
        if (Math.abs(slope) > mean * RAPID_SLOPE_RATIO) {
            risks.add(ForecastResult.RiskFlag.RAPID_TREND);
        }

        TrendDirection direction = TrendDirection.classify(slope, mean * STABLE_SLOPE_RATIO);
        log.debug("forecast_generated history={} days={} level={} total={} risks={}",
                n, forecastDays, level, total, risks);
        return new ForecastResult(
                points,
                total,
                averageDaily,
                percentChange,
                monthlyProjection(points),
                direction,
                ForecastResult.TrendStrength.fromRSquared(fit.rSquared()),
                slope,
                fit.intercept(),
                fit.rSquared(),
                mean,
                stdDeviation,
                n,
                series.dateRange(),
                level,
                risks
        );
    }

    /**
     * Validates the horizon and confidence level ahead of any work on the series.
     *
     * @return the matching confidence level
     */
    public ConfidenceLevel checkParameters(int forecastDays, double confidenceLevel) {
        if (forecastDays < 1 || forecastDays > MAX_FORECAST_DAYS) {
            throw new InvalidParameterException("forecastDays", forecastDays, "must be between 1 and " + MAX_FORECAST_DAYS);
        }
        return ConfidenceLevel.fromLevel(confidenceLevel)
                .orElseThrow(() -> new InvalidParameterException("confidenceLevel", confidenceLevel,
                        "must be one of 0.80, 0.90, 0.95, 0.99"));
    }

    private Optional<ForecastResult.MonthlyProjection> monthlyProjection(List<ForecastResult.ForecastPoint> points) {
        if (points.size() < MONTH_DAYS) {
            return Optional.empty();
        }
        double total = 0d;
        double lower = 0d;
        double upper = 0d;
        for (ForecastResult.ForecastPoint point : points.subList(0, MONTH_DAYS)) {
            total += point.pointEstimate();
            lower += point.lowerBound();
            upper += point.upperBound();
        }
        return Optional.of(new ForecastResult.MonthlyProjection(total, lower, upper));
    }
}
