package com.cloudwise.costanalytics.analytics;

import com.cloudwise.costanalytics.config.CostAnalyticsProperties;
import com.cloudwise.costanalytics.model.BaselineModel;
import com.cloudwise.costanalytics.model.ConfidenceBand;
import com.cloudwise.costanalytics.model.CostObservation;
import com.cloudwise.costanalytics.model.CostSeries;
import java.time.DayOfWeek;
import java.util.EnumMap;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

@Component
public class BaselineEstimator {

    private static final Logger log = LoggerFactory.getLogger(BaselineEstimator.class);

    static final int MIN_WINDOW_DAYS = 7;
    static final int MIN_SEASONAL_WINDOW = 14;

    private final CostAnalyticsProperties.Baseline defaults;

    public BaselineEstimator(CostAnalyticsProperties properties) {
        this.defaults = properties.baseline();
    }

    public BaselineModel estimate(CostSeries series) {
        return estimate(series, defaults.windowDays(), defaults.seasonalAdjustment());
    }

    public BaselineModel estimate(CostSeries series, int windowDays, boolean enableSeasonal) {
        checkWindow(windowDays);
        int available = series == null ? 0 : series.size();
        if (available < SeriesValidator.BASELINE_MINIMUM) {
            throw new InsufficientDataException(SeriesValidator.BASELINE_MINIMUM, available);
        }

        CostSeries window = series.tail(Math.min(windowDays, available));
        double[] costs = window.costs();
        double mean = SampleStatistics.mean(costs);
        double stdDeviation = SampleStatistics.stdDeviation(costs, mean);

        boolean seasonal = enableSeasonal && window.size() >= MIN_SEASONAL_WINDOW;
        Map<DayOfWeek, Double> factors = seasonal ? seasonalFactors(window, mean) : Map.of();

        ConfidenceBand ci95 = new ConfidenceBand(Math.max(0, mean - 2 * stdDeviation), mean + 2 * stdDeviation);
        ConfidenceBand ci99 = new ConfidenceBand(Math.max(0, mean - 3 * stdDeviation), mean + 3 * stdDeviation);
        double cv = SampleStatistics.coefficientOfVariation(stdDeviation, mean);

        log.debug("baseline_estimated window={} mean={} stdDev={} cv={} seasonal={}",
                window.size(), mean, stdDeviation, cv, seasonal);
        return new BaselineModel(
                mean,
                stdDeviation,
                factors,
                ci95,
                ci99,
                cv,
                BaselineModel.Stability.fromCoefficientOfVariation(cv),
                window.size(),
                window.dateRange(),
                seasonal
        );
    }

    /** Average cost per weekday relative to the window mean; weekdays without samples stay at 1.0. */
    public void checkWindow(int windowDays) {
        if (windowDays < MIN_WINDOW_DAYS) {
            throw new InvalidParameterException("windowDays", windowDays, "must be at least " + MIN_WINDOW_DAYS);
        }
    }

    private Map<DayOfWeek, Double> seasonalFactors(CostSeries window, double mean) {
        Map<DayOfWeek, double[]> sums = new EnumMap<>(DayOfWeek.class);
        for (CostObservation observation : window.observations()) {
            double[] acc = sums.computeIfAbsent(observation.date().getDayOfWeek(), day -> new double[2]);
            acc[0] += observation.costValue();
            acc[1] += 1;
        }
        Map<DayOfWeek, Double> factors = new EnumMap<>(DayOfWeek.class);
        for (DayOfWeek day : DayOfWeek.values()) {
            double[] acc = sums.get(day);
            if (acc == null || mean <= 0) {
                factors.put(day, 1.0);
            } else {
                factors.put(day, (acc[0] / acc[1]) / mean);
            }
        }
        return factors;
    }
}
