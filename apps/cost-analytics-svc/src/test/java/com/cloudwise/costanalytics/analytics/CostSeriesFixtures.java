package com.cloudwise.costanalytics.analytics;

import com.cloudwise.costanalytics.config.CostAnalyticsProperties;
import com.cloudwise.costanalytics.model.BaselineModel;
import com.cloudwise.costanalytics.model.ConfidenceBand;
import com.cloudwise.costanalytics.model.CostObservation;
import com.cloudwise.costanalytics.model.CostSeries;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.function.IntToDoubleFunction;

final class CostSeriesFixtures {

    /** A Monday. */
    static final LocalDate START = LocalDate.of(2025, 1, 6);

    static final CostAnalyticsProperties DEFAULTS = CostAnalyticsProperties.defaults();

    private CostSeriesFixtures() {
    }

    static CostSeries daily(int days, IntToDoubleFunction costForDay) {
        List<CostObservation> observations = new ArrayList<>(days);
        for (int day = 0; day < days; day++) {
            observations.add(CostObservation.of(START.plusDays(day), costForDay.applyAsDouble(day)));
        }
        return CostSeries.of(observations);
    }

    static CostSeries flat(int days, double cost) {
        return daily(days, day -> cost);
    }

    static CostSeries linear(int days, double intercept, double slope) {
        return daily(days, day -> intercept + slope * day);
    }

    static BaselineModel baseline(double mean, double stdDeviation) {
        return new BaselineModel(
                mean,
                stdDeviation,
                Map.of(),
                new ConfidenceBand(Math.max(0, mean - 2 * stdDeviation), mean + 2 * stdDeviation),
                new ConfidenceBand(Math.max(0, mean - 3 * stdDeviation), mean + 3 * stdDeviation),
                mean > 0 ? stdDeviation / mean * 100 : 0,
                BaselineModel.Stability.STABLE,
                30,
                null,
                false
        );
    }
}
