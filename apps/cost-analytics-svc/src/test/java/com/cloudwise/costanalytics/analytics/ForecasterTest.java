package com.cloudwise.costanalytics.analytics;

import static com.cloudwise.costanalytics.analytics.CostSeriesFixtures.DEFAULTS;
import static com.cloudwise.costanalytics.analytics.CostSeriesFixtures.START;
import static com.cloudwise.costanalytics.analytics.CostSeriesFixtures.daily;
import static com.cloudwise.costanalytics.analytics.CostSeriesFixtures.flat;
import static com.cloudwise.costanalytics.analytics.CostSeriesFixtures.linear;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

import com.cloudwise.costanalytics.model.ConfidenceLevel;
import com.cloudwise.costanalytics.model.CostSeries;
import com.cloudwise.costanalytics.model.ForecastResult;
import com.cloudwise.costanalytics.model.ForecastResult.ForecastPoint;
import com.cloudwise.costanalytics.model.ForecastResult.RiskFlag;
import com.cloudwise.costanalytics.model.TrendDirection;
import java.util.List;
import org.junit.jupiter.api.Test;

class ForecasterTest {

    private final Forecaster forecaster = new Forecaster(DEFAULTS);

    @Test
    void projectsFittedLineForward() {
        CostSeries series = linear(60, 1000, 5);

        ForecastResult forecast = forecaster.forecast(series);

        assertThat(forecast.points()).hasSize(30);
        ForecastPoint first = forecast.points().get(0);
        assertThat(first.date()).isEqualTo(START.plusDays(60));
        assertThat(first.dayOffset()).isEqualTo(1);
        assertThat(first.pointEstimate()).isCloseTo(1300.0, within(1e-6));
        assertThat(forecast.points().get(29).pointEstimate()).isCloseTo(1445.0, within(1e-6));
        assertThat(forecast.slope()).isCloseTo(5.0, within(1e-9));
        assertThat(forecast.rSquared()).isCloseTo(1.0, within(1e-9));
        assertThat(forecast.trendStrength()).isEqualTo(ForecastResult.TrendStrength.STRONG);
        assertThat(forecast.confidenceLevel()).isEqualTo(ConfidenceLevel.P80);
        assertThat(forecast.daysAnalyzed()).isEqualTo(60);
        assertThat(forecast.riskFlags()).isEmpty();
    }

    @Test
    void intervalWidthFollowsHorizonFormula() {
        CostSeries series = linear(60, 1000, 5);
        double stdDeviation = 5 * Math.sqrt(60 * 61 / 12.0);

        ForecastResult forecast = forecaster.forecast(series, 90, 0.95);

        for (ForecastPoint point : forecast.points()) {
            double expected = 1.96 * stdDeviation * (1 + point.dayOffset() / 30.0);
            assertThat(point.intervalWidth()).isCloseTo(expected, within(1e-6));
        }
        assertThat(forecast.historicalStdDeviation()).isCloseTo(stdDeviation, within(1e-9));
    }

    @Test
    void intervalWidthStrictlyIncreasesWithHorizon() {
        CostSeries series = daily(45, day -> 800 + 3 * day + (day % 3) * 40);

        List<ForecastPoint> points = forecaster.forecast(series, 90, 0.80).points();

        for (int i = 1; i < points.size(); i++) {
            assertThat(points.get(i).upperBound() - points.get(i).lowerBound())
                    .isGreaterThan(points.get(i - 1).upperBound() - points.get(i - 1).lowerBound());
        }
    }

    @Test
    void higherConfidenceWidensIntervals() {
        CostSeries series = daily(40, day -> 500 + (day % 5) * 25);

        ForecastPoint narrow = forecaster.forecast(series, 7, 0.80).points().get(0);
        ForecastPoint wide = forecaster.forecast(series, 7, 0.99).points().get(0);

        assertThat(wide.intervalWidth() / narrow.intervalWidth()).isCloseTo(2.576 / 1.28, within(1e-9));
    }

    @Test
    void aggregatesTotalsAndMonthlyProjection() {
        ForecastResult forecast = forecaster.forecast(linear(60, 1000, 5), 45, 0.80);

        double total = forecast.points().stream().mapToDouble(ForecastPoint::pointEstimate).sum();
        assertThat(forecast.totalForecast()).isCloseTo(total, within(1e-6));
        assertThat(forecast.averageDailyForecast()).isCloseTo(total / 45, within(1e-9));
        assertThat(forecast.historicalMean()).isCloseTo(1147.5, within(1e-9));
        assertThat(forecast.percentChangeVsHistorical())
                .isCloseTo((total / 45 - 1147.5) / 1147.5 * 100, within(1e-6));
        assertThat(forecast.monthlyProjection()).hasValueSatisfying(monthly -> {
            double firstThirty = forecast.points().subList(0, 30).stream().mapToDouble(ForecastPoint::pointEstimate).sum();
            assertThat(monthly.total()).isCloseTo(firstThirty, within(1e-6));
            assertThat(monthly.lower()).isLessThan(monthly.total());
            assertThat(monthly.upper()).isGreaterThan(monthly.total());
        });
    }

    @Test
    void shortHorizonHasNoMonthlyProjection() {
        ForecastResult forecast = forecaster.forecast(linear(60, 1000, 5), 7, 0.90);

        assertThat(forecast.points()).hasSize(7);
        assertThat(forecast.monthlyProjection()).isEmpty();
    }

    @Test
    void lowerBoundIsClampedAtZero() {
        ForecastResult forecast = forecaster.forecast(daily(30, day -> day % 2 == 0 ? 0 : 100), 10, 0.99);

        assertThat(forecast.points()).allSatisfy(point -> assertThat(point.lowerBound()).isGreaterThanOrEqualTo(0));
        assertThat(forecast.points().get(0).lowerBound()).isZero();
    }

    @Test
    void flagsNoisyShortHistory() {
        ForecastResult forecast = forecaster.forecast(daily(30, day -> day % 2 == 0 ? 100 : 1000));

        assertThat(forecast.riskFlags())
                .containsExactlyInAnyOrder(RiskFlag.LOW_FIT, RiskFlag.LIMITED_HISTORY, RiskFlag.HIGH_VOLATILITY);
        assertThat(forecast.trendDirection()).isEqualTo(TrendDirection.STABLE);
        assertThat(forecast.trendStrength()).isEqualTo(ForecastResult.TrendStrength.WEAK);
    }

    @Test
    void flagsRapidTrend() {
        ForecastResult forecast = forecaster.forecast(linear(30, 10, 10));

        assertThat(forecast.riskFlags()).contains(RiskFlag.RAPID_TREND, RiskFlag.LIMITED_HISTORY);
        assertThat(forecast.riskFlags()).doesNotContain(RiskFlag.LOW_FIT);
        assertThat(forecast.trendDirection()).isEqualTo(TrendDirection.INCREASING);
    }

    @Test
    void slopeUnderOnePercentOfMeanIsStable() {
        ForecastResult forecast = forecaster.forecast(linear(60, 1000, 5));

        assertThat(forecast.trendDirection()).isEqualTo(TrendDirection.STABLE);
    }

    @Test
    void flatHistoryForecastsConstantCost() {
        ForecastResult forecast = forecaster.forecast(flat(30, 500), 5, 0.80);

        assertThat(forecast.points()).allSatisfy(point -> {
            assertThat(point.pointEstimate()).isCloseTo(500.0, within(1e-9));
            assertThat(point.lowerBound()).isCloseTo(500.0, within(1e-9));
            assertThat(point.upperBound()).isCloseTo(500.0, within(1e-9));
        });
        assertThat(forecast.trendDirection()).isEqualTo(TrendDirection.STABLE);
        assertThat(forecast.riskFlags()).contains(RiskFlag.LOW_FIT);
    }

    @Test
    void rejectsInvalidParameters() {
        CostSeries series = flat(30, 100);

        assertThatThrownBy(() -> forecaster.forecast(series, 0, 0.80)).isInstanceOf(InvalidParameterException.class);
        assertThatThrownBy(() -> forecaster.forecast(series, 91, 0.80)).isInstanceOf(InvalidParameterException.class);
        assertThatThrownBy(() -> forecaster.forecast(series, 30, 0.85))
                .isInstanceOf(InvalidParameterException.class)
                .hasMessageContaining("confidenceLevel");
    }

    @Test
    void requiresThirtyObservations() {
        assertThatThrownBy(() -> forecaster.forecast(flat(29, 100)))
                .isInstanceOf(InsufficientDataException.class);
    }
}
