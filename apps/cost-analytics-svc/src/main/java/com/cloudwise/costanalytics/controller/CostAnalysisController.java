package com.cloudwise.costanalytics.controller;

import com.cloudwise.costanalytics.analytics.AnalysisSummaryFormatter;
import com.cloudwise.costanalytics.analytics.BaselineEstimator;
import com.cloudwise.costanalytics.analytics.Forecaster;
import com.cloudwise.costanalytics.analytics.MalformedBaselineException;
import com.cloudwise.costanalytics.analytics.SeriesValidator;
import com.cloudwise.costanalytics.analytics.SpikeDetector;
import com.cloudwise.costanalytics.analytics.TrendAnalyzer;
import com.cloudwise.costanalytics.config.CostAnalyticsProperties;
import com.cloudwise.costanalytics.controller.dto.BaselineDto;
import com.cloudwise.costanalytics.controller.dto.BaselineRequestDto;
import com.cloudwise.costanalytics.controller.dto.BaselineResponseDto;
import com.cloudwise.costanalytics.controller.dto.ConfidenceBandDto;
import com.cloudwise.costanalytics.controller.dto.ForecastRequestDto;
import com.cloudwise.costanalytics.controller.dto.ForecastResponseDto;
import com.cloudwise.costanalytics.controller.dto.SeriesMetadataDto;
import com.cloudwise.costanalytics.controller.dto.SpikeRequestDto;
import com.cloudwise.costanalytics.controller.dto.SpikeResponseDto;
import com.cloudwise.costanalytics.controller.dto.TrendRequestDto;
import com.cloudwise.costanalytics.controller.dto.TrendResponseDto;
import com.cloudwise.costanalytics.model.BaselineModel;
import com.cloudwise.costanalytics.model.ConfidenceBand;
import com.cloudwise.costanalytics.model.CostSeries;
import com.cloudwise.costanalytics.model.ForecastResult;
import com.cloudwise.costanalytics.model.SpikeResult;
import com.cloudwise.costanalytics.model.TrendResult;
import com.cloudwise.costanalytics.web.RequestContextHolder;
import jakarta.validation.Valid;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/analysis")
public class CostAnalysisController {

    private static final Logger log = LoggerFactory.getLogger(CostAnalysisController.class);

    private final SeriesValidator seriesValidator;
    private final BaselineEstimator baselineEstimator;
    private final SpikeDetector spikeDetector;
    private final TrendAnalyzer trendAnalyzer;
    private final Forecaster forecaster;
    private final AnalysisSummaryFormatter formatter;
    private final CostAnalyticsProperties properties;

    public CostAnalysisController(
            SeriesValidator seriesValidator,
            BaselineEstimator baselineEstimator,
            SpikeDetector spikeDetector,
            TrendAnalyzer trendAnalyzer,
            Forecaster forecaster,
            AnalysisSummaryFormatter formatter,
            CostAnalyticsProperties properties
    ) {
        this.seriesValidator = seriesValidator;
        this.baselineEstimator = baselineEstimator;
        this.spikeDetector = spikeDetector;
        this.trendAnalyzer = trendAnalyzer;
        this.forecaster = forecaster;
        this.formatter = formatter;
        this.properties = properties;
    }

    @PostMapping("/baseline")
    public ResponseEntity<BaselineResponseDto> baseline(@Valid @RequestBody BaselineRequestDto request) {
        int windowDays = Optional.ofNullable(request.windowDays()).orElse(properties.baseline().windowDays());
        baselineEstimator.checkWindow(windowDays);
        CostSeries series = seriesValidator.validate(request.history(), SeriesValidator.BASELINE_MINIMUM);
        BaselineModel baseline = baselineEstimator.estimate(
                series,
                windowDays,
                Optional.ofNullable(request.enableSeasonal()).orElse(properties.baseline().seasonalAdjustment())
        );
        logRequest("baseline", series);
        return ResponseEntity.ok(new BaselineResponseDto(
                toDto(baseline),
                metadata(series),
                formatter.describe(baseline),
                traceId()
        ));
    }

    @PostMapping("/spike")
    public ResponseEntity<SpikeResponseDto> spike(@Valid @RequestBody SpikeRequestDto request) {
        SpikeResult result = spikeDetector.detect(
                request.currentValue(),
                toModel(request.baseline()),
                Optional.ofNullable(request.thresholdPercent()).orElse(properties.spike().thresholdPercent()),
                Optional.ofNullable(request.zThreshold()).orElse(properties.spike().zThreshold())
        );
        log.info("analysis_request endpoint=spike series={} isSpike={} severity={}",
                seriesKey(), result.isSpike(), result.severity());
        return ResponseEntity.ok(new SpikeResponseDto(
                result.isSpike(),
                result.currentValue(),
                result.baselineMean(),
                result.deviationAmount(),
                result.deviationPercent(),
                result.zScore(),
                result.severity().name(),
                result.confidence(),
                result.withinCi95(),
                result.withinCi99(),
                result.percentThresholdExceeded(),
                result.zScoreThresholdExceeded(),
                result.thresholdPercent(),
                result.zThreshold(),
                formatter.describe(result),
                traceId()
        ));
    }

    @PostMapping("/trend")
    public ResponseEntity<TrendResponseDto> trend(@Valid @RequestBody TrendRequestDto request) {
        int lookbackDays = Optional.ofNullable(request.lookbackDays()).orElse(properties.trend().lookbackDays());
        double minSlopeThreshold = Optional.ofNullable(request.minSlopeThreshold()).orElse(properties.trend().minSlopeThreshold());
        trendAnalyzer.checkParameters(lookbackDays, minSlopeThreshold);
        CostSeries series = seriesValidator.validate(request.history(), SeriesValidator.TREND_MINIMUM);
        TrendResult result = trendAnalyzer.analyze(series, lookbackDays, minSlopeThreshold);
        logRequest("trend", series);
        TrendResult.AnalysisPeriod period = result.analysisPeriod();
        return ResponseEntity.ok(new TrendResponseDto(
                result.direction().name(),
                result.slope(),
                result.intercept(),
                result.rSquared(),
                result.fitQuality().name(),
                result.isSignificant(),
                result.confidence(),
                new TrendResponseDto.Projections(result.projection7(), result.projection30(), result.projection90()),
                new TrendResponseDto.AnalysisPeriod(
                        result.daysAnalyzed(),
                        period.range().start(),
                        period.range().end(),
                        period.startCost(),
                        period.endCost(),
                        period.totalChange()
                ),
                metadata(series),
                formatter.describe(result),
                traceId()
        ));
    }

    @PostMapping("/forecast")
    public ResponseEntity<ForecastResponseDto> forecast(@Valid @RequestBody ForecastRequestDto request) {
        int forecastDays = Optional.ofNullable(request.forecastDays()).orElse(properties.forecast().forecastDays());
        double confidenceLevel = Optional.ofNullable(request.confidenceLevel()).orElse(properties.forecast().confidenceLevel());
        forecaster.checkParameters(forecastDays, confidenceLevel);
        CostSeries series = seriesValidator.validate(request.history(), SeriesValidator.FORECAST_MINIMUM);
        ForecastResult result = forecaster.forecast(series, forecastDays, confidenceLevel);
        logRequest("forecast", series);
        return ResponseEntity.ok(new ForecastResponseDto(
                result.points().stream()
                        .map(point -> new ForecastResponseDto.Point(
                                point.date(),
                                point.dayOffset(),
                                point.pointEstimate(),
                                point.lowerBound(),
                                point.upperBound()))
                        .toList(),
                result.totalForecast(),
                result.averageDailyForecast(),
                result.percentChangeVsHistorical(),
                result.monthlyProjection()
                        .map(monthly -> new ForecastResponseDto.MonthlyProjection(monthly.total(), monthly.lower(), monthly.upper()))
                        .orElse(null),
                new ForecastResponseDto.TrendAnalysis(
                        result.trendDirection().name(),
                        result.trendStrength().name(),
                        result.slope(),
                        result.intercept(),
                        result.rSquared()
                ),
                new ForecastResponseDto.HistoricalBaseline(
                        result.daysAnalyzed(),
                        result.historicalMean(),
                        result.historicalStdDeviation(),
                        result.historyRange().start(),
                        result.historyRange().end()
                ),
                result.confidenceLevel().level(),
                result.riskFlags().stream().map(Enum::name).sorted().toList(),
                metadata(series),
                formatter.describe(result),
                traceId()
        ));
    }

    private BaselineDto toDto(BaselineModel baseline) {
        return new BaselineDto(
                baseline.mean(),
                baseline.stdDeviation(),
                baseline.seasonalFactors(),
                new ConfidenceBandDto(baseline.ci95().lower(), baseline.ci95().upper()),
                new ConfidenceBandDto(baseline.ci99().lower(), baseline.ci99().upper()),
                baseline.coefficientOfVariation(),
                baseline.stability().name(),
                baseline.sampleSize(),
                baseline.windowSpan().start(),
                baseline.windowSpan().end(),
                baseline.seasonalAdjusted()
        );
    }

    /**
     * Rebuilds a baseline from its wire form. Missing bands are derived from mean and standard
     * deviation the same way the estimator derives them.
     */
    private BaselineModel toModel(BaselineDto dto) {
        if (dto == null) {
            throw new MalformedBaselineException("baseline must be provided");
        }
        if (dto.mean() == null || dto.stdDeviation() == null) {
            throw new MalformedBaselineException("baseline must contain 'mean' and 'stdDeviation'");
        }
        double mean = dto.mean();
        double stdDeviation = dto.stdDeviation();
        double cv = Optional.ofNullable(dto.coefficientOfVariation())
                .orElse(mean > 0 ? stdDeviation / mean * 100 : 0d);
        return new BaselineModel(
                mean,
                stdDeviation,
                dto.seasonalFactors(),
                band(dto.ci95(), mean, stdDeviation, 2),
                band(dto.ci99(), mean, stdDeviation, 3),
                cv,
                BaselineModel.Stability.fromCoefficientOfVariation(cv),
                Optional.ofNullable(dto.sampleSize()).orElse(0),
                null,
                Boolean.TRUE.equals(dto.seasonalAdjusted())
        );
    }

    private ConfidenceBand band(ConfidenceBandDto dto, double mean, double stdDeviation, int width) {
        double lower = dto != null && dto.lower() != null ? dto.lower() : Math.max(0, mean - width * stdDeviation);
        double upper = dto != null && dto.upper() != null ? dto.upper() : mean + width * stdDeviation;
        return new ConfidenceBand(lower, upper);
    }

    private SeriesMetadataDto metadata(CostSeries series) {
        return new SeriesMetadataDto(series.size(), series.skippedCount(), series.duplicatesReplaced(), series.rejected());
    }

    private void logRequest(String endpoint, CostSeries series) {
        log.info("analysis_request endpoint={} series={} valid={} skipped={} duplicatesReplaced={}",
                endpoint, seriesKey(), series.size(), series.skippedCount(), series.duplicatesReplaced());
    }

    private String seriesKey() {
        return RequestContextHolder.get().map(RequestContextHolder.RequestContext::seriesKey).orElse(null);
    }

    private String traceId() {
        return RequestContextHolder.traceId().orElse(null);
    }
}
