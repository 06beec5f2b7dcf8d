package com.cloudwise.costanalytics.analytics;

import com.cloudwise.costanalytics.config.CostAnalyticsProperties;
import com.cloudwise.costanalytics.model.BaselineModel;
import com.cloudwise.costanalytics.model.SpikeResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Compares one observed cost against a baseline. A spike needs both the percentage test and the
 * z-score test to fire; severity is graded on the percentage deviation alone.
 */
@Component
public class SpikeDetector {

    private static final Logger log = LoggerFactory.getLogger(SpikeDetector.class);

    private final CostAnalyticsProperties.Spike defaults;

    public SpikeDetector(CostAnalyticsProperties properties) {
        this.defaults = properties.spike();
    }

    public SpikeResult detect(double currentValue, BaselineModel baseline) {
        return detect(currentValue, baseline, defaults.thresholdPercent(), defaults.zThreshold());
    }

    public SpikeResult detect(double currentValue, BaselineModel baseline, double thresholdPercent, double zThreshold) {
        if (!Double.isFinite(currentValue) || currentValue < 0) {
            throw new InvalidParameterException("currentValue", currentValue, "must be a non-negative number");
        }
        if (!Double.isFinite(thresholdPercent) || thresholdPercent <= 0) {
            throw new InvalidParameterException("thresholdPercent", thresholdPercent, "must be greater than zero");
        }
        if (!Double.isFinite(zThreshold) || zThreshold <= 0) {
            throw new InvalidParameterException("zThreshold", zThreshold, "must be greater than zero");
        }
        requireWellFormed(baseline);

        double mean = baseline.mean();
        double stdDeviation = baseline.stdDeviation();

        double deviationPercent;
        if (mean == 0) {
            deviationPercent = currentValue > 0 ? 100.0 : 0.0;
        } else {
            deviationPercent = (currentValue - mean) / mean * 100;
        }

        double zScore;
        if (stdDeviation == 0) {
            zScore = currentValue == mean ? 0.0 : Double.POSITIVE_INFINITY;
        } else {
            zScore = (currentValue - mean) / stdDeviation;
        }

        boolean percentExceeded = deviationPercent > thresholdPercent;
        boolean zScoreExceeded = zScore > zThreshold;
        boolean isSpike = percentExceeded && zScoreExceeded;

        double zConfidence = Math.min(100, Math.abs(zScore) / zThreshold * 50);
        double percentConfidence = Math.min(100, deviationPercent / thresholdPercent * 50);
        double confidence = Math.max(0, Math.min(100, (zConfidence + percentConfidence) / 2));

        SpikeResult.Severity severity = SpikeResult.Severity.fromDeviationPercent(deviationPercent);
        if (isSpike) {
            log.info("spike_detected current={} mean={} deviationPercent={} zScore={} severity={}",
                    currentValue, mean, deviationPercent, zScore, severity);
        }
        return new SpikeResult(
                isSpike,
                currentValue,
                mean,
                currentValue - mean,
                deviationPercent,
                zScore,
                severity,
                confidence,
                baseline.ci95().contains(currentValue),
                baseline.ci99().contains(currentValue),
                percentExceeded,
                zScoreExceeded,
                thresholdPercent,
                zThreshold
        );
    }

    private void requireWellFormed(BaselineModel baseline) {
        if (baseline == null) {
            throw new MalformedBaselineException("baseline must be provided");
        }
        if (!Double.isFinite(baseline.mean()) || baseline.mean() < 0) {
            throw new MalformedBaselineException("baseline mean must be a non-negative number, was " + baseline.mean());
        }
        if (!Double.isFinite(baseline.stdDeviation()) || baseline.stdDeviation() < 0) {
            throw new MalformedBaselineException("baseline stdDeviation must be a non-negative number, was " + baseline.stdDeviation());
        }
    }
}
