package com.cloudwise.costanalytics.config;

import com.cloudwise.costanalytics.model.ConfidenceLevel;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.ConstructorBinding;

/**
 * Default parameters applied when a caller does not supply its own. Every section is optional;
 * missing values fall back to the documented defaults.
 */
@ConfigurationProperties(prefix = "costanalytics")
public record CostAnalyticsProperties(
        Baseline baseline,
        Spike spike,
        Trend trend,
        Forecast forecast
) {

    @ConstructorBinding
    public CostAnalyticsProperties {
        baseline = baseline == null ? new Baseline(null, null) : baseline;
        spike = spike == null ? new Spike(null, null) : spike;
        trend = trend == null ? new Trend(null, null) : trend;
        forecast = forecast == null ? new Forecast(null, null) : forecast;
    }

    public static CostAnalyticsProperties defaults() {
        return new CostAnalyticsProperties(null, null, null, null);
    }

    public record Baseline(Integer windowDays, Boolean seasonalAdjustment) {
        public Baseline {
            if (windowDays == null) windowDays = 30;
            if (seasonalAdjustment == null) seasonalAdjustment = true;
            if (windowDays < 7) {
                throw new IllegalArgumentException("baseline.windowDays must be at least 7");
            }
        }
    }

    public record Spike(Double thresholdPercent, Double zThreshold) {
        public Spike {
            if (thresholdPercent == null) thresholdPercent = 20.0;
            if (zThreshold == null) zThreshold = 2.0;
            if (!(thresholdPercent > 0)) {
                throw new IllegalArgumentException("spike.thresholdPercent must be greater than zero");
            }
            if (!(zThreshold > 0)) {
                throw new IllegalArgumentException("spike.zThreshold must be greater than zero");
            }
        }
    }

    public record Trend(Integer lookbackDays, Double minSlopeThreshold) {
        public Trend {
            if (lookbackDays == null) lookbackDays = 14;
            if (minSlopeThreshold == null) minSlopeThreshold = 5.0;
            if (lookbackDays < 7) {
                throw new IllegalArgumentException("trend.lookbackDays must be at least 7");
            }
            if (!(minSlopeThreshold >= 0)) {
                throw new IllegalArgumentException("trend.minSlopeThreshold must not be negative");
            }
        }
    }

    public record Forecast(Integer forecastDays, Double confidenceLevel) {
        public Forecast {
            if (forecastDays == null) forecastDays = 30;
            if (confidenceLevel == null) confidenceLevel = 0.80;
            if (forecastDays < 1 || forecastDays > 90) {
                throw new IllegalArgumentException("forecast.forecastDays must be between 1 and 90");
            }
            if (ConfidenceLevel.fromLevel(confidenceLevel).isEmpty()) {
                throw new IllegalArgumentException("forecast.confidenceLevel must be one of 0.80, 0.90, 0.95, 0.99");
            }
        }
    }
}
