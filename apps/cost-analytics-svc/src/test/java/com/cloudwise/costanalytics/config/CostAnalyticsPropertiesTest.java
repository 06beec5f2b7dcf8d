package com.cloudwise.costanalytics.config;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import org.junit.jupiter.api.Test;

class CostAnalyticsPropertiesTest {

    @Test
    void defaultsApplyWhenSectionsAreMissing() {
        CostAnalyticsProperties properties = CostAnalyticsProperties.defaults();

        assertThat(properties.baseline().windowDays()).isEqualTo(30);
        assertThat(properties.baseline().seasonalAdjustment()).isTrue();
        assertThat(properties.spike().thresholdPercent()).isEqualTo(20.0);
        assertThat(properties.spike().zThreshold()).isEqualTo(2.0);
        assertThat(properties.trend().lookbackDays()).isEqualTo(14);
        assertThat(properties.trend().minSlopeThreshold()).isEqualTo(5.0);
        assertThat(properties.forecast().forecastDays()).isEqualTo(30);
        assertThat(properties.forecast().confidenceLevel()).isEqualTo(0.80);
    }

    @Test
    void partialSectionKeepsOtherDefaults() {
        CostAnalyticsProperties.Spike spike = new CostAnalyticsProperties.Spike(35.0, null);

        assertThat(spike.thresholdPercent()).isEqualTo(35.0);
        assertThat(spike.zThreshold()).isEqualTo(2.0);
    }

    @Test
    void rejectsOutOfRangeValues() {
        assertThatThrownBy(() -> new CostAnalyticsProperties.Baseline(6, true))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("windowDays");
        assertThatThrownBy(() -> new CostAnalyticsProperties.Spike(0.0, 2.0))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> new CostAnalyticsProperties.Trend(14, -1.0))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> new CostAnalyticsProperties.Forecast(91, 0.80))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> new CostAnalyticsProperties.Forecast(30, 0.85))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("confidenceLevel");
    }
}
