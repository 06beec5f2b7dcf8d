package com.cloudwise.costanalytics.controller.dto;

import com.fasterxml.jackson.annotation.JsonProperty;

public record SpikeResponseDto(
        @JsonProperty("isSpike") boolean isSpike,
        double currentValue,
        double baselineMean,
        double deviationAmount,
        double deviationPercent,
        double zScore,
        String severity,
        double confidence,
        boolean withinCi95,
        boolean withinCi99,
        boolean percentThresholdExceeded,
        boolean zScoreThresholdExceeded,
        double thresholdPercent,
        double zThreshold,
        String summary,
        String traceId
) {
}
