package com.cloudwise.costanalytics.controller.dto;

import jakarta.validation.constraints.NotNull;

public record SpikeRequestDto(
        @NotNull Double currentValue,
        BaselineDto baseline,
        Double thresholdPercent,
        Double zThreshold
) {
}
