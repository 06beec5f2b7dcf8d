package com.cloudwise.costanalytics.controller.dto;

import com.cloudwise.costanalytics.model.RawCostEntry;
import jakarta.validation.constraints.NotNull;
import java.util.List;

public record ForecastRequestDto(
        @NotNull List<RawCostEntry> history,
        Integer forecastDays,
        Double confidenceLevel
) {
}
