package com.cloudwise.costanalytics.controller.dto;

import com.cloudwise.costanalytics.model.RawCostEntry;
import jakarta.validation.constraints.NotNull;
import java.util.List;

public record BaselineRequestDto(
        @NotNull List<RawCostEntry> history,
        Integer windowDays,
        Boolean enableSeasonal
) {
}
