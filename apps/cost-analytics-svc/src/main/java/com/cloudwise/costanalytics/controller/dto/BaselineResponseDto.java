package com.cloudwise.costanalytics.controller.dto;

public record BaselineResponseDto(
        BaselineDto baseline,
        SeriesMetadataDto series,
        String summary,
        String traceId
) {
}
