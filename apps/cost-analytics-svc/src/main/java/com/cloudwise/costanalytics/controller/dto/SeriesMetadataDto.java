package com.cloudwise.costanalytics.controller.dto;

import com.cloudwise.costanalytics.model.RejectedEntry;
import java.util.List;

public record SeriesMetadataDto(
        int validEntries,
        int skippedEntries,
        int duplicatesReplaced,
        List<RejectedEntry> rejected
) {
}
