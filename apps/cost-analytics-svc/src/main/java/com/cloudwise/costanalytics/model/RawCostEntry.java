package com.cloudwise.costanalytics.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.databind.JsonNode;

/**
 * Untyped cost record as supplied by the cost data collaborator. Any field may be missing or
 * unparseable; only {@code SeriesValidator} turns these into {@link CostObservation}s.
 */
public record RawCostEntry(String date, String cost, String currency) {

    public static RawCostEntry of(String date, String cost) {
        return new RawCostEntry(date, cost, null);
    }

    /**
     * Reads one history element from JSON without failing on its shape. Scalars keep their text,
     * objects and arrays keep their JSON text so they are rejected per entry, and an element that is
     * not an object yields an entry with every field missing.
     */
    @JsonCreator(mode = JsonCreator.Mode.DELEGATING)
    public static RawCostEntry fromJson(JsonNode node) {
        if (node == null || !node.isObject()) {
            return new RawCostEntry(null, null, null);
        }
        return new RawCostEntry(text(node.get("date")), text(node.get("cost")), text(node.get("currency")));
    }

    private static String text(JsonNode field) {
        if (field == null || field.isNull() || field.isMissingNode()) {
            return null;
        }
        return field.isValueNode() ? field.asText() : field.toString();
    }
}
