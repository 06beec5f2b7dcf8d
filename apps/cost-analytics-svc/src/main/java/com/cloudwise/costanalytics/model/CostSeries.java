package com.cloudwise.costanalytics.model;

import java.time.LocalDate;
import java.util.List;
import java.util.Objects;

/**
 * Validated daily cost series for a single resource. Dates are strictly ascending and unique and
 * every cost is non-negative. {@link #rejected()} and {@link #duplicatesReplaced()} describe what
 * the validator dropped on the way in.
 */
public record CostSeries(
        List<CostObservation> observations,
        List<RejectedEntry> rejected,
        int duplicatesReplaced
) {
    public CostSeries {
        observations = List.copyOf(Objects.requireNonNull(observations, "observations"));
        rejected = rejected == null ? List.of() : List.copyOf(rejected);
        for (int i = 1; i < observations.size(); i++) {
            LocalDate previous = observations.get(i - 1).date();
            LocalDate current = observations.get(i).date();
            if (!current.isAfter(previous)) {
                throw new IllegalArgumentException("observation dates must be strictly ascending: "
                        + previous + " followed by " + current);
            }
        }
    }

    public static CostSeries of(List<CostObservation> observations) {
        return new CostSeries(observations, List.of(), 0);
    }

    public int size() {
        return observations.size();
    }

    public boolean isEmpty() {
        return observations.isEmpty();
    }

    public int skippedCount() {
        return rejected.size();
    }

    public double[] costs() {
        return observations.stream().mapToDouble(CostObservation::costValue).toArray();
    }

    /** The most recent {@code count} observations, or the whole series when it is shorter. */
    public CostSeries tail(int count) {
        if (count >= observations.size()) {
            return this;
        }
        return new CostSeries(observations.subList(observations.size() - count, observations.size()), rejected, duplicatesReplaced);
    }

    public LocalDate firstDate() {
        return observations.get(0).date();
    }

    public LocalDate lastDate() {
        return observations.get(observations.size() - 1).date();
    }

    public DateRange dateRange() {
        return new DateRange(firstDate(), lastDate());
    }
}
