package com.cloudwise.costanalytics.model;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.Objects;
import java.util.Optional;

public record CostObservation(
        LocalDate date,
        BigDecimal cost,
        Optional<String> currency
) {
    public CostObservation {
        Objects.requireNonNull(date, "date");
        Objects.requireNonNull(cost, "cost");
        if (cost.signum() < 0) {
            throw new IllegalArgumentException("cost must not be negative: " + cost);
        }
        currency = currency == null ? Optional.empty() : currency;
    }

    public static CostObservation of(LocalDate date, double cost) {
        return new CostObservation(date, BigDecimal.valueOf(cost), Optional.empty());
    }

    public double costValue() {
        return cost.doubleValue();
    }
}
