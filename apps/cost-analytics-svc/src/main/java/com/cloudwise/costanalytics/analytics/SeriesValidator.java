package com.cloudwise.costanalytics.analytics;

import com.cloudwise.costanalytics.model.CostObservation;
import com.cloudwise.costanalytics.model.CostSeries;
import com.cloudwise.costanalytics.model.RawCostEntry;
import com.cloudwise.costanalytics.model.RejectedEntry;
import java.math.BigDecimal;
import java.time.LocalDate;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.TreeMap;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Turns raw date/cost records into a {@link CostSeries}. Malformed records are skipped one by one
 * and reported on the series; only a shortfall of valid records is fatal.
 */
@Component
public class SeriesValidator {

    public static final int BASELINE_MINIMUM = 14;
    public static final int TREND_MINIMUM = 7;
    public static final int FORECAST_MINIMUM = 30;

    private static final Logger log = LoggerFactory.getLogger(SeriesValidator.class);

    public CostSeries validate(List<RawCostEntry> entries, int minimumValid) {
        if (minimumValid < 1) {
            throw new InvalidParameterException("minimumValid", minimumValid, "must be at least 1");
        }
        List<RawCostEntry> candidates = entries == null ? List.of() : entries;
        TreeMap<LocalDate, CostObservation> byDate = new TreeMap<>();
        List<RejectedEntry> rejected = new ArrayList<>();
        int duplicatesReplaced = 0;

        for (int position = 0; position < candidates.size(); position++) {
            RawCostEntry entry = candidates.get(position);
            if (entry == null || isBlank(entry.date()) || isBlank(entry.cost())) {
                rejected.add(new RejectedEntry(position, RejectedEntry.Reason.MISSING_FIELD));
                continue;
            }
            LocalDate date;
            try {
                date = LocalDate.parse(entry.date().trim());
            } catch (DateTimeParseException ex) {
                rejected.add(new RejectedEntry(position, RejectedEntry.Reason.UNPARSEABLE_DATE));
                continue;
            }
            BigDecimal cost;
            try {
                cost = new BigDecimal(entry.cost().trim());
            } catch (NumberFormatException ex) {
                rejected.add(new RejectedEntry(position, RejectedEntry.Reason.NON_NUMERIC_COST));
                continue;
            }
            if (!Double.isFinite(cost.doubleValue())) {
                rejected.add(new RejectedEntry(position, RejectedEntry.Reason.NON_NUMERIC_COST));
                continue;
            }
            if (cost.signum() < 0) {
                rejected.add(new RejectedEntry(position, RejectedEntry.Reason.NEGATIVE_COST));
                continue;
            }
            Optional<String> currency = isBlank(entry.currency()) ? Optional.empty() : Optional.of(entry.currency().trim());
            if (byDate.put(date, new CostObservation(date, cost, currency)) != null) {
                duplicatesReplaced++;
            }
        }

        if (!rejected.isEmpty() || duplicatesReplaced > 0) {
            log.debug("series_validation supplied={} valid={} skipped={} duplicatesReplaced={}",
                    candidates.size(), byDate.size(), rejected.size(), duplicatesReplaced);
        }
        if (byDate.size() < minimumValid) {
            throw new InsufficientDataException(minimumValid, byDate.size());
        }
        return new CostSeries(new ArrayList<>(byDate.values()), rejected, duplicatesReplaced);
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }
}
