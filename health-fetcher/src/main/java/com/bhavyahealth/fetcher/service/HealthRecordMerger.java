package com.bhavyahealth.fetcher.service;

import com.bhavyahealth.fetcher.model.DateKey;
import com.bhavyahealth.fetcher.model.EndpointResult;
import com.bhavyahealth.fetcher.model.EndpointSpec;
import com.bhavyahealth.fetcher.model.FieldMapping;
import com.bhavyahealth.fetcher.model.HealthColumns;
import com.bhavyahealth.fetcher.model.HealthRecord;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.time.format.TextStyle;
import java.util.Collection;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Folds the endpoint results of one date into a {@link HealthRecord}.
 *
 * Never fails: a column whose endpoint failed, was not called, or returned a junk value
 * ends up as {@link HealthRecord#NOT_AVAILABLE}. Derived columns are always set.
 */
@Component
@Slf4j
@RequiredArgsConstructor
public class HealthRecordMerger {

    static final String STATE_NAME = "Bihar";
    static final String FOCUS_AREA = "State Health System Performance";
    static final String SOURCE = "Bhavya";

    private static final DateTimeFormatter FETCHED_AT_FORMAT = DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm:ss");

    /** Placeholder strings the API uses for "no data" */
    private static final Set<String> MISSING_TOKENS = Set.of(
            "null", "none", "nan", "not found", "notfound", "n/a", "na", "-");

    private final EndpointCatalog catalog;
    private final Clock clock;

    public HealthRecord merge(DateKey date, Collection<EndpointResult> results) {
        Map<String, EndpointResult> byEndpoint = new HashMap<>();
        for (EndpointResult r : results) {
            if (r != null) byEndpoint.put(r.endpoint().id(), r);
        }

        Map<String, Optional<String>> values = new LinkedHashMap<>();
        for (String column : HealthColumns.ALL) {
            values.put(column, Optional.empty());
        }

        for (EndpointSpec endpoint : catalog.all()) {
            EndpointResult result = byEndpoint.get(endpoint.id());
            if (result == null || !result.isSuccess()) continue;

            for (FieldMapping mapping : endpoint.fields()) {
                values.put(mapping.column(), resolve(result, mapping));
            }
        }

        LocalDateTime fetchedAt = LocalDateTime.now(clock).withNano(0);
        values.put(HealthColumns.DATA_DATE, Optional.of(date.toString()));
        values.put(HealthColumns.STATE_NAME, Optional.of(STATE_NAME));
        values.put(HealthColumns.FOCUS_AREA, Optional.of(FOCUS_AREA));
        values.put(HealthColumns.YEAR, Optional.of(String.valueOf(date.date().getYear())));
        values.put(HealthColumns.MONTH, Optional.of(date.date().getMonth().getDisplayName(TextStyle.FULL, Locale.ENGLISH)));
        values.put(HealthColumns.START_DATE, Optional.of(date.toString()));
        values.put(HealthColumns.END_DATE, Optional.of(date.toString()));
        values.put(HealthColumns.SOURCE, Optional.of(SOURCE));
        values.put(HealthColumns.FETCHED_AT, Optional.of(fetchedAt.format(FETCHED_AT_FORMAT)));

        Map<String, String> columns = new LinkedHashMap<>();
        values.forEach((column, value) -> columns.put(column, value.orElse(HealthRecord.NOT_AVAILABLE)));

        HealthRecord record = new HealthRecord(date, fetchedAt, columns);
        log.debug("Merged {}: {} of {} columns unavailable",
                date, record.unavailableCount(), HealthColumns.ALL.size());
        return record;
    }

    private Optional<String> resolve(EndpointResult result, FieldMapping mapping) {
        for (String key : mapping.sourceKeys()) {
            Optional<String> value = result.value(key).flatMap(HealthRecordMerger::clean);
            if (value.isPresent() && mapping.zeroMeansMissing() && isZero(value.get())) {
                value = Optional.empty();
            }
            if (value.isPresent()) return value;
        }
        return Optional.empty();
    }

    static Optional<String> clean(String raw) {
        if (raw == null) return Optional.empty();
        String trimmed = raw.trim();
        if (trimmed.isEmpty() || MISSING_TOKENS.contains(trimmed.toLowerCase(Locale.ROOT))) {
            return Optional.empty();
        }
        return Optional.of(trimmed);
    }

    private static boolean isZero(String value) {
        return value.equals("0") || value.equals("0.0");
    }
}
