package com.bhavyahealth.fetcher.model;

import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

import java.time.LocalDateTime;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Merged row for one date, ready for the health report table.
 *
 * Every column of {@link HealthColumns#ALL} holds either a real value or
 * {@link #NOT_AVAILABLE}; the constructor refuses anything else.
 */
@Getter
@ToString
@EqualsAndHashCode
public final class HealthRecord {

    public static final String NOT_AVAILABLE = "Not Available";

    private final DateKey date;
    private final LocalDateTime fetchedAt;

    /** Column name → value, in {@link HealthColumns#ALL} order */
    private final Map<String, String> columns;

    public HealthRecord(DateKey date, LocalDateTime fetchedAt, Map<String, String> columns) {
        this.date = date;
        this.fetchedAt = fetchedAt;

        Map<String, String> ordered = new LinkedHashMap<>();
        for (String column : HealthColumns.ALL) {
            String value = columns.get(column);
            if (value == null) {
                throw new IllegalStateException("Column " + column + " has no value for " + date);
            }
            ordered.put(column, value);
        }
        if (columns.size() != ordered.size()) {
            throw new IllegalStateException("Undeclared columns for " + date + ": " + columns.keySet());
        }
        this.columns = Collections.unmodifiableMap(ordered);
    }

    public String get(String column) {
        String value = columns.get(column);
        if (value == null) {
            throw new IllegalArgumentException("Unknown column: " + column);
        }
        return value;
    }

    public boolean isAvailable(String column) {
        return !NOT_AVAILABLE.equals(get(column));
    }

    public long unavailableCount() {
        return columns.values().stream().filter(NOT_AVAILABLE::equals).count();
    }
}
