package com.bhavyahealth.fetcher.model;

import java.util.List;

/**
 * One output column fed by an endpoint payload.
 *
 * @param column           target column in {@link HealthColumns}
 * @param sourceKeys       payload keys tried in order, first present value wins
 * @param zeroMeansMissing treat "0" / "0.0" as no data (the ANM count reports 0 when unknown)
 */
public record FieldMapping(String column, List<String> sourceKeys, boolean zeroMeansMissing) {

    public FieldMapping {
        if (!HealthColumns.isDeclared(column)) {
            throw new IllegalArgumentException("Undeclared column: " + column);
        }
        if (sourceKeys == null || sourceKeys.isEmpty()) {
            throw new IllegalArgumentException("No source key for column " + column);
        }
        sourceKeys = List.copyOf(sourceKeys);
    }

    public static FieldMapping field(String column, String... sourceKeys) {
        return new FieldMapping(column, List.of(sourceKeys), false);
    }

    public static FieldMapping nonZeroField(String column, String... sourceKeys) {
        return new FieldMapping(column, List.of(sourceKeys), true);
    }
}
