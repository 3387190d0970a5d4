package com.bhavyahealth.fetcher.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Outcome of one call for one date: either the payload's scalar fields or a failure.
 */
public final class EndpointResult {

    private final EndpointSpec endpoint;
    private final Map<String, String> values;
    private final FailureKind failureKind;
    private final String message;

    private EndpointResult(EndpointSpec endpoint, Map<String, String> values,
                           FailureKind failureKind, String message) {
        this.endpoint = Objects.requireNonNull(endpoint, "endpoint");
        this.values = values;
        this.failureKind = failureKind;
        this.message = message;
    }

    public static EndpointResult success(EndpointSpec endpoint, Map<String, String> values) {
        return new EndpointResult(endpoint,
                Collections.unmodifiableMap(new LinkedHashMap<>(values)), null, null);
    }

    public static EndpointResult failure(EndpointSpec endpoint, FailureKind kind, String message) {
        return new EndpointResult(endpoint, null, Objects.requireNonNull(kind, "kind"), message);
    }

    public EndpointSpec endpoint() {
        return endpoint;
    }

    public boolean isSuccess() {
        return failureKind == null;
    }

    /** Raw payload value for a key; empty for failures and absent keys. */
    public Optional<String> value(String key) {
        return isSuccess() ? Optional.ofNullable(values.get(key)) : Optional.empty();
    }

    public FailureKind failureKind() {
        return failureKind;
    }

    public String message() {
        return message;
    }

    @Override
    public String toString() {
        return isSuccess()
                ? "EndpointResult[" + endpoint.id() + " ok " + values.size() + " fields]"
                : "EndpointResult[" + endpoint.id() + " " + failureKind + ": " + message + "]";
    }
}
