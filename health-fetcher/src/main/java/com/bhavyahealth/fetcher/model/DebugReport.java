package com.bhavyahealth.fetcher.model;

import lombok.Builder;
import lombok.Value;

import java.util.List;
import java.util.Map;

/**
 * Connection diagnostics. Every check runs even when an earlier one failed; failures are
 * collected in {@link #errors}.
 */
@Value
@Builder
public class DebugReport {

    Map<String, String> config;
    boolean connection;
    String tableCheck;      // exists | not found, null if the check failed
    Long recordCount;
    List<String> errors;
}
