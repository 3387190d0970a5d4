package com.bhavyahealth.fetcher.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.Builder;
import lombok.Value;

import java.util.Map;

/**
 * Totals carried by the final batch_done event.
 */
@Value
@Builder
@JsonInclude(JsonInclude.Include.NON_NULL)
public class BatchSummary {

    String jobId;
    int requested;
    int processed;          // dates fetched and persisted
    int skipped;            // dates already stored
    int errored;            // dates fetched but not persisted
    boolean cancelled;
    int endpointFailures;
    Map<String, Integer> endpointFailuresByDate;
    Long totalRecords;      // null when the count could not be read
    String error;           // unexpected orchestrator failure, normally null
}
