package com.bhavyahealth.fetcher.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.Builder;
import lombok.Value;

/**
 * Outcome of an on-demand table setup.
 */
@Value
@Builder
@JsonInclude(JsonInclude.Include.NON_NULL)
public class TableSetup {

    boolean success;
    String message;
    Boolean tableCreated;   // null when the database could not be reached
    Long recordCount;
}
