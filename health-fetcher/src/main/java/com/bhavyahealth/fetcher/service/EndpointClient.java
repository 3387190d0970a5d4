package com.bhavyahealth.fetcher.service;

import com.bhavyahealth.fetcher.model.DateKey;
import com.bhavyahealth.fetcher.model.EndpointResult;
import com.bhavyahealth.fetcher.model.EndpointSpec;

/**
 * Fetches one data point for one date. Implementations never throw: every outcome,
 * including exhausted retries, comes back as an {@link EndpointResult}.
 */
public interface EndpointClient {

    EndpointResult fetch(DateKey date, EndpointSpec endpoint);
}
