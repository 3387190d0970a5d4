package com.bhavyahealth.fetcher.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * Static description of one remote data point.
 * The path is the segment appended to the API base URL; no credentials live here.
 */
public record EndpointSpec(
        @JsonProperty("name") String id,
        @JsonProperty("endpoint") String path,
        @JsonProperty("desc") String description,
        @JsonIgnore List<FieldMapping> fields) {

    public EndpointSpec {
        fields = List.copyOf(fields);
    }

    public static EndpointSpec endpoint(String id, String path, String description, FieldMapping... fields) {
        return new EndpointSpec(id, path, description, List.of(fields));
    }
}
