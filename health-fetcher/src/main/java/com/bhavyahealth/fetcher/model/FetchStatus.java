package com.bhavyahealth.fetcher.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.Builder;
import lombok.Value;

import java.util.List;

@Value
@Builder
@JsonInclude(JsonInclude.Include.NON_NULL)
public class FetchStatus {

    String status;
    String database;        // connected | disconnected
    boolean tableExists;
    String tableName;
    long recordCount;
    String lastFetchedAt;   // null while the table is empty
    List<String> recentDates;
    int endpointCount;
    String error;
}
