package com.bhavyahealth.fetcher.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.Builder;
import lombok.Value;

import java.util.List;

@Value
@Builder
@JsonInclude(JsonInclude.Include.NON_NULL)
public class DateSummary {

    String date;
    int succeeded;
    int failed;
    List<String> failedEndpoints;
    boolean persisted;
    String error;           // null unless persistence failed
}
