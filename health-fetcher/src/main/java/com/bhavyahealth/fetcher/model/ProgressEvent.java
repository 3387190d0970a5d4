package com.bhavyahealth.fetcher.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonValue;
import lombok.Builder;
import lombok.Value;

/**
 * One unit of the progress stream. Serialized as a flat JSON object keyed by "type".
 */
@Value
@Builder
@JsonInclude(JsonInclude.Include.NON_NULL)
public class ProgressEvent {

    public enum Type {
        STARTED, ENDPOINT_DONE, DATE_DONE, DATE_SKIPPED, BATCH_DONE;

        @JsonValue
        public String wireName() {
            return name().toLowerCase();
        }
    }

    Type type;
    String date;
    Integer dateIndex;      // 1-based position in the request
    Integer totalDates;
    String endpoint;
    Boolean ok;
    FailureKind failureKind;
    String message;
    String reason;
    DateSummary summary;
    BatchSummary batch;

    public static ProgressEvent started(DateKey date, int dateIndex, int totalDates) {
        return ProgressEvent.builder()
                .type(Type.STARTED)
                .date(date.toString())
                .dateIndex(dateIndex)
                .totalDates(totalDates)
                .build();
    }

    public static ProgressEvent endpointDone(DateKey date, EndpointResult result) {
        return ProgressEvent.builder()
                .type(Type.ENDPOINT_DONE)
                .date(date.toString())
                .endpoint(result.endpoint().id())
                .ok(result.isSuccess())
                .failureKind(result.failureKind())
                .message(result.message())
                .build();
    }

    public static ProgressEvent dateDone(DateKey date, int dateIndex, int totalDates, DateSummary summary) {
        return ProgressEvent.builder()
                .type(Type.DATE_DONE)
                .date(date.toString())
                .dateIndex(dateIndex)
                .totalDates(totalDates)
                .summary(summary)
                .build();
    }

    public static ProgressEvent dateSkipped(DateKey date, int dateIndex, int totalDates, String reason) {
        return ProgressEvent.builder()
                .type(Type.DATE_SKIPPED)
                .date(date.toString())
                .dateIndex(dateIndex)
                .totalDates(totalDates)
                .reason(reason)
                .build();
    }

    public static ProgressEvent batchDone(BatchSummary batch) {
        return ProgressEvent.builder()
                .type(Type.BATCH_DONE)
                .batch(batch)
                .build();
    }

    public boolean isTerminalForDate() {
        return type == Type.DATE_DONE || type == Type.DATE_SKIPPED;
    }
}
