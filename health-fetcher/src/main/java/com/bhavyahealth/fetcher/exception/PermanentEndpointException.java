package com.bhavyahealth.fetcher.exception;

import com.bhavyahealth.fetcher.model.FailureKind;
import lombok.Getter;

/**
 * A call that repeating will not fix. Ends up as a failed EndpointResult.
 */
@Getter
public class PermanentEndpointException extends RuntimeException {

    private final FailureKind kind;

    public PermanentEndpointException(FailureKind kind, String message) {
        super(message);
        this.kind = kind;
    }

    public PermanentEndpointException(FailureKind kind, String message, Throwable cause) {
        super(message, cause);
        this.kind = kind;
    }
}
