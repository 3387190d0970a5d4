package com.bhavyahealth.fetcher.exception;

import com.bhavyahealth.fetcher.model.FailureKind;
import lombok.Getter;

/**
 * A call that may succeed if repeated: I/O failure, timeout, 5xx, 429 or an expired token.
 * Retried inside the API client and never seen above it.
 */
@Getter
public class TransientEndpointException extends RuntimeException {

    private final FailureKind kind;

    public TransientEndpointException(FailureKind kind, String message) {
        super(message);
        this.kind = kind;
    }

    public TransientEndpointException(FailureKind kind, String message, Throwable cause) {
        super(message, cause);
        this.kind = kind;
    }
}
