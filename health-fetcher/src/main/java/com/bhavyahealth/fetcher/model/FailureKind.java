package com.bhavyahealth.fetcher.model;

public enum FailureKind {
    TIMEOUT,
    CONNECTION,
    SERVER_ERROR,
    RATE_LIMITED,
    AUTHENTICATION,
    CLIENT_ERROR,
    MALFORMED_PAYLOAD,
    EMPTY_PAYLOAD,
    INTERRUPTED,
    UNEXPECTED
}
