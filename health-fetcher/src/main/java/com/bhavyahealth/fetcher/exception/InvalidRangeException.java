package com.bhavyahealth.fetcher.exception;

public class InvalidRangeException extends RuntimeException {

    public InvalidRangeException(String message) {
        super(message);
    }
}
