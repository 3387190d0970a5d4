package com.bhavyahealth.fetcher.exception;

/**
 * Upsert of one date failed. Reported on that date's date_done event; the batch goes on.
 */
public class StoragePersistException extends StorageException {

    public StoragePersistException(String message, Throwable cause) {
        super(message, cause);
    }
}
