package com.entity.datamining.store;

/**
 * Runtime exception thrown when the underlying entity storage fails.
 * Distinct from a "not found" outcome, which is reported through return values.
 */
public class StorageException extends RuntimeException {

    public StorageException(String message) {
        super(message);
    }

    public StorageException(String message, Throwable cause) {
        super(message, cause);
    }
}
