package com.permit.resolution.store;

/**
 * Thrown when the backing store cannot be read or written.
 * Fatal for a run: the run aborts and nothing it staged is published.
 */
public class StorageUnavailableException extends RuntimeException {

    public StorageUnavailableException(String message) {
        super(message);
    }

    public StorageUnavailableException(String message, Throwable cause) {
        super(message, cause);
    }
}
