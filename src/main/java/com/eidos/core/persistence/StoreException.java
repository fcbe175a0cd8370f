package com.eidos.core.persistence;

/**
 * Raised when a write to the episodic store cannot be completed.
 * Lookups never raise; they log and return an empty result.
 */
public class StoreException extends RuntimeException {

    public StoreException(String message, Throwable cause) {
        super(message, cause);
    }
}
