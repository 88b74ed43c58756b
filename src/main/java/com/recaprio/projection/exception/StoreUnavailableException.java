package com.recaprio.projection.exception;

/**
 * The projection store could not be written, or a write missed its deadline.
 * Retried with backoff.
 */
public class StoreUnavailableException extends RuntimeException {

    public StoreUnavailableException(String message, Throwable cause) {
        super(message, cause);
    }
}
