package com.transparenta.analytics.exception;

/**
 * Raised when an analytics filter violates the caller contract (missing period, missing
 * account category). Always thrown before the row store is touched.
 */
public class InvalidFilterException extends IllegalArgumentException {

    public InvalidFilterException(String message) {
        super(message);
    }
}
