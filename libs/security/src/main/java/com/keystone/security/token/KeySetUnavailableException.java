package com.keystone.security.token;

/**
 * Thrown when the key set cannot be fetched and no cached copy is within the staleness budget.
 */
public class KeySetUnavailableException extends RuntimeException {

    public KeySetUnavailableException(String message) {
        super(message);
    }

    public KeySetUnavailableException(String message, Throwable cause) {
        super(message, cause);
    }
}
