package com.keystone.security.access;

/**
 * Thrown when the role lookup service cannot answer.
 */
public class RoleLookupException extends RuntimeException {

    public RoleLookupException(String message) {
        super(message);
    }

    public RoleLookupException(String message, Throwable cause) {
        super(message, cause);
    }
}
