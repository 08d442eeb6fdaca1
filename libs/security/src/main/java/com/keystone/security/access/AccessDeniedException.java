package com.keystone.security.access;

/**
 * Thrown when a principal may not use a route.
 * <p>
 * {@link Reason#UNAUTHENTICATED} maps to 401; the other reasons map to the same generic 403.
 */
public class AccessDeniedException extends RuntimeException {

    public enum Reason {
        UNAUTHENTICATED,
        INSUFFICIENT_ROLE,
        ROLE_LOOKUP_UNAVAILABLE
    }

    private final Reason reason;
    private final AdminLevel requiredLevel;

    public AccessDeniedException(Reason reason, AdminLevel requiredLevel) {
        super("Access denied (%s) for level %s".formatted(reason, requiredLevel));
        this.reason = reason;
        this.requiredLevel = requiredLevel;
    }

    public Reason reason() {
        return reason;
    }

    public AdminLevel requiredLevel() {
        return requiredLevel;
    }
}
