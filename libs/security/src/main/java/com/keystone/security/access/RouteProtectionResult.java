package com.keystone.security.access;

/**
 * Outcome of a route check.
 *
 * @param allowed   whether the route may be used
 * @param level     the level that was required
 * @param errorKind why access was denied, null when allowed
 */
public record RouteProtectionResult(boolean allowed, AdminLevel level, AccessDeniedException.Reason errorKind) {

    public static RouteProtectionResult allow(AdminLevel level) {
        return new RouteProtectionResult(true, level, null);
    }

    public static RouteProtectionResult deny(AdminLevel level, AccessDeniedException.Reason errorKind) {
        return new RouteProtectionResult(false, level, errorKind);
    }

    /**
     * Throws the matching {@link AccessDeniedException} when access was denied.
     */
    public void orThrow() {
        if (!allowed) {
            throw new AccessDeniedException(errorKind, level);
        }
    }
}
