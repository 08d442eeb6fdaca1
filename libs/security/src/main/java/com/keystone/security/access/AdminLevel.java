package com.keystone.security.access;

import java.util.Set;

/**
 * Access levels for role-gated routes. Role names come from the role lookup service.
 */
public enum AdminLevel {

    ADMIN("admin"),
    SUPER_ADMIN("super-admin");

    private final String roleName;

    AdminLevel(String roleName) {
        this.roleName = roleName;
    }

    /** The role name as the role lookup service spells it. */
    public String roleName() {
        return roleName;
    }

    /**
     * Whether a set of role names satisfies this level. {@code super-admin} satisfies both
     * levels; {@code admin} only satisfies {@link #ADMIN}.
     */
    public boolean grantedBy(Set<String> roles) {
        return switch (this) {
            case ADMIN -> roles.contains(ADMIN.roleName) || roles.contains(SUPER_ADMIN.roleName);
            case SUPER_ADMIN -> roles.contains(SUPER_ADMIN.roleName);
        };
    }
}
