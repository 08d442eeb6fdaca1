package com.keystone.security.access;

import com.keystone.observability.SensitiveDataRedactor;
import com.keystone.security.AuthResult;
import com.keystone.security.TokenTransport;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Set;

import static com.keystone.security.access.AccessDeniedException.Reason.INSUFFICIENT_ROLE;
import static com.keystone.security.access.AccessDeniedException.Reason.ROLE_LOOKUP_UNAVAILABLE;
import static com.keystone.security.access.AccessDeniedException.Reason.UNAUTHENTICATED;

/**
 * Decides whether a principal may use an admin route.
 * <ol>
 *   <li>No principal: {@code UNAUTHENTICATED}.</li>
 *   <li>Super-admin service key or a signed {@code isSuperAdmin=true} claim: allowed for every
 *       level without a lookup.</li>
 *   <li>Otherwise the role lookup decides. A failing lookup denies access.</li>
 * </ol>
 */
public class RouteProtector {

    private static final Logger log = LoggerFactory.getLogger(RouteProtector.class);

    private final RoleLookupClient roleLookup;

    public RouteProtector(RoleLookupClient roleLookup) {
        if (roleLookup == null) {
            throw new IllegalArgumentException("roleLookup must not be null");
        }
        this.roleLookup = roleLookup;
    }

    /**
     * Checks a principal against a required level. Never throws for denials.
     *
     * @param principal the authenticated principal, or null
     * @param required  the level the route needs
     */
    public RouteProtectionResult check(AuthResult principal, AdminLevel required) {
        if (principal == null) {
            return RouteProtectionResult.deny(required, UNAUTHENTICATED);
        }
        if (principal.transport() == TokenTransport.SERVICE_KEY || principal.superAdminClaim()) {
            return RouteProtectionResult.allow(required);
        }

        Set<String> roles;
        try {
            roles = roleLookup.rolesFor(principal.customerId());
        } catch (RuntimeException e) {
            log.warn("Role lookup failed for customer {}, denying {}: {}",
                    principal.customerId(), required, SensitiveDataRedactor.scrub(e.getMessage()));
            return RouteProtectionResult.deny(required, ROLE_LOOKUP_UNAVAILABLE);
        }

        if (required.grantedBy(roles)) {
            return RouteProtectionResult.allow(required);
        }
        log.info("Customer {} lacks {} (roles={})", principal.customerId(), required, roles);
        return RouteProtectionResult.deny(required, INSUFFICIENT_ROLE);
    }

    /**
     * Like {@link #check} but throws {@link AccessDeniedException} on denial.
     */
    public void require(AuthResult principal, AdminLevel required) {
        check(principal, required).orThrow();
    }
}
