package com.keystone.security;

import com.keystone.security.token.TokenClaims;

/**
 * The authenticated principal carried through a request.
 *
 * @param customerId effective customer id
 * @param rawToken   the credential exactly as presented (trimmed); never logged
 * @param claims     verified claims, null for service-key calls
 * @param transport  how the credential arrived
 */
public record AuthResult(String customerId, String rawToken, TokenClaims claims, TokenTransport transport) {

    /** Principal id used for calls authenticated with the super-admin service key. */
    public static final String SERVICE_PRINCIPAL = "service:super-admin";

    public AuthResult {
        if (customerId == null || customerId.isBlank()) {
            throw new IllegalArgumentException("customerId must not be blank");
        }
        if (rawToken == null || transport == null) {
            throw new IllegalArgumentException("rawToken and transport are required");
        }
    }

    public static AuthResult fromToken(String rawToken, TokenClaims claims, TokenTransport transport) {
        return new AuthResult(claims.effectiveCustomerId(), rawToken, claims, transport);
    }

    public static AuthResult serviceKey(String apiKey) {
        return new AuthResult(SERVICE_PRINCIPAL, apiKey, null, TokenTransport.SERVICE_KEY);
    }

    /**
     * Whether the signed token carries {@code isSuperAdmin=true}.
     */
    public boolean superAdminClaim() {
        return claims != null && claims.superAdmin();
    }

    @Override
    public String toString() {
        return "AuthResult[customerId=" + customerId + ", transport=" + transport + "]";
    }
}
