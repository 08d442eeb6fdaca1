package com.keystone.security;

import com.keystone.security.access.SuperAdminKeyVerifier;
import com.keystone.security.token.TokenClaims;
import com.keystone.security.token.TokenVerificationException;
import com.keystone.security.token.TokenVerifier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Optional;

/**
 * Turns request credentials into an {@link AuthResult}.
 * <p>
 * The {@code auth_token} cookie is checked first; when present it is the only credential
 * considered. Otherwise the {@code Authorization: Bearer} value is used, which may also be
 * the super-admin service key.
 */
public class AuthExtractor {

    private static final Logger log = LoggerFactory.getLogger(AuthExtractor.class);

    private final TokenVerifier verifier;
    private final SuperAdminKeyVerifier serviceKeys;

    public AuthExtractor(TokenVerifier verifier, SuperAdminKeyVerifier serviceKeys) {
        if (verifier == null || serviceKeys == null) {
            throw new IllegalArgumentException("verifier and serviceKeys must not be null");
        }
        this.verifier = verifier;
        this.serviceKeys = serviceKeys;
    }

    /**
     * Authenticates a request.
     *
     * @param cookieValue         value of the {@code auth_token} cookie, or null
     * @param authorizationHeader value of the Authorization header, or null
     * @return the principal, or empty when the request carries no credential
     * @throws TokenVerificationException if a credential is present but invalid
     */
    public Optional<AuthResult> authenticate(String cookieValue, String authorizationHeader) {
        Optional<String> cookieToken = BearerTokenExtractor.fromCookie(cookieValue);
        if (cookieToken.isPresent()) {
            return Optional.of(verified(cookieToken.get(), TokenTransport.COOKIE));
        }

        Optional<String> headerToken = BearerTokenExtractor.extract(authorizationHeader);
        if (headerToken.isEmpty()) {
            return Optional.empty();
        }
        String token = headerToken.get();
        if (serviceKeys.matches(token)) {
            log.debug("Request authenticated with the super-admin service key");
            return Optional.of(AuthResult.serviceKey(token));
        }
        return Optional.of(verified(token, TokenTransport.BEARER_HEADER));
    }

    private AuthResult verified(String token, TokenTransport transport) {
        TokenClaims claims = verifier.verify(token);
        return AuthResult.fromToken(token, claims, transport);
    }
}
