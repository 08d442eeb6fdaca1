package com.keystone.security.token;

import com.nimbusds.jose.JOSEException;
import com.nimbusds.jose.JWSAlgorithm;
import com.nimbusds.jose.JWSHeader;
import com.nimbusds.jwt.SignedJWT;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.text.ParseException;
import java.time.Clock;
import java.time.Instant;

import static com.keystone.security.token.TokenVerificationException.Reason.INVALID_SIGNATURE;
import static com.keystone.security.token.TokenVerificationException.Reason.MALFORMED_TOKEN;
import static com.keystone.security.token.TokenVerificationException.Reason.TOKEN_EXPIRED;

/**
 * Validates bearer tokens.
 * <p>
 * The header is read without verification to pick a {@link SigningScheme}; any algorithm
 * other than RS256 or HS256 (including {@code none}) is malformed. After the signature
 * checks out, {@code exp} must lie strictly after the injected clock's now.
 * <p>
 * Signature mismatches always surface as {@code INVALID_SIGNATURE}, whatever the cause.
 */
public class TokenVerifier {

    private static final Logger log = LoggerFactory.getLogger(TokenVerifier.class);

    private final SigningScheme.Rs256 primary;
    private final SigningScheme.Hs256 legacy;
    private final Clock clock;

    /**
     * @param keys         key set for RS256 tokens, or null when only legacy tokens are accepted
     * @param legacySecret HS256 shared secret, or null to reject every HS256 token
     * @param clock        time source for expiry checks
     */
    public TokenVerifier(KeyMaterialCache keys, String legacySecret, Clock clock) {
        if (clock == null) {
            throw new IllegalArgumentException("clock must not be null");
        }
        this.primary = new SigningScheme.Rs256(keys);
        this.legacy = new SigningScheme.Hs256(legacySecret);
        this.clock = clock;
    }

    /**
     * Verifies a compact JWS and returns its claims.
     *
     * @param token the raw token (surrounding whitespace ignored)
     * @return the verified claims
     * @throws TokenVerificationException if the token is malformed, its key is unknown, its
     *                                    signature fails, or it has expired
     */
    public TokenClaims verify(String token) {
        if (token == null || token.isBlank()) {
            throw new TokenVerificationException(MALFORMED_TOKEN, "Token is empty");
        }

        SignedJWT jwt;
        try {
            jwt = SignedJWT.parse(token.trim());
        } catch (ParseException e) {
            throw new TokenVerificationException(MALFORMED_TOKEN, "Token is not a compact JWS", e);
        }

        SigningScheme scheme = schemeFor(jwt.getHeader());
        try {
            if (!jwt.verify(scheme.verifierFor(jwt.getHeader()))) {
                throw new TokenVerificationException(INVALID_SIGNATURE, "Signature does not verify");
            }
        } catch (JOSEException e) {
            throw new TokenVerificationException(INVALID_SIGNATURE, "Signature could not be checked", e);
        }

        TokenClaims claims;
        try {
            claims = TokenClaims.from(jwt.getJWTClaimsSet());
        } catch (ParseException e) {
            throw new TokenVerificationException(MALFORMED_TOKEN, "Token claims are not valid", e);
        }

        Instant now = clock.instant();
        if (claims.expiresAt() == null || !claims.expiresAt().isAfter(now)) {
            throw new TokenVerificationException(TOKEN_EXPIRED, "Token expired at " + claims.expiresAt());
        }
        if (!claims.hasIdentity()) {
            throw new TokenVerificationException(MALFORMED_TOKEN, "Token names neither subject nor customer");
        }
        log.debug("Verified {} token for customer {}", jwt.getHeader().getAlgorithm(), claims.effectiveCustomerId());
        return claims;
    }

    /**
     * Selects the scheme for a token header.
     */
    SigningScheme schemeFor(JWSHeader header) {
        JWSAlgorithm alg = header.getAlgorithm();
        if (JWSAlgorithm.RS256.equals(alg)) {
            return primary;
        }
        if (JWSAlgorithm.HS256.equals(alg)) {
            return legacy;
        }
        throw new TokenVerificationException(MALFORMED_TOKEN, "Unsupported token algorithm " + alg);
    }
}
