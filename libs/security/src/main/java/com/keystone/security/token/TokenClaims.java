package com.keystone.security.token;

import com.nimbusds.jwt.JWTClaimsSet;

import java.text.ParseException;
import java.time.Instant;
import java.util.Date;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Verified claims of a bearer token.
 * <p>
 * Registered claims map to their JWT names ({@code sub}, {@code iss}, {@code aud}, {@code exp},
 * {@code iat}, {@code jti}); the platform claims are {@code customerId}, {@code isSuperAdmin},
 * {@code csrf} and {@code scope}. Anything else lands in {@code extensions}.
 *
 * @param subject    subject ({@code sub})
 * @param issuer     issuer ({@code iss})
 * @param audience   audience ({@code aud}), empty when absent
 * @param expiresAt  expiry ({@code exp})
 * @param issuedAt   issue time ({@code iat})
 * @param jwtId      token id ({@code jti})
 * @param customerId platform customer id
 * @param superAdmin signed super-admin flag ({@code isSuperAdmin})
 * @param csrf       CSRF token bound to the session
 * @param scope      space-separated scopes
 * @param extensions remaining claims
 */
public record TokenClaims(
        String subject,
        String issuer,
        List<String> audience,
        Instant expiresAt,
        Instant issuedAt,
        String jwtId,
        String customerId,
        boolean superAdmin,
        String csrf,
        String scope,
        Map<String, Object> extensions
) {

    public static final String CUSTOMER_ID = "customerId";
    public static final String SUPER_ADMIN = "isSuperAdmin";
    public static final String CSRF = "csrf";
    public static final String SCOPE = "scope";

    private static final Set<String> KNOWN_CLAIMS = Set.of(
            "sub", "iss", "aud", "exp", "iat", "nbf", "jti", CUSTOMER_ID, SUPER_ADMIN, CSRF, SCOPE);

    public TokenClaims {
        audience = audience == null ? List.of() : List.copyOf(audience);
        extensions = extensions == null ? Map.of() : Map.copyOf(extensions);
    }

    /**
     * The customer this token speaks for: {@code customerId}, falling back to {@code sub}.
     */
    public String effectiveCustomerId() {
        return customerId != null && !customerId.isBlank() ? customerId : subject;
    }

    /**
     * Whether the token names a principal at all.
     */
    public boolean hasIdentity() {
        String id = effectiveCustomerId();
        return id != null && !id.isBlank();
    }

    /**
     * Reads claims from a parsed JWT.
     */
    public static TokenClaims from(JWTClaimsSet set) throws ParseException {
        Map<String, Object> extensions = new LinkedHashMap<>();
        set.getClaims().forEach((name, value) -> {
            if (!KNOWN_CLAIMS.contains(name) && value != null) {
                extensions.put(name, value);
            }
        });
        Boolean superAdmin = set.getBooleanClaim(SUPER_ADMIN);
        return new TokenClaims(
                set.getSubject(),
                set.getIssuer(),
                set.getAudience(),
                toInstant(set.getExpirationTime()),
                toInstant(set.getIssueTime()),
                set.getJWTID(),
                set.getStringClaim(CUSTOMER_ID),
                Boolean.TRUE.equals(superAdmin),
                set.getStringClaim(CSRF),
                set.getStringClaim(SCOPE),
                extensions);
    }

    /**
     * Writes these claims as a JWT claims set.
     */
    public JWTClaimsSet toClaimsSet() {
        JWTClaimsSet.Builder builder = new JWTClaimsSet.Builder()
                .subject(subject)
                .issuer(issuer)
                .expirationTime(toDate(expiresAt))
                .issueTime(toDate(issuedAt))
                .jwtID(jwtId)
                .claim(CUSTOMER_ID, customerId)
                .claim(SUPER_ADMIN, superAdmin)
                .claim(CSRF, csrf)
                .claim(SCOPE, scope);
        if (!audience.isEmpty()) {
            builder.audience(audience);
        }
        extensions.forEach(builder::claim);
        return builder.build();
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Copy of these claims with a different expiry and issue time.
     */
    public TokenClaims withTimes(Instant issuedAt, Instant expiresAt) {
        return new TokenClaims(subject, issuer, audience, expiresAt, issuedAt, jwtId, customerId,
                superAdmin, csrf, scope, extensions);
    }

    TokenClaims withIds(String jwtId, String csrf) {
        return new TokenClaims(subject, issuer, audience, expiresAt, issuedAt, jwtId, customerId,
                superAdmin, csrf, scope, extensions);
    }

    private static Instant toInstant(Date date) {
        return date == null ? null : date.toInstant();
    }

    private static Date toDate(Instant instant) {
        return instant == null ? null : Date.from(instant);
    }

    /**
     * Fluent builder, mainly for the issuer and tests.
     */
    public static final class Builder {
        private String subject;
        private String issuer;
        private List<String> audience = List.of();
        private Instant expiresAt;
        private Instant issuedAt;
        private String jwtId;
        private String customerId;
        private boolean superAdmin;
        private String csrf;
        private String scope;
        private final Map<String, Object> extensions = new LinkedHashMap<>();

        private Builder() {
        }

        public Builder subject(String subject) {
            this.subject = subject;
            return this;
        }

        public Builder issuer(String issuer) {
            this.issuer = issuer;
            return this;
        }

        public Builder audience(String... audience) {
            this.audience = List.of(audience);
            return this;
        }

        public Builder expiresAt(Instant expiresAt) {
            this.expiresAt = expiresAt;
            return this;
        }

        public Builder issuedAt(Instant issuedAt) {
            this.issuedAt = issuedAt;
            return this;
        }

        public Builder jwtId(String jwtId) {
            this.jwtId = jwtId;
            return this;
        }

        public Builder customerId(String customerId) {
            this.customerId = customerId;
            return this;
        }

        public Builder superAdmin(boolean superAdmin) {
            this.superAdmin = superAdmin;
            return this;
        }

        public Builder csrf(String csrf) {
            this.csrf = csrf;
            return this;
        }

        public Builder scope(String scope) {
            this.scope = scope;
            return this;
        }

        public Builder extension(String name, Object value) {
            this.extensions.put(name, value);
            return this;
        }

        public TokenClaims build() {
            return new TokenClaims(subject, issuer, audience, expiresAt, issuedAt, jwtId, customerId,
                    superAdmin, csrf, scope, extensions);
        }
    }
}
