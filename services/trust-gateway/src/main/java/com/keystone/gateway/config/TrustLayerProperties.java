package com.keystone.gateway.config;

import com.keystone.security.token.HttpKeySetSource;
import com.keystone.security.token.KeyMaterialCache;
import com.keystone.sharing.DataSharingRequestManager;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;
import java.time.Duration;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * Trust-layer settings, bound from {@code keystone.trust.*}.
 *
 * <pre>
 * keystone:
 *   trust:
 *     service-name: trust-gateway
 *     issuer: https://auth.example.com
 *     access-url: https://access.example.com
 *     super-admin-api-key: ${SUPER_ADMIN_API_KEY:}
 *     legacy-secret: ${JWT_SECRET:}
 * </pre>
 *
 * @param serviceName              tag on every metric. Required.
 * @param environment              deployment environment, {@code development} by default
 * @param issuer                   identity provider base URL
 * @param jwksUrl                  key-set location, {@code {issuer}/.well-known/jwks.json} by default
 * @param accessUrl                role lookup base URL
 * @param superAdminApiKey         service-to-service key; blank disables it
 * @param legacySecret             HS256 shared secret; blank rejects legacy tokens
 * @param httpTimeout              connect and read timeout for outbound calls (3 s)
 * @param keyCacheTtl              key-set refresh interval (10 min)
 * @param keyStalenessBudget       how long a stale key set may serve after failed refreshes (1 h)
 * @param keyMinRefreshInterval    minimum gap between forced refreshes for unknown kids (30 s)
 * @param sharingRequestTtl        lifetime of a pending sharing request (30 days)
 */
@ConfigurationProperties(prefix = "keystone.trust")
@Validated
public record TrustLayerProperties(
        @NotBlank String serviceName,
        String environment,
        @NotBlank String issuer,
        String jwksUrl,
        @NotBlank String accessUrl,
        @Size(min = 16) String superAdminApiKey,
        @Size(min = 32) String legacySecret,
        Duration httpTimeout,
        Duration keyCacheTtl,
        Duration keyStalenessBudget,
        Duration keyMinRefreshInterval,
        Duration sharingRequestTtl) {

    /** Applies defaults; runs before Bean Validation. */
    public TrustLayerProperties {
        if (environment == null || environment.isBlank()) {
            environment = "development";
        }
        if ((jwksUrl == null || jwksUrl.isBlank()) && issuer != null && !issuer.isBlank()) {
            jwksUrl = HttpKeySetSource.jwksUrlFor(issuer);
        }
        if (superAdminApiKey != null && superAdminApiKey.isBlank()) {
            superAdminApiKey = null;
        }
        if (legacySecret != null && legacySecret.isBlank()) {
            legacySecret = null;
        }
        httpTimeout = positiveOr(httpTimeout, Duration.ofSeconds(3));
        keyCacheTtl = positiveOr(keyCacheTtl, KeyMaterialCache.DEFAULT_TTL);
        keyStalenessBudget = positiveOr(keyStalenessBudget, KeyMaterialCache.DEFAULT_STALENESS_BUDGET);
        keyMinRefreshInterval = positiveOr(keyMinRefreshInterval, KeyMaterialCache.DEFAULT_MIN_REFRESH_INTERVAL);
        sharingRequestTtl = positiveOr(sharingRequestTtl, DataSharingRequestManager.DEFAULT_REQUEST_TTL);
    }

    private static Duration positiveOr(Duration value, Duration fallback) {
        return value == null || value.isZero() || value.isNegative() ? fallback : value;
    }
}
