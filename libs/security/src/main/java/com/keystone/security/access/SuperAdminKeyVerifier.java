package com.keystone.security.access;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;

/**
 * Recognizes the super-admin service API key used for service-to-service calls.
 * <p>
 * Comparison is constant-time. When no key is configured nothing matches.
 */
public final class SuperAdminKeyVerifier {

    private final byte[] expected;

    public SuperAdminKeyVerifier(String configuredKey) {
        this.expected = configuredKey == null || configuredKey.isBlank()
                ? null
                : configuredKey.trim().getBytes(StandardCharsets.UTF_8);
    }

    public static SuperAdminKeyVerifier disabled() {
        return new SuperAdminKeyVerifier(null);
    }

    public boolean matches(String presented) {
        if (expected == null || presented == null) {
            return false;
        }
        return MessageDigest.isEqual(expected, presented.trim().getBytes(StandardCharsets.UTF_8));
    }

    public boolean isEnabled() {
        return expected != null;
    }
}
