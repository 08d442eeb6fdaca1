package com.keystone.security.access;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("SuperAdminKeyVerifier")
class SuperAdminKeyVerifierTest {

    private final SuperAdminKeyVerifier verifier = new SuperAdminKeyVerifier("configured-key-123");

    @Test
    @DisplayName("matches the configured key, ignoring surrounding whitespace")
    void matches() {
        assertThat(verifier.matches("configured-key-123")).isTrue();
        assertThat(verifier.matches(" configured-key-123 ")).isTrue();
        assertThat(verifier.isEnabled()).isTrue();
    }

    @Test
    @DisplayName("rejects other values")
    void rejects() {
        assertThat(verifier.matches("configured-key-12")).isFalse();
        assertThat(verifier.matches("CONFIGURED-KEY-123")).isFalse();
        assertThat(verifier.matches(null)).isFalse();
    }

    @Test
    @DisplayName("matches nothing when no key is configured")
    void disabled() {
        assertThat(SuperAdminKeyVerifier.disabled().matches("")).isFalse();
        assertThat(new SuperAdminKeyVerifier("  ").matches("  ")).isFalse();
        assertThat(SuperAdminKeyVerifier.disabled().isEnabled()).isFalse();
    }
}
