package com.keystone.security;

import java.util.Locale;
import java.util.Optional;

/**
 * Pulls raw credentials out of request header values.
 */
public final class BearerTokenExtractor {

    /** Name of the HttpOnly cookie browsers send. */
    public static final String AUTH_COOKIE = "auth_token";

    private static final String BEARER = "bearer";

    private BearerTokenExtractor() {
        // utility class
    }

    /**
     * Extracts the token from an Authorization header value ({@code "Bearer <token>"},
     * scheme matched case-insensitively).
     *
     * @param authorizationHeader the full header value (may be null)
     * @return the trimmed token, or empty if the header is missing or uses another scheme
     */
    public static Optional<String> extract(String authorizationHeader) {
        if (authorizationHeader == null || authorizationHeader.isBlank()) {
            return Optional.empty();
        }
        String trimmed = authorizationHeader.strip();
        if (trimmed.length() <= BEARER.length()
                || !trimmed.substring(0, BEARER.length()).toLowerCase(Locale.ROOT).equals(BEARER)
                || !Character.isWhitespace(trimmed.charAt(BEARER.length()))) {
            return Optional.empty();
        }
        String token = trimmed.substring(BEARER.length()).strip();
        return token.isEmpty() ? Optional.empty() : Optional.of(token);
    }

    /**
     * Normalizes a cookie value: trimmed, empty when blank.
     */
    public static Optional<String> fromCookie(String cookieValue) {
        if (cookieValue == null || cookieValue.isBlank()) {
            return Optional.empty();
        }
        return Optional.of(cookieValue.strip());
    }
}
