package com.keystone.security.token;

/**
 * Thrown when a bearer token cannot be accepted.
 * <p>
 * The reason is kept for logs and the {@code keystone.auth.failures} counter only; every
 * reason becomes the same generic 401 at the HTTP boundary.
 */
public class TokenVerificationException extends RuntimeException {

    public enum Reason {
        /** Not a compact JWS, an unsupported {@code alg}, or missing identity claims. */
        MALFORMED_TOKEN,
        /** No key with the token's {@code kid} in the current key set. */
        UNKNOWN_SIGNING_KEY,
        /** Signature does not verify, or the legacy secret is not configured. */
        INVALID_SIGNATURE,
        /** {@code exp} is missing or not strictly in the future. */
        TOKEN_EXPIRED
    }

    private final Reason reason;

    public TokenVerificationException(Reason reason, String message) {
        super(message);
        this.reason = reason;
    }

    public TokenVerificationException(Reason reason, String message, Throwable cause) {
        super(message, cause);
        this.reason = reason;
    }

    public Reason reason() {
        return reason;
    }
}
