package com.keystone.crypto;

/**
 * Thrown when an envelope cannot be opened.
 * <p>
 * The {@link Reason} is for logs and metrics. HTTP callers collapse every reason into a
 * single generic 400 so the response never reveals whether the key or the payload was wrong.
 */
public class EnvelopeException extends RuntimeException {

    /** Why the envelope could not be opened. */
    public enum Reason {
        /** The secret's SHA-256 fingerprint does not match the envelope's key hash. */
        WRONG_DECRYPTION_KEY,
        /** Truncated, inconsistent or tampered envelope (including a failed GCM tag). */
        CORRUPTED_ENVELOPE,
        /** Version byte (or JSON version field) this codec does not read. */
        UNSUPPORTED_ENVELOPE_VERSION
    }

    private final Reason reason;

    public EnvelopeException(Reason reason, String message) {
        super(message);
        this.reason = reason;
    }

    public EnvelopeException(Reason reason, String message, Throwable cause) {
        super(message, cause);
        this.reason = reason;
    }

    public Reason reason() {
        return reason;
    }
}
