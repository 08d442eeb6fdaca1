package com.keystone.observability;

import java.util.regex.Pattern;

/**
 * Keeps credentials out of log output.
 * <p>
 * Bearer tokens double as decryption secrets for response bodies, so a logged token is a
 * leaked key. Exception messages from parsers and HTTP clients can echo request content;
 * run them through {@link #scrub(String)} before logging. Log a credential's identity with
 * {@link #hint(String)}, never the credential itself.
 */
public final class SensitiveDataRedactor {

    /** The replacement string for redacted values. */
    public static final String REDACTED = "[REDACTED]";

    private static final Pattern COMPACT_JWS =
            Pattern.compile("[A-Za-z0-9_-]{8,}\\.[A-Za-z0-9_-]{8,}\\.[A-Za-z0-9_-]{8,}");

    private static final Pattern BEARER_VALUE =
            Pattern.compile("(?i)(bearer\\s+)\\S+");

    private SensitiveDataRedactor() {
        // utility class
    }

    /**
     * Replaces compact-JWS-shaped substrings and {@code Bearer <value>} credentials in free
     * text with {@value #REDACTED}. Null stays null.
     */
    public static String scrub(String text) {
        if (text == null || text.isEmpty()) {
            return text;
        }
        String scrubbed = BEARER_VALUE.matcher(text).replaceAll("$1" + REDACTED);
        return COMPACT_JWS.matcher(scrubbed).replaceAll(REDACTED);
    }

    /**
     * Whether a whole value has the shape of a compact JWS ({@code header.payload.signature}).
     */
    public static boolean looksLikeToken(String value) {
        return value != null && COMPACT_JWS.matcher(value).matches();
    }

    /**
     * Shortens a credential to a non-reversible hint for diagnostics, e.g. {@code eyJh…(212)}.
     */
    public static String hint(String credential) {
        if (credential == null || credential.isEmpty()) {
            return "<none>";
        }
        String prefix = credential.length() > 4 ? credential.substring(0, 4) : "";
        return prefix + "…(" + credential.length() + ")";
    }
}
