package com.keystone.sharing;

import java.security.SecureRandom;
import java.time.Instant;
import java.util.Base64;
import java.util.HexFormat;

/**
 * Mints request ids and request keys.
 */
public class RequestKeyGenerator {

    public static final int REQUEST_KEY_BYTES = 32;
    private static final int ID_SUFFIX_BYTES = 8;

    private final SecureRandom random;

    public RequestKeyGenerator() {
        this(new SecureRandom());
    }

    public RequestKeyGenerator(SecureRandom random) {
        this.random = random;
    }

    /** 32 random bytes, standard base64. */
    public String newRequestKey() {
        byte[] key = new byte[REQUEST_KEY_BYTES];
        random.nextBytes(key);
        return Base64.getEncoder().encodeToString(key);
    }

    /** {@code req_<epochMillis>_<16 lowercase hex>}. */
    public String newRequestId(Instant now) {
        byte[] suffix = new byte[ID_SUFFIX_BYTES];
        random.nextBytes(suffix);
        return "req_" + now.toEpochMilli() + "_" + HexFormat.of().formatHex(suffix);
    }
}
