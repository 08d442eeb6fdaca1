package com.keystone.crypto;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.crypto.AEADBadTagException;
import javax.crypto.Cipher;
import javax.crypto.SecretKey;
import javax.crypto.SecretKeyFactory;
import javax.crypto.spec.GCMParameterSpec;
import javax.crypto.spec.PBEKeySpec;
import javax.crypto.spec.SecretKeySpec;
import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.security.GeneralSecurityException;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.security.SecureRandom;
import java.util.zip.GZIPInputStream;
import java.util.zip.GZIPOutputStream;

/**
 * Token-keyed authenticated encryption.
 * <p>
 * The secret (usually a bearer token or a request key) is stretched with PBKDF2-HMAC-SHA256
 * into an AES-256 key; the payload is sealed with AES-GCM. Every envelope carries the
 * SHA-256 of the secret so a wrong secret is rejected before any key derivation happens.
 * <p>
 * Instances are thread-safe.
 */
public class CipherEngine {

    private static final Logger log = LoggerFactory.getLogger(CipherEngine.class);

    public static final int PBKDF2_ITERATIONS = 100_000;
    public static final int KEY_LENGTH_BITS = 256;
    public static final int SALT_LENGTH = 16;
    public static final int IV_LENGTH = 12;
    public static final int KEY_HASH_LENGTH = 32;
    public static final int GCM_TAG_BITS = 128;
    public static final int MIN_SECRET_LENGTH = 10;

    /** Compression is kept only when it saves more than the gzip framing costs. */
    static final int GZIP_OVERHEAD = 18;

    private final SecureRandom random;

    public CipherEngine() {
        this(new SecureRandom());
    }

    public CipherEngine(SecureRandom random) {
        if (random == null) {
            throw new IllegalArgumentException("random must not be null");
        }
        this.random = random;
    }

    /**
     * Derives the AES-256 key for a secret and salt.
     *
     * @param secret the derivation secret (trimmed by the caller)
     * @param salt   the per-envelope salt
     * @return an AES key
     */
    public SecretKey deriveKey(String secret, byte[] salt) {
        PBEKeySpec spec = new PBEKeySpec(secret.toCharArray(), salt, PBKDF2_ITERATIONS, KEY_LENGTH_BITS);
        try {
            SecretKeyFactory factory = SecretKeyFactory.getInstance("PBKDF2WithHmacSHA256");
            byte[] keyBytes = factory.generateSecret(spec).getEncoded();
            return new SecretKeySpec(keyBytes, "AES");
        } catch (GeneralSecurityException e) {
            throw new IllegalStateException("PBKDF2WithHmacSHA256 is not available", e);
        } finally {
            spec.clearPassword();
        }
    }

    /**
     * Encrypts a payload under a secret.
     *
     * @param plaintext the bytes to protect
     * @param secret    the derivation secret; surrounding whitespace is ignored
     * @param compress  whether to try gzip first (kept only when it actually shrinks the payload)
     * @return a fresh v5 single-stage envelope
     * @throws IllegalArgumentException if the secret is shorter than {@value #MIN_SECRET_LENGTH} characters
     */
    public SingleStageEnvelope encrypt(byte[] plaintext, String secret, boolean compress) {
        if (plaintext == null) {
            throw new IllegalArgumentException("plaintext must not be null");
        }
        String normalized = normalizeSecret(secret);

        byte[] payload = plaintext;
        boolean compressed = false;
        if (compress) {
            byte[] gzipped = gzip(plaintext);
            if (gzipped.length < plaintext.length - GZIP_OVERHEAD) {
                payload = gzipped;
                compressed = true;
            }
        }

        byte[] salt = randomBytes(SALT_LENGTH);
        byte[] iv = randomBytes(IV_LENGTH);
        SecretKey key = deriveKey(normalized, salt);
        try {
            Cipher cipher = Cipher.getInstance("AES/GCM/NoPadding");
            cipher.init(Cipher.ENCRYPT_MODE, key, new GCMParameterSpec(GCM_TAG_BITS, iv));
            byte[] ciphertext = cipher.doFinal(payload);
            return new SingleStageEnvelope(EnvelopeCodec.CURRENT_VERSION, salt, iv,
                    keyHash(normalized), ciphertext, compressed);
        } catch (GeneralSecurityException e) {
            throw new IllegalStateException("AES-GCM encryption failed", e);
        }
    }

    /**
     * Convenience overload for text payloads, compressed when worthwhile.
     */
    public SingleStageEnvelope encrypt(String plaintext, String secret) {
        return encrypt(plaintext.getBytes(StandardCharsets.UTF_8), secret, true);
    }

    /**
     * Opens one envelope layer.
     * <p>
     * The key hash is compared first in constant time; on mismatch this fails with
     * {@link EnvelopeException.Reason#WRONG_DECRYPTION_KEY} without deriving a key. A legacy
     * layer without a key hash is decrypted directly, and a failed tag check on it is
     * reported as a wrong key since the two cannot be told apart.
     *
     * @param envelope the envelope to open
     * @param secret   the derivation secret; surrounding whitespace is ignored
     * @return the original plaintext bytes
     * @throws EnvelopeException if the secret does not match or the envelope is damaged
     */
    public byte[] decrypt(SingleStageEnvelope envelope, String secret) {
        if (envelope == null) {
            throw new IllegalArgumentException("envelope must not be null");
        }
        String normalized = normalizeSecret(secret);

        if (envelope.hasKeyHash() && !MessageDigest.isEqual(envelope.keyHash(), keyHash(normalized))) {
            throw new EnvelopeException(EnvelopeException.Reason.WRONG_DECRYPTION_KEY,
                    "Secret does not match the envelope key hash");
        }

        SecretKey key = deriveKey(normalized, envelope.salt());
        byte[] payload;
        try {
            Cipher cipher = Cipher.getInstance("AES/GCM/NoPadding");
            cipher.init(Cipher.DECRYPT_MODE, key, new GCMParameterSpec(GCM_TAG_BITS, envelope.iv()));
            payload = cipher.doFinal(envelope.ciphertext());
        } catch (AEADBadTagException e) {
            if (!envelope.hasKeyHash()) {
                throw new EnvelopeException(EnvelopeException.Reason.WRONG_DECRYPTION_KEY,
                        "Authentication tag check failed on a layer without a key hash", e);
            }
            throw new EnvelopeException(EnvelopeException.Reason.CORRUPTED_ENVELOPE,
                    "Authentication tag check failed", e);
        } catch (GeneralSecurityException e) {
            throw new EnvelopeException(EnvelopeException.Reason.CORRUPTED_ENVELOPE,
                    "Envelope could not be decrypted", e);
        }
        return envelope.compressed() ? gunzip(payload) : payload;
    }

    /**
     * SHA-256 of the trimmed secret, as stored in every envelope.
     */
    public static byte[] keyHash(String secret) {
        try {
            return MessageDigest.getInstance("SHA-256").digest(secret.trim().getBytes(StandardCharsets.UTF_8));
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 is not available", e);
        }
    }

    static String normalizeSecret(String secret) {
        String trimmed = secret == null ? "" : secret.trim();
        if (trimmed.length() < MIN_SECRET_LENGTH) {
            throw new IllegalArgumentException(
                    "secret must be at least %d characters".formatted(MIN_SECRET_LENGTH));
        }
        return trimmed;
    }

    private byte[] randomBytes(int length) {
        byte[] bytes = new byte[length];
        random.nextBytes(bytes);
        return bytes;
    }

    private static byte[] gzip(byte[] data) {
        ByteArrayOutputStream out = new ByteArrayOutputStream(data.length / 2 + 32);
        try (GZIPOutputStream gzip = new GZIPOutputStream(out)) {
            gzip.write(data);
        } catch (IOException e) {
            throw new UncheckedIOException("gzip failed", e);
        }
        return out.toByteArray();
    }

    private static byte[] gunzip(byte[] data) {
        try (GZIPInputStream gzip = new GZIPInputStream(new ByteArrayInputStream(data))) {
            return gzip.readAllBytes();
        } catch (IOException e) {
            log.warn("Compressed envelope payload could not be inflated: {}", e.getMessage());
            throw new EnvelopeException(EnvelopeException.Reason.CORRUPTED_ENVELOPE,
                    "Compressed payload is not valid gzip", e);
        }
    }
}
