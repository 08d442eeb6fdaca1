package com.keystone.crypto;

import java.util.Arrays;
import java.util.HexFormat;

/**
 * One AES-256-GCM layer: salt and IV for this encryption only, the SHA-256 fingerprint of
 * the secret, and the ciphertext (GCM tag appended).
 *
 * @param version    envelope format the layer was read from or will be written as (3, 4 or 5)
 * @param salt       PBKDF2 salt
 * @param iv         GCM nonce
 * @param keyHash    SHA-256 of the trimmed secret; empty for v3 layers written without one
 * @param ciphertext AES-GCM output including the 16-byte tag
 * @param compressed whether the plaintext was gzipped before encryption
 */
public record SingleStageEnvelope(
        int version,
        byte[] salt,
        byte[] iv,
        byte[] keyHash,
        byte[] ciphertext,
        boolean compressed
) implements EncryptedEnvelope {

    public SingleStageEnvelope {
        if (salt == null || iv == null || keyHash == null || ciphertext == null) {
            throw new IllegalArgumentException("salt, iv, keyHash and ciphertext are required");
        }
        salt = salt.clone();
        iv = iv.clone();
        keyHash = keyHash.clone();
        ciphertext = ciphertext.clone();
    }

    @Override
    public byte[] salt() {
        return salt.clone();
    }

    @Override
    public byte[] iv() {
        return iv.clone();
    }

    @Override
    public byte[] keyHash() {
        return keyHash.clone();
    }

    /**
     * Whether the layer carries a key hash for the fast wrong-secret check.
     */
    public boolean hasKeyHash() {
        return keyHash.length > 0;
    }

    @Override
    public byte[] ciphertext() {
        return ciphertext.clone();
    }

    @Override
    public int depth() {
        return 1;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof SingleStageEnvelope other)) {
            return false;
        }
        return version == other.version
                && compressed == other.compressed
                && Arrays.equals(salt, other.salt)
                && Arrays.equals(iv, other.iv)
                && Arrays.equals(keyHash, other.keyHash)
                && Arrays.equals(ciphertext, other.ciphertext);
    }

    @Override
    public int hashCode() {
        int result = Integer.hashCode(version);
        result = 31 * result + Boolean.hashCode(compressed);
        result = 31 * result + Arrays.hashCode(salt);
        result = 31 * result + Arrays.hashCode(iv);
        result = 31 * result + Arrays.hashCode(keyHash);
        result = 31 * result + Arrays.hashCode(ciphertext);
        return result;
    }

    @Override
    public String toString() {
        return "SingleStageEnvelope[version=%d, compressed=%s, keyHash=%s, ciphertextLength=%d]"
                .formatted(version, compressed, hasKeyHash() ? HexFormat.of().formatHex(keyHash, 0, 4) : "none", ciphertext.length);
    }
}
