package com.keystone.crypto;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.io.IOException;
import java.nio.ByteBuffer;
import java.nio.charset.StandardCharsets;
import java.util.Base64;
import java.util.HexFormat;

/**
 * Reads and writes the envelope wire formats.
 * <ul>
 *   <li><b>v5</b> (written): {@code [5][compressed][saltLen][ivLen][hashLen] salt iv keyHash ciphertext}</li>
 *   <li><b>v4</b> (read-only): {@code [4][saltLen][ivLen][hashLen] salt iv keyHash ciphertext}, never compressed</li>
 *   <li><b>v3</b> (read-only): JSON object with base64 {@code iv}, {@code salt}, {@code data} and a hex
 *       {@code tokenHash}</li>
 * </ul>
 * New code only ever produces v5.
 */
public final class EnvelopeCodec {

    public static final int CURRENT_VERSION = 5;
    static final int BINARY_V4 = 4;
    static final int JSON_V3 = 3;

    private static final int V5_HEADER_LENGTH = 5;
    private static final int V4_HEADER_LENGTH = 4;
    private static final int GCM_TAG_LENGTH = CipherEngine.GCM_TAG_BITS / 8;

    private static final ObjectMapper MAPPER = new ObjectMapper();

    private EnvelopeCodec() {
        // utility class
    }

    /**
     * Writes a single layer as v5 binary.
     */
    public static byte[] encode(SingleStageEnvelope envelope) {
        if (!envelope.hasKeyHash()) {
            throw new IllegalArgumentException("v5 envelopes require a key hash");
        }
        byte[] salt = envelope.salt();
        byte[] iv = envelope.iv();
        byte[] keyHash = envelope.keyHash();
        byte[] ciphertext = envelope.ciphertext();

        ByteBuffer buffer = ByteBuffer.allocate(
                V5_HEADER_LENGTH + salt.length + iv.length + keyHash.length + ciphertext.length);
        buffer.put((byte) CURRENT_VERSION);
        buffer.put((byte) (envelope.compressed() ? 1 : 0));
        buffer.put((byte) salt.length);
        buffer.put((byte) iv.length);
        buffer.put((byte) keyHash.length);
        buffer.put(salt).put(iv).put(keyHash).put(ciphertext);
        return buffer.array();
    }

    /**
     * Writes the outer layer of a multi-stage envelope as v5 binary. The depth travels
     * separately (see the sealed field representation).
     */
    public static byte[] encode(MultiStageEnvelope envelope) {
        return encode(envelope.outer());
    }

    /**
     * Reads any supported format, detecting legacy JSON by its leading brace.
     *
     * @throws EnvelopeException on unknown versions or damaged input
     */
    public static SingleStageEnvelope decode(byte[] data) {
        if (data == null || data.length == 0) {
            throw corrupted("Envelope is empty");
        }
        if (data[0] == '{') {
            return decodeLegacyJson(new String(data, StandardCharsets.UTF_8));
        }
        return decodeBinary(data);
    }

    /**
     * Reads a v5 or v4 binary envelope.
     */
    public static SingleStageEnvelope decodeBinary(byte[] data) {
        if (data == null || data.length < V4_HEADER_LENGTH) {
            throw corrupted("Envelope is too short");
        }
        int version = Byte.toUnsignedInt(data[0]);
        if (version != CURRENT_VERSION && version != BINARY_V4) {
            throw new EnvelopeException(EnvelopeException.Reason.UNSUPPORTED_ENVELOPE_VERSION,
                    "Unsupported binary envelope version: " + version);
        }
        if (version == CURRENT_VERSION && data.length < V5_HEADER_LENGTH) {
            throw corrupted("Envelope is too short");
        }

        ByteBuffer buffer = ByteBuffer.wrap(data);
        buffer.get();
        boolean compressed = false;
        if (version == CURRENT_VERSION) {
            byte flag = buffer.get();
            if (flag != 0 && flag != 1) {
                throw corrupted("Invalid compression flag: " + flag);
            }
            compressed = flag == 1;
        }
        int saltLength = Byte.toUnsignedInt(buffer.get());
        int ivLength = Byte.toUnsignedInt(buffer.get());
        int hashLength = Byte.toUnsignedInt(buffer.get());
        if (saltLength != CipherEngine.SALT_LENGTH
                || ivLength != CipherEngine.IV_LENGTH
                || hashLength != CipherEngine.KEY_HASH_LENGTH) {
            throw corrupted("Invalid header lengths");
        }
        if (buffer.remaining() < saltLength + ivLength + hashLength + GCM_TAG_LENGTH) {
            throw corrupted("Envelope is truncated");
        }

        byte[] salt = new byte[saltLength];
        byte[] iv = new byte[ivLength];
        byte[] keyHash = new byte[hashLength];
        buffer.get(salt).get(iv).get(keyHash);
        byte[] ciphertext = new byte[buffer.remaining()];
        buffer.get(ciphertext);
        return new SingleStageEnvelope(version, salt, iv, keyHash, ciphertext, compressed);
    }

    /**
     * Reads a v3 JSON envelope. {@code tokenHash} is optional; a layer without it is read
     * with an empty key hash and cannot be fast-rejected.
     */
    public static SingleStageEnvelope decodeLegacyJson(String json) {
        JsonNode node;
        try {
            node = MAPPER.readTree(json);
        } catch (IOException e) {
            throw new EnvelopeException(EnvelopeException.Reason.CORRUPTED_ENVELOPE,
                    "Legacy envelope is not valid JSON", e);
        }
        if (node == null || !node.isObject()) {
            throw corrupted("Legacy envelope is not a JSON object");
        }
        int version = node.path("version").asInt(-1);
        if (version != JSON_V3) {
            throw new EnvelopeException(EnvelopeException.Reason.UNSUPPORTED_ENVELOPE_VERSION,
                    "Unsupported JSON envelope version: " + version);
        }
        if (!node.path("encrypted").asBoolean(false)) {
            throw corrupted("Legacy envelope is not marked as encrypted");
        }
        try {
            Base64.Decoder base64 = Base64.getDecoder();
            byte[] salt = base64.decode(requiredText(node, "salt"));
            byte[] iv = base64.decode(requiredText(node, "iv"));
            byte[] keyHash = node.hasNonNull("tokenHash")
                    ? HexFormat.of().parseHex(requiredText(node, "tokenHash"))
                    : new byte[0];
            byte[] ciphertext = base64.decode(requiredText(node, "data"));
            if (salt.length != CipherEngine.SALT_LENGTH
                    || iv.length != CipherEngine.IV_LENGTH
                    || (keyHash.length != 0 && keyHash.length != CipherEngine.KEY_HASH_LENGTH)
                    || ciphertext.length < GCM_TAG_LENGTH) {
                throw corrupted("Legacy envelope has invalid field lengths");
            }
            return new SingleStageEnvelope(JSON_V3, salt, iv, keyHash, ciphertext, false);
        } catch (IllegalArgumentException e) {
            throw new EnvelopeException(EnvelopeException.Reason.CORRUPTED_ENVELOPE,
                    "Legacy envelope field is not valid base64 or hex", e);
        }
    }

    private static String requiredText(JsonNode node, String field) {
        JsonNode value = node.get(field);
        if (value == null || !value.isTextual()) {
            throw corrupted("Legacy envelope is missing '" + field + "'");
        }
        return value.asText();
    }

    private static EnvelopeException corrupted(String message) {
        return new EnvelopeException(EnvelopeException.Reason.CORRUPTED_ENVELOPE, message);
    }
}
