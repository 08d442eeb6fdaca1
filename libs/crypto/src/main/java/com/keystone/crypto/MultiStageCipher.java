package com.keystone.crypto;

import java.util.List;

/**
 * Stacks independently keyed {@link CipherEngine} layers.
 * <p>
 * {@link #seal} pushes one layer per secret in the order given; the last secret protects
 * the outermost layer. {@link #open} pops layers in strict reverse order, so the secrets
 * must be supplied outermost first. A secret supplied out of turn fails the key hash check
 * of the layer it is tried against with {@link EnvelopeException.Reason#WRONG_DECRYPTION_KEY}.
 * <p>
 * The two-stage field privacy scheme is {@code seal(value, ownerToken, requestKey)} and
 * {@code open(envelope, requestKey, ownerToken)}.
 */
public final class MultiStageCipher {

    public static final int MIN_STAGES = 2;
    public static final int MAX_STAGES = 10;

    private final CipherEngine engine;

    public MultiStageCipher(CipherEngine engine) {
        if (engine == null) {
            throw new IllegalArgumentException("engine must not be null");
        }
        this.engine = engine;
    }

    /**
     * Encrypts {@code plaintext} once per secret, innermost first.
     *
     * @param plaintext the payload
     * @param secrets   layer secrets in push order (2 to {@value #MAX_STAGES})
     * @return the stacked envelope
     */
    public MultiStageEnvelope seal(byte[] plaintext, List<String> secrets) {
        requireStageCount(secrets);
        SingleStageEnvelope layer = engine.encrypt(plaintext, secrets.get(0), true);
        for (int i = 1; i < secrets.size(); i++) {
            layer = engine.encrypt(EnvelopeCodec.encode(layer), secrets.get(i), false);
        }
        return new MultiStageEnvelope(layer, secrets.size());
    }

    public MultiStageEnvelope seal(byte[] plaintext, String... secrets) {
        return seal(plaintext, List.of(secrets));
    }

    /**
     * Removes every layer.
     *
     * @param envelope the stacked envelope
     * @param secrets  one secret per layer, outermost first
     * @return the original plaintext
     * @throws IllegalArgumentException if the number of secrets differs from the depth
     * @throws EnvelopeException        if a secret is wrong or out of order
     */
    public byte[] open(MultiStageEnvelope envelope, List<String> secrets) {
        if (secrets == null || secrets.size() != envelope.depth()) {
            throw new IllegalArgumentException("expected %d secrets, got %d"
                    .formatted(envelope.depth(), secrets == null ? 0 : secrets.size()));
        }
        EncryptedEnvelope current = envelope;
        for (int i = 0; i < secrets.size() - 1; i++) {
            current = peel((MultiStageEnvelope) current, secrets.get(i));
        }
        return engine.decrypt((SingleStageEnvelope) current, secrets.get(secrets.size() - 1));
    }

    public byte[] open(MultiStageEnvelope envelope, String... secrets) {
        return open(envelope, List.of(secrets));
    }

    /**
     * Removes only the outermost layer. A two-stage envelope peels down to a
     * {@link SingleStageEnvelope}; deeper stacks stay multi-stage.
     *
     * @param envelope the stacked envelope
     * @param secret   the outermost layer's secret
     * @return the remaining layers
     */
    public EncryptedEnvelope peel(MultiStageEnvelope envelope, String secret) {
        SingleStageEnvelope inner = EnvelopeCodec.decodeBinary(engine.decrypt(envelope.outer(), secret));
        int remaining = envelope.depth() - 1;
        return remaining == 1 ? inner : new MultiStageEnvelope(inner, remaining);
    }

    private static void requireStageCount(List<String> secrets) {
        if (secrets == null || secrets.size() < MIN_STAGES || secrets.size() > MAX_STAGES) {
            throw new IllegalArgumentException("multi-stage sealing needs between %d and %d secrets"
                    .formatted(MIN_STAGES, MAX_STAGES));
        }
    }
}
