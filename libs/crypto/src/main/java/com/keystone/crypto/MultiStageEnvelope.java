package com.keystone.crypto;

/**
 * A stack of independently keyed layers. Only the outermost layer is visible; each inner
 * layer is the v5 encoding of the next {@link SingleStageEnvelope}, sitting inside the
 * ciphertext of the layer above it.
 *
 * @param outer the outermost layer (encrypted last, opened first)
 * @param depth total number of layers, at least 2
 */
public record MultiStageEnvelope(SingleStageEnvelope outer, int depth) implements EncryptedEnvelope {

    public MultiStageEnvelope {
        if (outer == null) {
            throw new IllegalArgumentException("outer must not be null");
        }
        if (depth < MultiStageCipher.MIN_STAGES || depth > MultiStageCipher.MAX_STAGES) {
            throw new IllegalArgumentException("depth must be between %d and %d, was %d"
                    .formatted(MultiStageCipher.MIN_STAGES, MultiStageCipher.MAX_STAGES, depth));
        }
    }
}
