package com.keystone.crypto;

/**
 * An encrypted payload, either a single AES-GCM layer or a stack of layers.
 * <p>
 * The two variants are deliberately not interchangeable: {@link CipherEngine#decrypt}
 * only accepts a {@link SingleStageEnvelope}, and {@link MultiStageCipher#open} only
 * accepts a {@link MultiStageEnvelope}.
 */
public sealed interface EncryptedEnvelope permits SingleStageEnvelope, MultiStageEnvelope {

    /**
     * Number of independently keyed layers protecting the payload.
     */
    int depth();
}
