package com.keystone.crypto;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DisplayName("MultiStageCipher")
class MultiStageCipherTest {

    private static final String OWNER_TOKEN = "owner.jwt.token-value-1234";
    private static final String REQUEST_KEY = "q2V0bXlSZXF1ZXN0S2V5QmFzZTY0VmFsdWVIZXJlIQ==";
    private static final byte[] EMAIL = "\"a@b.com\"".getBytes(StandardCharsets.UTF_8);

    private final CipherEngine engine = new CipherEngine();
    private final MultiStageCipher cipher = new MultiStageCipher(engine);

    @Nested
    @DisplayName("Two stages")
    class TwoStages {

        @Test
        @DisplayName("opens when unwound request key first, owner token second")
        void opensInReverseOrder() {
            MultiStageEnvelope envelope = cipher.seal(EMAIL, OWNER_TOKEN, REQUEST_KEY);

            assertThat(envelope.depth()).isEqualTo(2);
            assertThat(cipher.open(envelope, REQUEST_KEY, OWNER_TOKEN)).isEqualTo(EMAIL);
        }

        @Test
        @DisplayName("fails with WRONG_DECRYPTION_KEY when unwound in encryption order")
        void failsInForwardOrder() {
            MultiStageEnvelope envelope = cipher.seal(EMAIL, OWNER_TOKEN, REQUEST_KEY);

            assertThatThrownBy(() -> cipher.open(envelope, OWNER_TOKEN, REQUEST_KEY))
                    .isInstanceOf(EnvelopeException.class)
                    .extracting(e -> ((EnvelopeException) e).reason())
                    .isEqualTo(EnvelopeException.Reason.WRONG_DECRYPTION_KEY);
        }

        @Test
        @DisplayName("the request key alone yields only the owner-keyed inner layer")
        void requestKeyAloneIsNotEnough() {
            MultiStageEnvelope envelope = cipher.seal(EMAIL, OWNER_TOKEN, REQUEST_KEY);

            EncryptedEnvelope inner = cipher.peel(envelope, REQUEST_KEY);

            assertThat(inner).isInstanceOf(SingleStageEnvelope.class);
            SingleStageEnvelope ownerLayer = (SingleStageEnvelope) inner;
            assertThat(ownerLayer.keyHash()).isEqualTo(CipherEngine.keyHash(OWNER_TOKEN));
            assertThatThrownBy(() -> engine.decrypt(ownerLayer, REQUEST_KEY))
                    .isInstanceOf(EnvelopeException.class);
            assertThat(engine.decrypt(ownerLayer, OWNER_TOKEN)).isEqualTo(EMAIL);
        }

        @Test
        @DisplayName("the outer layer cannot be opened with the owner token alone")
        void outerLayerNeedsRequestKey() {
            MultiStageEnvelope envelope = cipher.seal(EMAIL, OWNER_TOKEN, REQUEST_KEY);

            assertThatThrownBy(() -> engine.decrypt(envelope.outer(), OWNER_TOKEN))
                    .isInstanceOf(EnvelopeException.class)
                    .extracting(e -> ((EnvelopeException) e).reason())
                    .isEqualTo(EnvelopeException.Reason.WRONG_DECRYPTION_KEY);
        }
    }

    @Nested
    @DisplayName("N stages")
    class NStages {

        @Test
        @DisplayName("three layers pop in strict reverse order")
        void threeLayers() {
            List<String> pushOrder = List.of("first-secret-0001", "second-secret-002", "third-secret-0003");
            MultiStageEnvelope envelope = cipher.seal(EMAIL, pushOrder);

            assertThat(envelope.depth()).isEqualTo(3);
            assertThat(cipher.peel(envelope, "third-secret-0003")).isInstanceOf(MultiStageEnvelope.class);
            assertThat(cipher.open(envelope, List.of("third-secret-0003", "second-secret-002", "first-secret-0001")))
                    .isEqualTo(EMAIL);
        }

        @Test
        @DisplayName("secret count must match the depth")
        void secretCountMustMatch() {
            MultiStageEnvelope envelope = cipher.seal(EMAIL, OWNER_TOKEN, REQUEST_KEY);

            assertThatThrownBy(() -> cipher.open(envelope, REQUEST_KEY))
                    .isInstanceOf(IllegalArgumentException.class);
        }

        @Test
        @DisplayName("fewer than two or more than ten secrets are refused")
        void stageBounds() {
            assertThatThrownBy(() -> cipher.seal(EMAIL, OWNER_TOKEN))
                    .isInstanceOf(IllegalArgumentException.class);
            assertThatThrownBy(() -> cipher.seal(EMAIL, java.util.Collections.nCopies(11, OWNER_TOKEN)))
                    .isInstanceOf(IllegalArgumentException.class);
        }
    }
}
