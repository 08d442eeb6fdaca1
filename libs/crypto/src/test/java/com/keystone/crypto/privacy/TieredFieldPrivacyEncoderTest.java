package com.keystone.crypto.privacy;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.core.JsonGenerator;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.SerializerProvider;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import com.fasterxml.jackson.databind.annotation.JsonSerialize;
import com.fasterxml.jackson.databind.ser.std.StdSerializer;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.keystone.crypto.CipherEngine;
import com.keystone.crypto.EnvelopeException;
import com.keystone.crypto.MultiStageCipher;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.util.List;
import java.util.Set;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DisplayName("TieredFieldPrivacyEncoder")
class TieredFieldPrivacyEncoderTest {

    private static final String OWNER_TOKEN = "owner-token-abcdefghijklmnop";
    private static final String REQUEST_KEY = "request-key-0123456789abcdef";

    record Profile(
            String customerId,
            @FieldPrivacy String email,
            @FieldPrivacy(Visibility.PUBLIC) String displayName,
            @FieldPrivacy String phone
    ) {
    }

    @JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
    record SnakeCaseContact(String customerId, @FieldPrivacy String emailAddress) {
    }

    static class RenamedContact {
        @FieldPrivacy
        private final String emailAddress;

        RenamedContact(String emailAddress) {
            this.emailAddress = emailAddress;
        }

        @JsonProperty("email")
        public String getEmailAddress() {
            return emailAddress;
        }
    }

    static class AnnotatedGetterContact {
        private final String phone;

        AnnotatedGetterContact(String phone) {
            this.phone = phone;
        }

        @FieldPrivacy
        public String getPhone() {
            return phone;
        }
    }

    @JsonSerialize(using = CustomContactSerializer.class)
    record CustomContact(@FieldPrivacy String email) {
    }

    static class CustomContactSerializer extends StdSerializer<CustomContact> {

        CustomContactSerializer() {
            super(CustomContact.class);
        }

        @Override
        public void serialize(CustomContact value, JsonGenerator gen, SerializerProvider provider) throws IOException {
            gen.writeStartObject();
            gen.writeStringField("mail", value.email());
            gen.writeEndObject();
        }
    }

    private final ObjectMapper mapper = new ObjectMapper();
    private final TieredFieldPrivacyEncoder encoder =
            new TieredFieldPrivacyEncoder(new MultiStageCipher(new CipherEngine()), mapper);

    @Nested
    @DisplayName("encode")
    class Encode {

        @Test
        @DisplayName("seals private fields and leaves public ones untouched")
        void sealsPrivateFieldsOnly() {
            ObjectNode node = encoder.encode(new Profile("cust_1", "a@b.com", "Ada", null), OWNER_TOKEN, REQUEST_KEY);

            assertThat(node.get("customerId").asText()).isEqualTo("cust_1");
            assertThat(node.get("displayName").asText()).isEqualTo("Ada");
            assertThat(node.get("phone").isNull()).isTrue();

            JsonNode email = node.get("email");
            assertThat(email.get("doubleEncrypted").asBoolean()).isTrue();
            assertThat(email.get("stages").asInt()).isEqualTo(2);
            assertThat(email.get("envelope").asText()).isNotBlank();
            assertThat(email.toString()).doesNotContain("a@b.com");
        }

        @Test
        @DisplayName("collects private field names from annotations")
        void privateFieldNames() {
            assertThat(encoder.privateFields(Profile.class)).containsExactlyInAnyOrder("email", "phone");
        }
    }

    @Nested
    @DisplayName("property naming")
    class PropertyNaming {

        @Test
        @DisplayName("seals private fields under a snake_case naming strategy")
        void snakeCase() {
            ObjectNode node = encoder.encode(new SnakeCaseContact("c1", "a@b.com"), OWNER_TOKEN, REQUEST_KEY);

            assertThat(node.get("customer_id").asText()).isEqualTo("c1");
            assertThat(TieredFieldPrivacyEncoder.isSealed(node.get("email_address"))).isTrue();
            assertThat(node.toString()).doesNotContain("a@b.com");
            assertThat(encoder.openField(node.get("email_address"), List.of(REQUEST_KEY, OWNER_TOKEN)).asText())
                    .isEqualTo("a@b.com");
        }

        @Test
        @DisplayName("seals a private field whose getter is renamed")
        void renamedGetter() {
            ObjectNode node = encoder.encode(new RenamedContact("x@y.com"), OWNER_TOKEN, REQUEST_KEY);

            assertThat(node.has("emailAddress")).isFalse();
            assertThat(TieredFieldPrivacyEncoder.isSealed(node.get("email"))).isTrue();
            assertThat(node.toString()).doesNotContain("x@y.com");
        }

        @Test
        @DisplayName("seals a property annotated on its getter")
        void annotatedGetter() {
            ObjectNode node = encoder.encode(new AnnotatedGetterContact("+2348000000"), OWNER_TOKEN, REQUEST_KEY);

            assertThat(TieredFieldPrivacyEncoder.isSealed(node.get("phone"))).isTrue();
        }

        @Test
        @DisplayName("honours a mapper-level naming strategy")
        void mapperStrategy() {
            ObjectMapper kebab = new ObjectMapper().setPropertyNamingStrategy(PropertyNamingStrategies.KEBAB_CASE);
            TieredFieldPrivacyEncoder kebabEncoder =
                    new TieredFieldPrivacyEncoder(new MultiStageCipher(new CipherEngine()), kebab);

            ObjectNode node = kebabEncoder.encode(new Profile("cust_1", "a@b.com", "Ada", null), OWNER_TOKEN, REQUEST_KEY);

            assertThat(kebabEncoder.privateFields(Profile.class)).containsExactlyInAnyOrder("email", "phone");
            assertThat(node.get("display-name").asText()).isEqualTo("Ada");
            assertThat(TieredFieldPrivacyEncoder.isSealed(node.get("email"))).isTrue();
        }

        @Test
        @DisplayName("fails when a private value is serialized under a name it cannot find")
        void failsClosed() {
            assertThatThrownBy(() -> encoder.encode(new CustomContact("a@b.com"), OWNER_TOKEN, REQUEST_KEY))
                    .isInstanceOf(IllegalStateException.class)
                    .hasMessageContaining("'email'");
        }

        @Test
        @DisplayName("a missing private value with no content is not an error")
        void missingNullValue() {
            ObjectNode node = encoder.encode(new CustomContact(null), OWNER_TOKEN, REQUEST_KEY);

            assertThat(node.has("mail")).isTrue();
        }
    }

    @Nested
    @DisplayName("openField")
    class OpenField {

        @Test
        @DisplayName("returns the original value with request key then owner token")
        void opensInOrder() {
            ObjectNode node = encoder.encode(new Profile("cust_1", "a@b.com", "Ada", null), OWNER_TOKEN, REQUEST_KEY);

            JsonNode email = encoder.openField(node.get("email"), List.of(REQUEST_KEY, OWNER_TOKEN));

            assertThat(email.asText()).isEqualTo("a@b.com");
        }

        @Test
        @DisplayName("fails when unwound in the wrong order")
        void wrongOrder() {
            ObjectNode node = encoder.encode(new Profile("cust_1", "a@b.com", "Ada", null), OWNER_TOKEN, REQUEST_KEY);

            assertThatThrownBy(() -> encoder.openField(node.get("email"), List.of(OWNER_TOKEN, REQUEST_KEY)))
                    .isInstanceOf(EnvelopeException.class)
                    .extracting(e -> ((EnvelopeException) e).reason())
                    .isEqualTo(EnvelopeException.Reason.WRONG_DECRYPTION_KEY);
        }

        @Test
        @DisplayName("rejects values that are not sealed fields")
        void notSealed() {
            assertThat(TieredFieldPrivacyEncoder.isSealed(mapper.getNodeFactory().textNode("a@b.com"))).isFalse();
            assertThatThrownBy(() -> encoder.openField(mapper.getNodeFactory().textNode("x"), List.of(REQUEST_KEY, OWNER_TOKEN)))
                    .isInstanceOf(EnvelopeException.class);
        }
    }

    @Test
    @DisplayName("sealFields supports deeper stacks on structured values")
    void threeStageStructuredValue() {
        ObjectNode node = mapper.createObjectNode();
        node.putObject("address").put("city", "Lagos").put("zip", "100001");
        node.put("plan", "pro");
        List<String> secrets = List.of("stage-one-secret", "stage-two-secret", "stage-three-secret");

        encoder.sealFields(node, Set.of("address"), secrets);

        assertThat(node.get("address").get("stages").asInt()).isEqualTo(3);
        JsonNode address = encoder.openField(node.get("address"),
                List.of("stage-three-secret", "stage-two-secret", "stage-one-secret"));
        assertThat(address.get("city").asText()).isEqualTo("Lagos");
        assertThat(node.get("plan").asText()).isEqualTo("pro");
    }
}
