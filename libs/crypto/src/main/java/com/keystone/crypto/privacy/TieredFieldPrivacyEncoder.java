package com.keystone.crypto.privacy;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.BeanDescription;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.introspect.AnnotatedMember;
import com.fasterxml.jackson.databind.introspect.BeanPropertyDefinition;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.keystone.crypto.EnvelopeCodec;
import com.keystone.crypto.EnvelopeException;
import com.keystone.crypto.MultiStageCipher;
import com.keystone.crypto.MultiStageEnvelope;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.util.ArrayList;
import java.util.Base64;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Seals the {@link Visibility#PRIVATE} fields of a DTO with stacked encryption.
 * <p>
 * Stage 1 uses the data owner's token, stage 2 the request key minted for one sharing
 * request. A sealed field is replaced by
 * <pre>{"doubleEncrypted": true, "stages": 2, "envelope": "&lt;base64 v5&gt;"}</pre>
 * Public and unannotated fields are left untouched, as are private fields whose value is
 * null. Property names are resolved by the mapper, so naming strategies and renamed
 * accessors are honoured. A private property with a value that is missing from the
 * serialized tree fails the encoding.
 */
public final class TieredFieldPrivacyEncoder {

    private static final Logger log = LoggerFactory.getLogger(TieredFieldPrivacyEncoder.class);

    public static final String SEALED_MARKER = "doubleEncrypted";
    public static final String STAGES = "stages";
    public static final String ENVELOPE = "envelope";

    private final MultiStageCipher cipher;
    private final ObjectMapper mapper;
    private final Map<Class<?>, List<PrivateProperty>> privateFieldCache = new ConcurrentHashMap<>();

    public TieredFieldPrivacyEncoder(MultiStageCipher cipher, ObjectMapper mapper) {
        if (cipher == null || mapper == null) {
            throw new IllegalArgumentException("cipher and mapper must not be null");
        }
        this.cipher = cipher;
        this.mapper = mapper;
    }

    /**
     * Serializes {@code value} and seals its private fields in two stages.
     *
     * @param value      the DTO
     * @param ownerToken the data owner's bearer token (stage 1)
     * @param requestKey the sharing request's key (stage 2)
     * @return the JSON tree with private fields sealed
     */
    public ObjectNode encode(Object value, String ownerToken, String requestKey) {
        JsonNode tree = mapper.valueToTree(value);
        if (!(tree instanceof ObjectNode node)) {
            throw new IllegalArgumentException("only objects can carry private fields");
        }
        List<PrivateProperty> properties = privateProperties(value.getClass());
        Set<String> names = new LinkedHashSet<>();
        for (PrivateProperty property : properties) {
            if (!node.has(property.name()) && property.valueOf(value) != null) {
                throw new IllegalStateException("Private property '" + property.name() + "' of "
                        + value.getClass().getName() + " is missing from the serialized form");
            }
            names.add(property.name());
        }
        return sealFields(node, names, List.of(ownerToken, requestKey));
    }

    /**
     * Seals the named fields of an already serialized object with an arbitrary stack of
     * secrets (innermost first). The node is modified in place and returned.
     */
    public ObjectNode sealFields(ObjectNode node, Set<String> fieldNames, List<String> secrets) {
        for (String name : fieldNames) {
            JsonNode fieldValue = node.get(name);
            if (fieldValue == null || fieldValue.isNull()) {
                continue;
            }
            MultiStageEnvelope envelope = cipher.seal(toBytes(fieldValue), secrets);
            ObjectNode sealed = mapper.createObjectNode();
            sealed.put(SEALED_MARKER, true);
            sealed.put(STAGES, envelope.depth());
            sealed.put(ENVELOPE, Base64.getEncoder().encodeToString(EnvelopeCodec.encode(envelope)));
            node.set(name, sealed);
        }
        log.debug("Sealed {} field(s) in {} stages", fieldNames.size(), secrets.size());
        return node;
    }

    /**
     * Recovers a sealed field's original JSON value.
     *
     * @param sealed  the sealed field representation
     * @param secrets one secret per stage, outermost first (request key, then owner token)
     * @throws EnvelopeException if a secret is wrong or out of order
     */
    public JsonNode openField(JsonNode sealed, List<String> secrets) {
        byte[] plaintext = cipher.open(envelopeOf(sealed), secrets);
        try {
            return mapper.readTree(plaintext);
        } catch (IOException e) {
            throw new EnvelopeException(EnvelopeException.Reason.CORRUPTED_ENVELOPE,
                    "Sealed field does not contain JSON", e);
        }
    }

    /**
     * Parses the sealed field representation back into an envelope.
     */
    public static MultiStageEnvelope envelopeOf(JsonNode sealed) {
        if (!isSealed(sealed)) {
            throw new EnvelopeException(EnvelopeException.Reason.CORRUPTED_ENVELOPE,
                    "Value is not a sealed field");
        }
        byte[] binary;
        try {
            binary = Base64.getDecoder().decode(sealed.get(ENVELOPE).asText());
        } catch (IllegalArgumentException e) {
            throw new EnvelopeException(EnvelopeException.Reason.CORRUPTED_ENVELOPE,
                    "Sealed field envelope is not valid base64", e);
        }
        int stages = sealed.path(STAGES).asInt(0);
        if (stages < MultiStageCipher.MIN_STAGES || stages > MultiStageCipher.MAX_STAGES) {
            throw new EnvelopeException(EnvelopeException.Reason.CORRUPTED_ENVELOPE,
                    "Sealed field has an invalid stage count: " + stages);
        }
        return new MultiStageEnvelope(EnvelopeCodec.decodeBinary(binary), stages);
    }

    /**
     * Whether a JSON value is a sealed field.
     */
    public static boolean isSealed(JsonNode value) {
        return value != null
                && value.isObject()
                && value.path(SEALED_MARKER).asBoolean(false)
                && value.path(ENVELOPE).isTextual();
    }

    /**
     * JSON property names of the properties marked {@link Visibility#PRIVATE} on a type, as
     * the mapper names them.
     */
    public Set<String> privateFields(Class<?> type) {
        Set<String> names = new LinkedHashSet<>();
        for (PrivateProperty property : privateProperties(type)) {
            names.add(property.name());
        }
        return names;
    }

    private List<PrivateProperty> privateProperties(Class<?> type) {
        return privateFieldCache.computeIfAbsent(type, this::scanPrivateProperties);
    }

    private List<PrivateProperty> scanPrivateProperties(Class<?> type) {
        BeanDescription description = mapper.getSerializationConfig().introspect(mapper.constructType(type));
        List<PrivateProperty> found = new ArrayList<>();
        for (BeanPropertyDefinition property : description.findProperties()) {
            if (isPrivate(property.getField()) || isPrivate(property.getGetter())) {
                AnnotatedMember accessor = property.getAccessor();
                if (accessor != null) {
                    accessor.fixAccess(true);
                }
                found.add(new PrivateProperty(property.getName(), accessor));
            }
        }
        return List.copyOf(found);
    }

    private static boolean isPrivate(AnnotatedMember member) {
        if (member == null) {
            return false;
        }
        FieldPrivacy privacy = member.getAnnotation(FieldPrivacy.class);
        return privacy != null && privacy.value() == Visibility.PRIVATE;
    }

    private record PrivateProperty(String name, AnnotatedMember accessor) {

        Object valueOf(Object bean) {
            if (accessor == null) {
                return null;
            }
            try {
                return accessor.getValue(bean);
            } catch (IllegalArgumentException e) {
                throw new IllegalStateException("Private property '" + name + "' could not be read", e);
            }
        }
    }

    private byte[] toBytes(JsonNode value) {
        try {
            return mapper.writeValueAsBytes(value);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Field value could not be serialized", e);
        }
    }
}
