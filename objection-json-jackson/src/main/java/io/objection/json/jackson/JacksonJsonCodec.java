package io.objection.json.jackson;

import com.fasterxml.jackson.core.JsonFactory;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.cfg.CoercionAction;
import com.fasterxml.jackson.databind.cfg.CoercionInputShape;
import com.fasterxml.jackson.databind.type.LogicalType;
import io.objection.json.spi.ArrayNode;
import io.objection.json.spi.JsonCodec;
import io.objection.json.spi.JsonException;
import io.objection.json.spi.JsonNode;
import io.objection.json.spi.ObjectNode;

import java.util.Objects;

/**
 * Jackson implementation of JsonCodec.
 *
 * <p>The default mapper ignores unknown properties, so payload types only need to declare the
 * fields they read. Scalars are never converted between kinds: a number is not a valid string,
 * and neither a string nor a boolean is a valid number.
 */
public final class JacksonJsonCodec implements JsonCodec {
    private final ObjectMapper mapper;

    /**
     * Creates a Jackson codec with the default ObjectMapper.
     */
    public JacksonJsonCodec() {
        this(defaultMapper());
    }

    /**
     * Creates a Jackson codec with a custom ObjectMapper.
     * @param mapper the ObjectMapper to use
     */
    public JacksonJsonCodec(ObjectMapper mapper) {
        this.mapper = Objects.requireNonNull(mapper, "mapper");
    }

    static ObjectMapper defaultMapper() {
        ObjectMapper mapper = new ObjectMapper(new JsonFactory())
                .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false)
                .configure(DeserializationFeature.FAIL_ON_TRAILING_TOKENS, true);
        mapper.coercionConfigFor(LogicalType.Textual)
                .setCoercion(CoercionInputShape.Integer, CoercionAction.Fail)
                .setCoercion(CoercionInputShape.Float, CoercionAction.Fail)
                .setCoercion(CoercionInputShape.Boolean, CoercionAction.Fail);
        mapper.coercionConfigFor(LogicalType.Integer)
                .setCoercion(CoercionInputShape.String, CoercionAction.Fail)
                .setCoercion(CoercionInputShape.Float, CoercionAction.Fail)
                .setCoercion(CoercionInputShape.Boolean, CoercionAction.Fail);
        mapper.coercionConfigFor(LogicalType.Float)
                .setCoercion(CoercionInputShape.String, CoercionAction.Fail)
                .setCoercion(CoercionInputShape.Boolean, CoercionAction.Fail);
        mapper.coercionConfigFor(LogicalType.Boolean)
                .setCoercion(CoercionInputShape.String, CoercionAction.Fail)
                .setCoercion(CoercionInputShape.Integer, CoercionAction.Fail);
        return mapper;
    }

    /**
     * Returns the underlying ObjectMapper for advanced usage.
     */
    public ObjectMapper getMapper() {
        return mapper;
    }

    @Override
    public byte[] writeBytes(Object value) throws JsonException {
        try {
            return mapper.writeValueAsBytes(JacksonJsonNode.unwrapIfWrapped(value));
        } catch (Exception e) {
            throw new JsonException("Failed to serialize object to bytes", e);
        }
    }

    @Override
    public String writeString(Object value) throws JsonException {
        try {
            return mapper.writeValueAsString(JacksonJsonNode.unwrapIfWrapped(value));
        } catch (Exception e) {
            throw new JsonException("Failed to serialize object to string", e);
        }
    }

    @Override
    public JsonNode readTree(byte[] data) throws JsonException {
        try {
            return JacksonJsonNode.wrap(requireDocument(mapper.readTree(data)), mapper);
        } catch (JsonException e) {
            throw e;
        } catch (Exception e) {
            throw new JsonException(e.getMessage(), e);
        }
    }

    @Override
    public JsonNode readTree(String json) throws JsonException {
        try {
            return JacksonJsonNode.wrap(requireDocument(mapper.readTree(json)), mapper);
        } catch (JsonException e) {
            throw e;
        } catch (Exception e) {
            throw new JsonException(e.getMessage(), e);
        }
    }

    @Override
    public JsonNode valueToTree(Object value) throws JsonException {
        if (value instanceof JacksonJsonNode node) {
            return node;
        }
        try {
            com.fasterxml.jackson.databind.JsonNode tree = mapper.valueToTree(value);
            return JacksonJsonNode.wrap(tree == null ? mapper.nullNode() : tree, mapper);
        } catch (IllegalArgumentException e) {
            throw new JsonException("Failed to convert " + value.getClass().getName() + " to a tree; " + e.getMessage(), e);
        }
    }

    @Override
    public ObjectNode createObjectNode() {
        return new JacksonObjectNode(mapper.createObjectNode(), mapper);
    }

    @Override
    public ArrayNode createArrayNode() {
        return new JacksonArrayNode(mapper.createArrayNode(), mapper);
    }

    // readTree yields a MissingNode (or null) for empty content
    private static com.fasterxml.jackson.databind.JsonNode requireDocument(com.fasterxml.jackson.databind.JsonNode node)
            throws JsonException {
        if (node == null || node.isMissingNode()) {
            throw new JsonException("No content to parse");
        }
        return node;
    }
}
