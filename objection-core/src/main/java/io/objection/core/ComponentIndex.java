package io.objection.core;

import io.objection.json.spi.JsonCodec;
import io.objection.json.spi.JsonException;
import io.objection.json.spi.JsonNode;

/**
 * Opaque reference to a component tree, as produced by generated renderer bindings.
 *
 * <p>The core never inspects the result; it is shipped as the payload of a {@code root_mount} action.
 */
@FunctionalInterface
public interface ComponentIndex {

    JsonNode toNode(JsonCodec codec) throws JsonException;

    /**
     * Wraps any value the codec can serialize.
     */
    static ComponentIndex of(Object value) {
        return codec -> codec.valueToTree(value);
    }
}
