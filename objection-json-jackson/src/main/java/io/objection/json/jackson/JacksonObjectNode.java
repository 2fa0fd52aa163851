package io.objection.json.jackson;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.objection.json.spi.ArrayNode;
import io.objection.json.spi.JsonNode;
import io.objection.json.spi.ObjectNode;

/**
 * Jackson implementation of ObjectNode.
 */
final class JacksonObjectNode extends JacksonJsonNode implements ObjectNode {
    private final com.fasterxml.jackson.databind.node.ObjectNode objectDelegate;

    JacksonObjectNode(com.fasterxml.jackson.databind.node.ObjectNode delegate, ObjectMapper mapper) {
        super(delegate, mapper);
        this.objectDelegate = delegate;
    }

    @Override
    public ObjectNode put(String fieldName, String value) {
        objectDelegate.put(fieldName, value);
        return this;
    }

    @Override
    public ObjectNode set(String fieldName, JsonNode value) {
        objectDelegate.set(fieldName, JacksonJsonNode.unwrap(value, mapper));
        return this;
    }

    @Override
    public ObjectNode putObject(String fieldName) {
        return new JacksonObjectNode(objectDelegate.putObject(fieldName), mapper);
    }

    @Override
    public ArrayNode putArray(String fieldName) {
        return new JacksonArrayNode(objectDelegate.putArray(fieldName), mapper);
    }
}
