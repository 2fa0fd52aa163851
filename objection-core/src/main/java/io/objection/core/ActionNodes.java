package io.objection.core;

import io.objection.json.spi.ArrayNode;
import io.objection.json.spi.JsonCodec;
import io.objection.json.spi.JsonNode;
import io.objection.json.spi.ObjectNode;

/**
 * Builds the wire form of actions and keys.
 */
final class ActionNodes {
    private ActionNodes() {}

    /**
     * {@code {"key": {"actionPath": [...], "debugSymbol": ...}, "data": ...}}
     */
    static ObjectNode action(JsonCodec codec, EventPath path, String debugSymbol, JsonNode data) {
        ObjectNode action = codec.createObjectNode();
        writeKey(action.putObject(Protocol.F_KEY), Protocol.F_ACTION_PATH, path, debugSymbol);
        action.set(Protocol.F_DATA, data);
        return action;
    }

    static ObjectNode error(JsonCodec codec, String message) {
        ObjectNode action = action(codec, EventPath.of(Protocol.ROOT_ERROR), null, null);
        action.put(Protocol.F_DATA, message);
        return action;
    }

    static ObjectNode key(JsonCodec codec, String pathField, EventPath path, String debugSymbol) {
        ObjectNode key = codec.createObjectNode();
        writeKey(key, pathField, path, debugSymbol);
        return key;
    }

    private static void writeKey(ObjectNode key, String pathField, EventPath path, String debugSymbol) {
        ArrayNode segments = key.putArray(pathField);
        for (Symbol symbol : path.symbols()) {
            segments.add(symbol.value());
        }
        key.put(Protocol.F_DEBUG_SYMBOL, debugSymbol);
    }
}
