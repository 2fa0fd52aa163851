package io.objection.core;

import io.objection.json.jackson.JacksonBinaryCodec;
import io.objection.json.jackson.JacksonJsonCodec;
import io.objection.json.spi.JsonCodec;
import io.objection.json.spi.JsonException;
import io.objection.json.spi.JsonNode;

final class Fixtures {
    private Fixtures() {}

    static final JsonCodec JSON = new JacksonJsonCodec();
    static final SymbolCodec SYMBOLS = new SymbolCodec(new JacksonBinaryCodec());

    static JsonNode json(String text) {
        try {
            return JSON.readTree(text);
        } catch (JsonException e) {
            throw new IllegalArgumentException(e);
        }
    }

    /**
     * Root for an event at {@code path}; {@code dataJson} may be null for an event without payload.
     */
    static SessionRoot root(EventPath path, String dataJson) {
        return SessionRoot.fromEvent(new RawEvent(path, dataJson == null ? null : json(dataJson)), JSON, SYMBOLS);
    }

    static String write(Object value) {
        try {
            return JSON.writeString(value);
        } catch (JsonException e) {
            throw new IllegalArgumentException(e);
        }
    }
}
