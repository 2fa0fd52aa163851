package io.objection.json.jackson;

import io.objection.json.spi.BinaryCodec;
import io.objection.json.spi.JsonCodec;
import io.objection.json.spi.JsonCodecProvider;

/**
 * ServiceLoader provider for {@link JacksonJsonCodec} and {@link JacksonBinaryCodec}.
 */
public final class JacksonJsonCodecProvider implements JsonCodecProvider {
    private final JsonCodec jsonCodec = new JacksonJsonCodec();
    private final BinaryCodec binaryCodec = new JacksonBinaryCodec();

    @Override
    public JsonCodec jsonCodec() {
        return jsonCodec;
    }

    @Override
    public BinaryCodec binaryCodec() {
        return binaryCodec;
    }
}
