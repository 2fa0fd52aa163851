package io.objection.json.jackson;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.MapperFeature;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.dataformat.cbor.databind.CBORMapper;
import io.objection.json.spi.BinaryCodec;
import io.objection.json.spi.JsonException;

import java.util.Objects;

/**
 * CBOR implementation of {@link BinaryCodec}.
 *
 * <p>Properties and map entries are written in sorted order so that equal values always encode
 * to identical bytes. Unknown properties and trailing bytes are rejected on read.
 */
public final class JacksonBinaryCodec implements BinaryCodec {
    private final CBORMapper mapper;

    public JacksonBinaryCodec() {
        this(CBORMapper.builder()
                .enable(MapperFeature.SORT_PROPERTIES_ALPHABETICALLY)
                .enable(SerializationFeature.ORDER_MAP_ENTRIES_BY_KEYS)
                .enable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES)
                .enable(DeserializationFeature.FAIL_ON_TRAILING_TOKENS)
                .build());
    }

    public JacksonBinaryCodec(CBORMapper mapper) {
        this.mapper = Objects.requireNonNull(mapper, "mapper");
    }

    @Override
    public byte[] writeBinary(Object value) throws JsonException {
        try {
            return mapper.writeValueAsBytes(value);
        } catch (Exception e) {
            throw new JsonException("Failed to serialize object to CBOR; " + e.getMessage(), e);
        }
    }

    @Override
    public <T> T readBinary(byte[] data, Class<T> type) throws JsonException {
        Objects.requireNonNull(type, "type");
        if (data == null || data.length == 0) {
            throw new JsonException("Cannot deserialize " + type.getName() + " from empty data");
        }
        try {
            T value = mapper.readValue(data, type);
            if (value == null) {
                throw new JsonException("CBOR null is not a valid " + type.getName());
            }
            return value;
        } catch (JsonException e) {
            throw e;
        } catch (Exception e) {
            throw new JsonException("Failed to deserialize CBOR to " + type.getName() + "; " + e.getMessage(), e);
        }
    }
}
