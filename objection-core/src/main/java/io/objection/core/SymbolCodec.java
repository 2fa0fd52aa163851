package io.objection.core;

import io.objection.json.spi.BinaryCodec;
import io.objection.json.spi.JsonException;

import java.util.HexFormat;
import java.util.Objects;

/**
 * Encodes typed values into path-safe {@link Symbol}s and back.
 *
 * <p>A value is written in the canonical compact binary form of the configured {@link BinaryCodec} and
 * rendered as lowercase hex. The symbol carries no type tag: {@link #decode(Symbol, Class)} must be given
 * the type that was encoded. Decoding with a different but compatible type (an {@code Integer} read back
 * as a {@code Long}) succeeds with whatever the bytes happen to mean.
 */
public final class SymbolCodec {

    private static final HexFormat HEX = HexFormat.of();

    private final BinaryCodec binaryCodec;

    public SymbolCodec(BinaryCodec binaryCodec) {
        this.binaryCodec = Objects.requireNonNull(binaryCodec, "binaryCodec");
    }

    /**
     * Encodes a value as a dynamic path segment.
     *
     * @throws IllegalArgumentException if the value cannot be serialized at all
     */
    public Symbol encode(Object value) {
        Objects.requireNonNull(value, "value");
        byte[] bytes;
        try {
            bytes = binaryCodec.writeBinary(value);
        } catch (JsonException e) {
            throw new IllegalArgumentException("cannot encode " + value.getClass().getName() + " as a symbol", e);
        }
        return Symbol.literal(HEX.formatHex(bytes));
    }

    public <S> S decode(Symbol symbol, Class<S> type) throws SymbolCodecException {
        Objects.requireNonNull(symbol, "symbol");
        return decode(symbol.value(), type);
    }

    /**
     * Decodes a raw segment as received from the renderer.
     */
    public <S> S decode(String text, Class<S> type) throws SymbolCodecException {
        Objects.requireNonNull(text, "text");
        Objects.requireNonNull(type, "type");

        byte[] bytes;
        try {
            bytes = HEX.parseHex(text);
        } catch (IllegalArgumentException e) {
            throw new SymbolCodecException.MalformedEncoding(text, e);
        }

        try {
            return binaryCodec.readBinary(bytes, type);
        } catch (JsonException | RuntimeException e) {
            throw new SymbolCodecException.InvalidBytes(bytes, e);
        }
    }
}
