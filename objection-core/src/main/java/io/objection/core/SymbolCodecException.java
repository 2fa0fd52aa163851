package io.objection.core;

import java.util.Arrays;

/**
 * Raised when a path segment cannot be turned back into a value.
 */
public abstract class SymbolCodecException extends ObjectionException {

    protected SymbolCodecException(String message, Throwable cause) {
        super(message, cause);
    }

    /**
     * The segment is not valid hex, so no bytes could be recovered.
     */
    public static final class MalformedEncoding extends SymbolCodecException {
        private final String input;

        public MalformedEncoding(String input, Throwable cause) {
            super("failed to decode hex; " + cause.getMessage() + "; the following text is what we tried to parse: " + input,
                    cause);
            this.input = input;
        }

        public String input() {
            return input;
        }
    }

    /**
     * The bytes were recovered but do not deserialize as the requested type.
     */
    public static final class InvalidBytes extends SymbolCodecException {
        private final byte[] bytes;

        public InvalidBytes(byte[] bytes, Throwable cause) {
            super("failed to deserialize from raw bytes; " + cause.getMessage()
                    + "; the following bytes are what we tried to deserialize: " + Arrays.toString(bytes), cause);
            this.bytes = bytes.clone();
        }

        public byte[] bytes() {
            return bytes.clone();
        }
    }
}
