package io.objection.json.spi;

/**
 * Base exception for JSON and binary serialization and deserialization errors.
 */
public class JsonException extends Exception {
    public JsonException(String message) {
        super(message);
    }

    public JsonException(String message, Throwable cause) {
        super(message, cause);
    }
}
