package io.objection.core;

/**
 * Base class for Objection protocol errors.
 *
 * <p>These are expected, typed outcomes (a key that does not match, a renderer-supplied segment that does
 * not decode, a malformed request) rather than programming errors, so they are checked. Subclasses are
 * grouped per operation and preserve the original cause when applicable.
 */
public abstract class ObjectionException extends Exception {

    protected ObjectionException(String message) {
        super(message);
    }

    protected ObjectionException(String message, Throwable cause) {
        super(message, cause);
    }
}
