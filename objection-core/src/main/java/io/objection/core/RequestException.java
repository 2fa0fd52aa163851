package io.objection.core;

/**
 * The request body does not have the shape of a batch; no event of it is processed.
 */
public final class RequestException extends ObjectionException {

    public RequestException(String detail) {
        super("Invalid request body. " + detail);
    }

    public RequestException(String detail, Throwable cause) {
        super("Invalid request body. " + detail, cause);
    }
}
