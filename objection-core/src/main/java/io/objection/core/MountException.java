package io.objection.core;

/**
 * Raised by {@link SessionRoot#takeMountEvent()} when the bootstrap handshake cannot be read.
 */
public abstract class MountException extends ObjectionException {

    protected MountException(String message) {
        super(message);
    }

    protected MountException(String message, Throwable cause) {
        super(message, cause);
    }

    public static final class EmptyEventPath extends MountException {
        public EmptyEventPath() {
            super("found an empty path when trying to check for a mount event, which is never valid");
        }
    }

    public static final class NoEventData extends MountException {
        public NoEventData() {
            super("event key stated that this is a mount event, but no event data was given, which is not valid");
        }
    }

    public static final class FailedToDeserializeMountData extends MountException {
        public FailedToDeserializeMountData(String detail, Throwable cause) {
            super("event key stated that this is a mount event, but the event data didn't deserialize"
                    + " into the expected mount data structure; " + detail, cause);
        }
    }
}
