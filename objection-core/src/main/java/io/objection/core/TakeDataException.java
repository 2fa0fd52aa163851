package io.objection.core;

import java.util.List;

/**
 * Raised by {@link EventKey#takeData(Client)} when the key may not consume the incoming payload.
 */
public abstract class TakeDataException extends ObjectionException {

    protected TakeDataException(String message) {
        super(message);
    }

    protected TakeDataException(String message, Throwable cause) {
        super(message, cause);
    }

    /**
     * The key's path differs from the incoming event path. The payload was not touched.
     */
    public static final class DifferingEventPaths extends TakeDataException {
        private final EventPath existing;
        private final EventPath incoming;

        public DifferingEventPaths(EventPath existing, EventPath incoming) {
            super("this event path is different from the incoming event path;"
                    + " application should always validate the event path before taking the event data;"
                    + " this event path: " + existing + "; incoming event path: " + incoming);
            this.existing = existing;
            this.incoming = incoming;
        }

        public EventPath existing() {
            return existing;
        }

        public EventPath incoming() {
            return incoming;
        }

        public List<String> existingSegments() {
            return existing.segments();
        }

        public List<String> incomingSegments() {
            return incoming.segments();
        }
    }

    /**
     * The payload was already consumed for this event (or the event carried none).
     */
    public static final class DataAlreadyTaken extends TakeDataException {
        public DataAlreadyTaken() {
            super("tried to take event data, but it was already taken;"
                    + " this is probably caused by calling EventKey#takeData more than once for a single event");
        }
    }

    /**
     * The payload did not deserialize as the key's type. It has been consumed regardless.
     */
    public static final class FailedToDeserialize extends TakeDataException {
        public FailedToDeserialize(String detail, Throwable cause) {
            super("failed to deserialize event data according to the pre-specified type; " + detail, cause);
        }
    }
}
