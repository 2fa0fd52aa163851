package io.objection.core;

import io.objection.json.spi.JsonCodec;
import io.objection.json.spi.JsonException;
import io.objection.json.spi.JsonNode;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * State of one incoming event while its handler runs.
 *
 * <p>Lifecycle:
 * <ol>
 *   <li><b>Created</b> by {@link #fromEvent} with the event's path and unconsumed payload.</li>
 *   <li><b>Active</b> once {@link #getClient()} hands out the single {@link Client}; keys consume the
 *       payload and append actions through it.</li>
 *   <li><b>Finalized</b> by {@link #intoResponse()}; every further call fails.</li>
 * </ol>
 *
 * <p>Instances are single-writer and not thread-safe. An asynchronous handler may continue on another
 * thread as long as it does not touch the root concurrently. The one exception is expiry: when the
 * dispatcher gives up on a handler it finalizes the root from its timer thread, and the handler's
 * next call on the root or its client fails.
 */
public final class SessionRoot {

    private enum State { CREATED, ACTIVE, FINALIZED }

    private final EventPath eventPath;
    private final JsonCodec jsonCodec;
    private final SymbolCodec symbolCodec;
    private final List<JsonNode> actions = new ArrayList<>();
    private JsonNode eventData;
    private volatile State state = State.CREATED;
    private Client openClient;

    private SessionRoot(RawEvent event, JsonCodec jsonCodec, SymbolCodec symbolCodec) {
        this.eventPath = event.path();
        this.eventData = event.data();
        this.jsonCodec = Objects.requireNonNull(jsonCodec, "jsonCodec");
        this.symbolCodec = Objects.requireNonNull(symbolCodec, "symbolCodec");
    }

    public static SessionRoot fromEvent(RawEvent event, JsonCodec jsonCodec, SymbolCodec symbolCodec) {
        Objects.requireNonNull(event, "event");
        return new SessionRoot(event, jsonCodec, symbolCodec);
    }

    public EventPath eventPath() {
        return eventPath;
    }

    /**
     * Whether the incoming payload is still available.
     */
    public boolean hasEventData() {
        return eventData != null;
    }

    /**
     * Acquires the mutation handle, rooted at {@link Protocol#ROOT_SCOPE}.
     *
     * @throws IllegalStateException if a client is already open or the root is finalized
     */
    public Client getClient() {
        ensureNotFinalized();
        if (openClient != null) {
            throw new IllegalStateException("a client is already open for event " + eventPath);
        }
        openClient = new Client(this, EventPath.of(Protocol.ROOT_SCOPE));
        state = State.ACTIVE;
        return openClient;
    }

    /**
     * Runs {@code work} with a client that is closed afterwards, even if {@code work} throws.
     */
    public <R, E extends Exception> R withClient(ClientFunction<R, E> work) throws E {
        Objects.requireNonNull(work, "work");
        try (Client client = getClient()) {
            return work.apply(client);
        }
    }

    /**
     * Checks whether this is the session bootstrap event and, if so, consumes its payload.
     *
     * <p>Only the first path segment is examined. For any event other than {@link Protocol#MOUNT_EVENT} the
     * payload stays available for ordinary key matching.
     *
     * @return the mount data, or empty if this is not a mount event
     * @throws MountException.EmptyEventPath if the incoming path is empty
     * @throws MountException.NoEventData if this is a mount event without payload
     * @throws MountException.FailedToDeserializeMountData if the payload is not {@code {token}}
     */
    public Optional<MountData> takeMountEvent() throws MountException {
        ensureNoClient();
        Symbol first = eventPath.first().orElseThrow(MountException.EmptyEventPath::new);
        if (!Protocol.MOUNT_EVENT.equals(first.value())) {
            return Optional.empty();
        }

        JsonNode raw = takeEventData();
        if (raw == null) {
            throw new MountException.NoEventData();
        }
        if (!raw.isObject()) {
            throw new MountException.FailedToDeserializeMountData("expected an object, found " + raw, null);
        }
        try {
            return Optional.of(raw.toObject(MountData.class));
        } catch (JsonException e) {
            throw new MountException.FailedToDeserializeMountData(e.getMessage(), e);
        }
    }

    /**
     * Appends a {@code root_mount} action that replaces the whole rendered tree. Each call appends.
     *
     * @throws IllegalArgumentException if the component cannot be serialized
     */
    public void setRootUi(ComponentIndex component) {
        Objects.requireNonNull(component, "component");
        ensureNoClient();
        JsonNode data;
        try {
            data = component.toNode(jsonCodec);
        } catch (JsonException e) {
            throw new IllegalArgumentException("cannot serialize root component", e);
        }
        actions.add(ActionNodes.action(jsonCodec, EventPath.of(Protocol.ROOT_MOUNT), null, data));
    }

    /**
     * Finalizes the root and returns its action log. Any open client stops working.
     */
    public UiResponse intoResponse() {
        ensureNotFinalized();
        state = State.FINALIZED;
        openClient = null;
        return new UiResponse(actions);
    }

    /**
     * Finalizes the root without producing a response, for a handler that ran out of time.
     */
    void expire() {
        state = State.FINALIZED;
    }

    boolean isFinalized() {
        return state == State.FINALIZED;
    }

    JsonCodec jsonCodec() {
        return jsonCodec;
    }

    SymbolCodec symbolCodec() {
        return symbolCodec;
    }

    JsonNode takeEventData() {
        JsonNode data = eventData;
        eventData = null;
        return data;
    }

    void appendAction(JsonNode action) {
        actions.add(action);
    }

    void release(Client client) {
        if (openClient == client) {
            openClient = null;
        }
    }

    private void ensureNotFinalized() {
        if (state == State.FINALIZED) {
            throw new IllegalStateException("session root is finalized");
        }
    }

    private void ensureNoClient() {
        ensureNotFinalized();
        if (openClient != null) {
            throw new IllegalStateException("cannot modify the session root while a client is open");
        }
    }
}
