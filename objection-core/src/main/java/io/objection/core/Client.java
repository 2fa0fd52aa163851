package io.objection.core;

import io.objection.json.spi.JsonException;
import io.objection.json.spi.JsonNode;

import java.util.Objects;

/**
 * The single mutation handle of a {@link SessionRoot}.
 *
 * <p>Only a Client can consume the incoming payload ({@link EventKey#takeData(Client)}) or append actions
 * ({@link ActionKey#emit(Object, Client)}). At most one Client per root is open at a time; close it (or use
 * {@link SessionRoot#withClient}) before acquiring another or before touching the root directly.
 */
public final class Client implements AutoCloseable {

    private final SessionRoot root;
    private final EventPath scope;
    private boolean closed;

    Client(SessionRoot root, EventPath scope) {
        this.root = Objects.requireNonNull(root, "root");
        this.scope = Objects.requireNonNull(scope, "scope");
    }

    /**
     * View of this client's scope ({@code ["main"]}) for deriving event keys.
     */
    public Ui ui() {
        ensureOpen();
        return new Ui(scope, root.symbolCodec());
    }

    /**
     * Reader over the path of the event being handled.
     */
    public EventPathCursor eventPathCursor() {
        ensureOpen();
        return new EventPathCursor(root.eventPath(), root.symbolCodec());
    }

    public boolean isOpen() {
        return !closed && !root.isFinalized();
    }

    /**
     * Releases the root so that another client can be acquired. Idempotent.
     */
    @Override
    public void close() {
        if (!closed) {
            closed = true;
            root.release(this);
        }
    }

    EventPath incomingPath() {
        ensureOpen();
        return root.eventPath();
    }

    JsonNode takeEventData() {
        ensureOpen();
        return root.takeEventData();
    }

    void pushAction(EventPath path, String debugSymbol, Object data) {
        ensureOpen();
        JsonNode node;
        try {
            node = root.jsonCodec().valueToTree(data);
        } catch (JsonException e) {
            throw new IllegalArgumentException("cannot serialize action data for " + path, e);
        }
        root.appendAction(ActionNodes.action(root.jsonCodec(), path, debugSymbol, node));
    }

    private void ensureOpen() {
        if (closed) {
            throw new IllegalStateException("client is closed");
        }
        if (root.isFinalized()) {
            throw new IllegalStateException("session root is finalized");
        }
    }
}
