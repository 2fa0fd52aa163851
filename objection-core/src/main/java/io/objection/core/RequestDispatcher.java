package io.objection.core;

import io.objection.json.spi.ArrayNode;
import io.objection.json.spi.JsonCodec;
import io.objection.json.spi.JsonCodecProvider;
import io.objection.json.spi.JsonException;
import io.objection.json.spi.JsonNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.CompletionStage;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Transport-neutral entry point of the protocol: turns one request body into one response body.
 *
 * <p>Events of a request are handled strictly in order, each with a fresh {@link SessionRoot}; the next
 * handler is only invoked once the previous one has completed. The response concatenates the action logs
 * in event order. A handler failure becomes a single {@code root_error} action for that event and does not
 * affect the others; a malformed body becomes a response consisting of a single {@code root_error}.
 *
 * <p>Use {@link #builder()} to create instances with custom configuration:
 * <pre>{@code
 * RequestDispatcher dispatcher = RequestDispatcher.builder()
 *     .handlerTimeout(Duration.ofSeconds(10))
 *     .maxEventsPerRequest(64)
 *     .build();
 *
 * dispatcher.dispatch(body, (sessionId, root) -> app.handle(sessionId, root))
 *     .thenAccept(transport::reply);
 * }</pre>
 */
public final class RequestDispatcher {
    private static final Logger log = LoggerFactory.getLogger(RequestDispatcher.class);

    /**
     * Default: accept any number of events and let the transport enforce body limits.
     */
    public static final int NO_EVENT_LIMIT = Integer.MAX_VALUE;

    private final JsonCodec jsonCodec;
    private final SymbolCodec symbolCodec;
    private final Duration handlerTimeout;
    private final int maxEventsPerRequest;

    /**
     * Creates a new builder for configuring a dispatcher.
     */
    public static Builder builder() {
        return new Builder();
    }

    private RequestDispatcher(Builder builder) {
        JsonCodecProvider provider = builder.jsonCodec == null || builder.symbolCodec == null
                ? ServiceLoaderCodecs.defaultProvider()
                : null;
        this.jsonCodec = builder.jsonCodec != null ? builder.jsonCodec : provider.jsonCodec();
        this.symbolCodec = builder.symbolCodec != null ? builder.symbolCodec : new SymbolCodec(provider.binaryCodec());
        this.handlerTimeout = builder.handlerTimeout;
        this.maxEventsPerRequest = builder.maxEventsPerRequest > 0 ? builder.maxEventsPerRequest : NO_EVENT_LIMIT;
    }

    /**
     * Builder for {@link RequestDispatcher}.
     */
    public static final class Builder {
        private JsonCodec jsonCodec;
        private SymbolCodec symbolCodec;
        private Duration handlerTimeout;
        private int maxEventsPerRequest;

        private Builder() {}

        /** Sets the codec for request and response documents. Default: discovered via ServiceLoader. */
        public Builder jsonCodec(JsonCodec jsonCodec) {
            this.jsonCodec = jsonCodec;
            return this;
        }

        /** Sets the codec for dynamic path symbols. Default: discovered via ServiceLoader. */
        public Builder symbolCodec(SymbolCodec symbolCodec) {
            this.symbolCodec = symbolCodec;
            return this;
        }

        /**
         * Sets how long a single event handler may take. Default: no limit.
         *
         * <p>An expired event contributes a {@code root_error} action; anything it logged is discarded.
         * Its session root is finalized at once, so the handler's later calls on it fail. The timeout
         * bounds the event's result, not the handler's run time: the next event still waits until the
         * expired handler's stage completes, so events never overlap. A handler whose stage never
         * completes stalls the rest of the request; cancel the future returned by {@code dispatch} to
         * abandon it.
         */
        public Builder handlerTimeout(Duration handlerTimeout) {
            if (handlerTimeout != null && (handlerTimeout.isNegative() || handlerTimeout.isZero())) {
                throw new IllegalArgumentException("handlerTimeout must be positive");
            }
            this.handlerTimeout = handlerTimeout;
            return this;
        }

        /** Sets the maximum number of events per request. Default: {@link #NO_EVENT_LIMIT}. */
        public Builder maxEventsPerRequest(int maxEventsPerRequest) {
            this.maxEventsPerRequest = maxEventsPerRequest;
            return this;
        }

        /** Builds the dispatcher with the configured settings. */
        public RequestDispatcher build() {
            return new RequestDispatcher(this);
        }
    }

    public JsonCodec jsonCodec() {
        return jsonCodec;
    }

    public SymbolCodec symbolCodec() {
        return symbolCodec;
    }

    /**
     * Dispatches a JSON text body and renders the response as JSON text.
     */
    public CompletableFuture<String> dispatch(String body, EventHandler handler) {
        Objects.requireNonNull(body, "body");
        JsonNode tree;
        try {
            tree = jsonCodec.readTree(body);
        } catch (JsonException e) {
            return CompletableFuture.completedFuture(render(reject(new RequestException(e.getMessage(), e))));
        }
        return dispatch(tree, handler).thenApply(this::render);
    }

    /**
     * Dispatches a UTF-8 JSON body and renders the response as UTF-8 JSON.
     */
    public CompletableFuture<byte[]> dispatch(byte[] body, EventHandler handler) {
        Objects.requireNonNull(body, "body");
        JsonNode tree;
        try {
            tree = jsonCodec.readTree(body);
        } catch (JsonException e) {
            return CompletableFuture.completedFuture(renderBytes(reject(new RequestException(e.getMessage(), e))));
        }
        return dispatch(tree, handler).thenApply(this::renderBytes);
    }

    /**
     * Dispatches a parsed body.
     *
     * <p>The returned future never completes exceptionally. Cancelling it stops the dispatch before the
     * next event; the actions of events not yet completed are dropped.
     */
    public CompletableFuture<ArrayNode> dispatch(JsonNode body, EventHandler handler) {
        Objects.requireNonNull(handler, "handler");
        RawRequest request;
        try {
            request = RequestParser.parse(body, maxEventsPerRequest);
        } catch (RequestException e) {
            return CompletableFuture.completedFuture(reject(e));
        }

        CompletableFuture<ArrayNode> result = new CompletableFuture<>();
        List<JsonNode> buffer = new ArrayList<>();
        CompletableFuture<Void> chain = CompletableFuture.completedFuture(null);
        for (RawEvent event : request.events()) {
            chain = chain.thenCompose(ignored -> result.isDone()
                    ? CompletableFuture.<Void>completedFuture(null)
                    : dispatchEvent(request.sessionId(), event, handler).thenAccept(buffer::addAll));
        }
        chain.whenComplete((ignored, error) -> {
            if (error != null) {
                result.completeExceptionally(error);
            } else {
                result.complete(jsonCodec.createArrayNode().addAll(buffer));
            }
        });
        return result;
    }

    private CompletableFuture<List<JsonNode>> dispatchEvent(String sessionId, RawEvent event, EventHandler handler) {
        log.debug("Dispatching event {} of session {}", event.path(), sessionId);
        SessionRoot root = SessionRoot.fromEvent(event, jsonCodec, symbolCodec);

        CompletableFuture<UiResponse> running;
        try {
            CompletionStage<UiResponse> stage = handler.handle(sessionId, root);
            running = stage != null
                    ? stage.toCompletableFuture()
                    : CompletableFuture.failedFuture(new IllegalStateException("event handler returned no result"));
        } catch (Exception e) {
            running = CompletableFuture.failedFuture(e);
        }
        if (handlerTimeout == null) {
            return running.handle((response, error) -> fold(sessionId, event, response, error));
        }

        CompletableFuture<UiResponse> handlerStage = running;
        // copy() so that the timeout does not complete the handler's own future; a failure relayed from
        // the handler arrives wrapped, the timeout itself arrives bare
        return running.copy()
                .orTimeout(handlerTimeout.toMillis(), TimeUnit.MILLISECONDS)
                .handle((response, error) -> {
                    if (error instanceof TimeoutException) {
                        root.expire();
                        String message = "event handler timed out after " + handlerTimeout.toMillis() + " ms";
                        log.warn("Event {} of session {} failed: {}", event.path(), sessionId, message);
                        return List.<JsonNode>of(ActionNodes.error(jsonCodec, message));
                    }
                    return fold(sessionId, event, response, error);
                })
                // the next event starts only after an expired handler has settled
                .thenCompose(actions -> handlerStage.handle((ignoredResponse, ignoredError) -> actions));
    }

    private List<JsonNode> fold(String sessionId, RawEvent event, UiResponse response, Throwable error) {
        if (error == null && response != null) {
            return response.actions();
        }
        String message;
        if (error == null) {
            message = "event handler completed without a response";
            log.warn("Event {} of session {} failed: {}", event.path(), sessionId, message);
        } else {
            Throwable cause = unwrap(error);
            message = cause.getMessage() != null ? cause.getMessage() : cause.toString();
            log.warn("Event {} of session {} failed: {}", event.path(), sessionId, message, cause);
        }
        return List.<JsonNode>of(ActionNodes.error(jsonCodec, message));
    }

    private ArrayNode reject(RequestException e) {
        log.warn("Rejected request: {}", e.getMessage());
        ArrayNode response = jsonCodec.createArrayNode();
        response.add(ActionNodes.error(jsonCodec, e.getMessage()));
        return response;
    }

    private static Throwable unwrap(Throwable error) {
        Throwable current = error;
        while ((current instanceof CompletionException || current instanceof ExecutionException)
                && current.getCause() != null) {
            current = current.getCause();
        }
        return current;
    }

    private String render(ArrayNode response) {
        try {
            return jsonCodec.writeString(response);
        } catch (JsonException e) {
            throw new IllegalStateException("failed to render response", e);
        }
    }

    private byte[] renderBytes(ArrayNode response) {
        try {
            return jsonCodec.writeBytes(response);
        } catch (JsonException e) {
            throw new IllegalStateException("failed to render response", e);
        }
    }
}
