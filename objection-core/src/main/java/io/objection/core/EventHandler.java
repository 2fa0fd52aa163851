package io.objection.core;

import java.util.concurrent.CompletionStage;

/**
 * Application logic invoked once per incoming event.
 *
 * <p>The handler completes with {@link SessionRoot#intoResponse()} on success. Failing (throwing, or
 * completing the stage exceptionally) turns into a single {@code root_error} action carrying the
 * exception message; the other events of the batch are unaffected.
 */
@FunctionalInterface
public interface EventHandler {

    CompletionStage<UiResponse> handle(String sessionId, SessionRoot root) throws Exception;
}
