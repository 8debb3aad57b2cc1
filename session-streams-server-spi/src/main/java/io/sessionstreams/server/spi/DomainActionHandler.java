package io.sessionstreams.server.spi;

import io.sessionstreams.core.ActionResult;

import java.util.Map;

/**
 * The opaque domain logic behind a tool call.
 *
 * <p>The returned {@link ActionResult#events()} are dispatched to the session named by the
 * {@code sessionId} argument, or to the first event's session when the argument is absent.
 */
@FunctionalInterface
public interface DomainActionHandler {

    ActionResult handle(String toolName, Map<String, Object> arguments) throws Exception;

    /**
     * Handler used until a real one is wired in; every call fails without producing events.
     */
    static DomainActionHandler unavailable() {
        return (toolName, arguments) -> ActionResult.failure("Orchestrator not connected");
    }
}
