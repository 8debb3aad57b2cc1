package io.sessionstreams.core;

import java.util.List;

/**
 * Outcome of a domain action (tool call).
 *
 * <p>Only {@code events} is interpreted by the event pipeline; {@code data} and {@code error} pass through
 * to the caller untouched.
 */
public record ActionResult(boolean success, Object data, String error, List<DomainEvent> events) {
    public ActionResult {
        events = events == null ? List.of() : List.copyOf(events);
    }

    public static ActionResult ok(Object data, List<DomainEvent> events) {
        return new ActionResult(true, data, null, events);
    }

    public static ActionResult ok(Object data) {
        return new ActionResult(true, data, null, List.of());
    }

    public static ActionResult failure(String error) {
        return new ActionResult(false, null, error, List.of());
    }
}
