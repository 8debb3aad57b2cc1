package io.sessionstreams.core;

import java.util.List;

/**
 * Ingress body for a direct dispatch: {@code {sessionId, events}}.
 *
 * <p>{@code sessionId} may be omitted, in which case the first event's session is used.
 */
public record DispatchRequest(String sessionId, List<DomainEvent> events) {}
