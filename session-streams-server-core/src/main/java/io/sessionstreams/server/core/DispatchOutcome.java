package io.sessionstreams.server.core;

/**
 * Result of {@link EventDispatcher#dispatch}.
 *
 * @param appended events added to the session log
 * @param delivered connections that accepted every frame
 * @param pruned connections removed because a write failed
 */
public record DispatchOutcome(int appended, int delivered, int pruned) {

    static final DispatchOutcome EMPTY = new DispatchOutcome(0, 0, 0);
}
