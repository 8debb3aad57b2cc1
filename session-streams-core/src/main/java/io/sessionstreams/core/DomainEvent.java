package io.sessionstreams.core;

import java.time.Clock;
import java.util.Objects;

/**
 * An application-level fact produced by a domain action, scoped to one session.
 *
 * <p>Within a session {@code seq} is strictly increasing and starts at 1. {@code id} is the wire-level
 * resumption token; events produced by {@link EventSequencer} use {@link EventId#format(String, long)}.
 *
 * @param id unique event id
 * @param seq session-scoped sequence number (&gt;= 1)
 * @param type event name on the wire
 * @param sessionId owning session
 * @param payload any JSON-serializable value (may be {@code null})
 * @param timestamp creation time in epoch milliseconds
 */
public record DomainEvent(String id, long seq, String type, String sessionId, Object payload, long timestamp) {
    public DomainEvent {
        Objects.requireNonNull(id, "id");
        Objects.requireNonNull(type, "type");
        Objects.requireNonNull(sessionId, "sessionId");
        if (type.isBlank()) throw new IllegalArgumentException("type must not be blank");
        if (sessionId.isBlank()) throw new IllegalArgumentException("sessionId must not be blank");
        if (seq < 1) throw new IllegalArgumentException("seq must be >= 1: " + seq);
    }

    public static DomainEvent of(String sessionId, long seq, String type, Object payload, Clock clock) {
        return new DomainEvent(EventId.format(sessionId, seq), seq, type, sessionId, payload, clock.millis());
    }
}
