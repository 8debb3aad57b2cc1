package io.sessionstreams.core;

import java.time.Clock;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Assigns per-session sequence numbers and builds {@link DomainEvent}s.
 *
 * <p>Intended for domain-action handlers; one instance should be shared by every producer of a session's
 * events so that sequence numbers stay strictly increasing.
 */
public final class EventSequencer {

    private final Map<String, AtomicLong> counters = new ConcurrentHashMap<>();
    private final Clock clock;

    public EventSequencer() {
        this(Clock.systemUTC());
    }

    public EventSequencer(Clock clock) {
        this.clock = Objects.requireNonNull(clock, "clock");
    }

    public long nextSeq(String sessionId) {
        Objects.requireNonNull(sessionId, "sessionId");
        return counters.computeIfAbsent(sessionId, k -> new AtomicLong()).incrementAndGet();
    }

    public DomainEvent next(String sessionId, String type, Object payload) {
        return DomainEvent.of(sessionId, nextSeq(sessionId), type, payload, clock);
    }

    /** Last seq handed out for the session, or 0. */
    public long currentSeq(String sessionId) {
        AtomicLong c = counters.get(sessionId);
        return c == null ? 0 : c.get();
    }

    public void reset(String sessionId) {
        counters.remove(sessionId);
    }
}
