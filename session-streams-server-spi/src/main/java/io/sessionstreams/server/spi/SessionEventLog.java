package io.sessionstreams.server.spi;

import io.sessionstreams.core.DomainEvent;

import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.OptionalLong;
import java.util.Set;

/**
 * Per-session, bounded, ordered history of domain events used for replay on reconnect.
 *
 * <p>Implementations must be safe for concurrent use across sessions. Callers that need append and push
 * (or registration and replay) to be atomic for one session hold a per-session lock around the calls.
 */
public interface SessionEventLog {

    /**
     * Appends events in order, creating the session's buffer if needed and refreshing its last activity.
     * Oldest events are evicted once the capacity is exceeded. Never fails for well-formed events.
     */
    void append(String sessionId, List<DomainEvent> events);

    /**
     * Returns buffered events with {@code seq > afterSeq}, ascending. Empty for unknown sessions.
     *
     * <p>Evicted events are silently absent; the result starts at the oldest retained match.
     */
    List<DomainEvent> since(String sessionId, long afterSeq);

    /** Highest buffered seq, empty if nothing is buffered. */
    OptionalLong lastSeq(String sessionId);

    Optional<Instant> lastActivity(String sessionId);

    Set<String> sessionIds();

    /**
     * Drops the session's buffer.
     *
     * @return {@code true} if a buffer existed
     */
    boolean remove(String sessionId);

    LogStats stats();
}
