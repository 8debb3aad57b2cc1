package io.sessionstreams.server.core;

import io.sessionstreams.core.DomainEvent;
import io.sessionstreams.server.spi.LogStats;
import io.sessionstreams.server.spi.SessionEventLog;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.OptionalLong;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.locks.ReentrantLock;

/**
 * In-memory {@link SessionEventLog} keeping the most recent {@code maxEventsPerSession} events of each session.
 *
 * <p>Each session's buffer is guarded by its own lock; unrelated sessions never contend. Events whose
 * {@code seq} does not exceed the session's last appended seq are dropped, so the buffer stays strictly
 * ascending even when a producer retries.
 */
public final class InMemorySessionEventLog implements SessionEventLog {

    private static final Logger log = LoggerFactory.getLogger(InMemorySessionEventLog.class);

    public static final int DEFAULT_MAX_EVENTS_PER_SESSION = 100;

    private final Map<String, SessionBuffer> buffers = new ConcurrentHashMap<>();
    private final int maxEventsPerSession;
    private final Clock clock;

    public InMemorySessionEventLog() {
        this(DEFAULT_MAX_EVENTS_PER_SESSION, Clock.systemUTC());
    }

    public InMemorySessionEventLog(int maxEventsPerSession) {
        this(maxEventsPerSession, Clock.systemUTC());
    }

    public InMemorySessionEventLog(int maxEventsPerSession, Clock clock) {
        if (maxEventsPerSession <= 0) {
            throw new IllegalArgumentException("maxEventsPerSession must be > 0: " + maxEventsPerSession);
        }
        this.maxEventsPerSession = maxEventsPerSession;
        this.clock = Objects.requireNonNull(clock, "clock");
    }

    public int maxEventsPerSession() {
        return maxEventsPerSession;
    }

    @Override
    public void append(String sessionId, List<DomainEvent> events) {
        Objects.requireNonNull(sessionId, "sessionId");
        Objects.requireNonNull(events, "events");
        if (events.isEmpty()) return;

        while (true) {
            SessionBuffer b = buffers.computeIfAbsent(sessionId, k -> new SessionBuffer());
            b.lock.lock();
            try {
                // lost a race with remove(); retry against a fresh buffer
                if (b.removed) continue;
                b.append(events, maxEventsPerSession, sessionId);
                b.lastActivity = clock.instant();
                return;
            } finally {
                b.lock.unlock();
            }
        }
    }

    @Override
    public List<DomainEvent> since(String sessionId, long afterSeq) {
        SessionBuffer b = buffers.get(sessionId);
        if (b == null) return List.of();
        b.lock.lock();
        try {
            List<DomainEvent> out = new ArrayList<>();
            for (DomainEvent e : b.events) {
                if (e.seq() > afterSeq) out.add(e);
            }
            return out;
        } finally {
            b.lock.unlock();
        }
    }

    @Override
    public OptionalLong lastSeq(String sessionId) {
        SessionBuffer b = buffers.get(sessionId);
        if (b == null) return OptionalLong.empty();
        b.lock.lock();
        try {
            return b.lastSeq == 0 ? OptionalLong.empty() : OptionalLong.of(b.lastSeq);
        } finally {
            b.lock.unlock();
        }
    }

    @Override
    public Optional<Instant> lastActivity(String sessionId) {
        SessionBuffer b = buffers.get(sessionId);
        if (b == null) return Optional.empty();
        b.lock.lock();
        try {
            return Optional.ofNullable(b.lastActivity);
        } finally {
            b.lock.unlock();
        }
    }

    @Override
    public Set<String> sessionIds() {
        return Set.copyOf(buffers.keySet());
    }

    @Override
    public boolean remove(String sessionId) {
        SessionBuffer b = buffers.remove(sessionId);
        if (b == null) return false;
        b.lock.lock();
        try {
            b.removed = true;
            b.events.clear();
        } finally {
            b.lock.unlock();
        }
        return true;
    }

    @Override
    public LogStats stats() {
        int sessions = 0;
        long total = 0;
        for (SessionBuffer b : buffers.values()) {
            b.lock.lock();
            try {
                if (b.removed) continue;
                sessions++;
                total += b.events.size();
            } finally {
                b.lock.unlock();
            }
        }
        return new LogStats(sessions, total);
    }

    private static final class SessionBuffer {
        final ReentrantLock lock = new ReentrantLock();
        final ArrayDeque<DomainEvent> events = new ArrayDeque<>();
        long lastSeq;
        Instant lastActivity;
        boolean removed;

        void append(List<DomainEvent> batch, int max, String sessionId) {
            for (DomainEvent e : batch) {
                if (e.seq() <= lastSeq) {
                    log.warn("Dropping event {} for session {}: seq {} does not follow {}", e.id(), sessionId, e.seq(), lastSeq);
                    continue;
                }
                events.addLast(e);
                lastSeq = e.seq();
            }
            while (events.size() > max) {
                events.removeFirst();
            }
        }
    }
}
