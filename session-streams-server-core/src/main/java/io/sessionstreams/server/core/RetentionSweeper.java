package io.sessionstreams.server.core;

import io.sessionstreams.server.spi.SessionEventLog;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Evicts sessions whose log has been idle longer than the session timeout.
 *
 * <p>There is no background thread: request entry points call {@link #maybeSweep()}, which runs at most one
 * sweep per sweep interval across all callers.
 */
public final class RetentionSweeper {

    private static final Logger log = LoggerFactory.getLogger(RetentionSweeper.class);

    public static final Duration DEFAULT_SESSION_TIMEOUT = Duration.ofHours(1);
    public static final Duration DEFAULT_SWEEP_INTERVAL = Duration.ofMinutes(1);

    private static final long NEVER = Long.MIN_VALUE;

    private final SessionEventLog eventLog;
    private final ConnectionRegistry registry;
    private final SessionLocks locks;
    private final Duration sessionTimeout;
    private final Duration sweepInterval;
    private final Clock clock;
    private final AtomicLong lastSweepMillis = new AtomicLong(NEVER);

    RetentionSweeper(
            SessionEventLog eventLog,
            ConnectionRegistry registry,
            SessionLocks locks,
            Duration sessionTimeout,
            Duration sweepInterval,
            Clock clock
    ) {
        this.eventLog = Objects.requireNonNull(eventLog, "eventLog");
        this.registry = Objects.requireNonNull(registry, "registry");
        this.locks = Objects.requireNonNull(locks, "locks");
        this.sessionTimeout = Objects.requireNonNull(sessionTimeout, "sessionTimeout");
        this.sweepInterval = Objects.requireNonNull(sweepInterval, "sweepInterval");
        this.clock = Objects.requireNonNull(clock, "clock");
    }

    /**
     * Sweeps if the last sweep is at least one sweep interval old.
     *
     * @return sessions evicted by this call
     */
    public int maybeSweep() {
        Instant now = clock.instant();
        long nowMillis = now.toEpochMilli();
        long last = lastSweepMillis.get();
        if (last != NEVER && nowMillis - last < sweepInterval.toMillis()) return 0;
        if (!lastSweepMillis.compareAndSet(last, nowMillis)) return 0;
        return sweep(now);
    }

    /**
     * Removes the log and the connection set of every session idle since before {@code now - sessionTimeout}.
     * Connections of an evicted session are closed gracefully.
     *
     * @return number of sessions evicted
     */
    public int sweep(Instant now) {
        Objects.requireNonNull(now, "now");
        Instant cutoff = now.minus(sessionTimeout);
        int swept = 0;
        for (String sessionId : eventLog.sessionIds()) {
            List<SessionConnection> orphans = locks.call(sessionId, () -> {
                Optional<Instant> lastActivity = eventLog.lastActivity(sessionId);
                if (lastActivity.isEmpty() || !lastActivity.get().isBefore(cutoff)) return null;
                eventLog.remove(sessionId);
                return registry.evict(sessionId);
            });
            if (orphans == null) continue;
            swept++;
            orphans.forEach(SessionConnection::close);
            log.debug("Evicted idle session {} ({} open connection(s) closed)", sessionId, orphans.size());
        }
        if (swept > 0) {
            log.info("Retention sweep evicted {} idle session(s)", swept);
        }
        return swept;
    }
}
