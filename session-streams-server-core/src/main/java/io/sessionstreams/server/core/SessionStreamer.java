package io.sessionstreams.server.core;

import io.sessionstreams.core.DomainEvent;
import io.sessionstreams.core.EventId;
import io.sessionstreams.server.spi.SessionEventLog;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.List;
import java.util.Objects;
import java.util.OptionalLong;
import java.util.concurrent.Executor;
import java.util.concurrent.ScheduledFuture;

/**
 * Opens client streams: registers the connection, acknowledges it, replays what the client missed and starts
 * its heartbeat.
 *
 * <p>Registration and replay run under the session lock that {@link EventDispatcher} also holds while it
 * appends and pushes, so a joining client sees every event exactly once and in order: either in the replay or
 * as a live push, never both.
 */
public final class SessionStreamer {

    private static final Logger log = LoggerFactory.getLogger(SessionStreamer.class);

    private final SessionEventLog eventLog;
    private final ConnectionRegistry registry;
    private final SessionLocks locks;
    private final HeartbeatScheduler heartbeats;
    private final SseFrames frames;
    private final Executor writerExecutor;
    private final int maxQueuedFrames;
    private final Clock clock;

    SessionStreamer(
            SessionEventLog eventLog,
            ConnectionRegistry registry,
            SessionLocks locks,
            HeartbeatScheduler heartbeats,
            SseFrames frames,
            Executor writerExecutor,
            int maxQueuedFrames,
            Clock clock
    ) {
        this.eventLog = Objects.requireNonNull(eventLog, "eventLog");
        this.registry = Objects.requireNonNull(registry, "registry");
        this.locks = Objects.requireNonNull(locks, "locks");
        this.heartbeats = Objects.requireNonNull(heartbeats, "heartbeats");
        this.frames = Objects.requireNonNull(frames, "frames");
        this.writerExecutor = Objects.requireNonNull(writerExecutor, "writerExecutor");
        this.maxQueuedFrames = maxQueuedFrames;
        this.clock = Objects.requireNonNull(clock, "clock");
    }

    /**
     * Opens a stream for {@code sessionId}.
     *
     * <p>A well-formed {@code lastEventId} ({@code "<sessionId>:<seq>"}) requests replay of every buffered event
     * after {@code seq}; a missing or malformed one means "go live without replay". The {@code connected} frame
     * echoes the accepted seq (0 when none).
     *
     * @return a LIVE connection whose queue already holds the acknowledgment and any replay
     */
    public SessionConnection open(String sessionId, String lastEventId) {
        if (sessionId == null || sessionId.isBlank()) {
            throw new IllegalArgumentException("Missing sessionId");
        }
        OptionalLong resumeFrom = EventId.parseSeq(lastEventId);
        long lastSeq = resumeFrom.orElse(0L);

        Opened opened = locks.call(sessionId, () -> {
            List<DomainEvent> missed = resumeFrom.isPresent() ? eventLog.since(sessionId, lastSeq) : List.of();
            // acknowledgment, replay and summary are queued before anyone drains; they must not eat the live budget
            int capacity = maxQueuedFrames + 1 + (missed.isEmpty() ? 0 : missed.size() + 1);
            SessionConnection conn = new SessionConnection(sessionId, capacity, writerExecutor, clock);
            registry.register(sessionId, conn);
            conn.send(frames.connected(sessionId, lastSeq));
            int n = replay(conn, sessionId, lastSeq, missed);
            conn.markLive();
            return new Opened(conn, n);
        });
        SessionConnection connection = opened.connection();
        int replayed = opened.replayed();

        ScheduledFuture<?> heartbeat = heartbeats.schedule(connection);
        connection.onClose(() -> {
            heartbeat.cancel(false);
            registry.remove(sessionId, connection);
            log.info("Stream closed: session={} connection={}", sessionId, connection.id());
        });

        log.info("Stream opened: session={} connection={} lastSeq={} replayed={}",
                sessionId, connection.id(), lastSeq, replayed);
        return connection;
    }

    private int replay(SessionConnection connection, String sessionId, long lastSeq, List<DomainEvent> missed) {
        int sent = 0;
        long toSeq = lastSeq;
        for (DomainEvent event : missed) {
            SseFrame frame;
            try {
                frame = frames.domain(event);
            } catch (IllegalArgumentException e) {
                log.warn("Skipping unserializable event {} during replay for session {}", event.id(), sessionId, e);
                continue;
            }
            if (!connection.send(frame)) {
                return sent;
            }
            sent++;
            toSeq = event.seq();
        }
        if (sent > 0) {
            connection.send(frames.reconnected(sent, lastSeq, toSeq));
        }
        return sent;
    }

    private record Opened(SessionConnection connection, int replayed) {
    }
}
