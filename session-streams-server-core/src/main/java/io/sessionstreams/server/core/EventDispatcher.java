package io.sessionstreams.server.core;

import io.sessionstreams.core.DomainEvent;
import io.sessionstreams.server.spi.SessionEventLog;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Appends a batch of events to a session's log, then pushes them to every open connection of that session.
 *
 * <p>Pushing only enqueues on each connection, so a slow or dead client never delays the others. A connection
 * that refuses a frame gets no further frames from this batch and is removed from the registry.
 */
public final class EventDispatcher {

    private static final Logger log = LoggerFactory.getLogger(EventDispatcher.class);

    private final SessionEventLog eventLog;
    private final ConnectionRegistry registry;
    private final SessionLocks locks;
    private final SseFrames frames;

    EventDispatcher(SessionEventLog eventLog, ConnectionRegistry registry, SessionLocks locks, SseFrames frames) {
        this.eventLog = Objects.requireNonNull(eventLog, "eventLog");
        this.registry = Objects.requireNonNull(registry, "registry");
        this.locks = Objects.requireNonNull(locks, "locks");
        this.frames = Objects.requireNonNull(frames, "frames");
    }

    /**
     * Dispatches {@code events} to {@code sessionId}, creating the session implicitly.
     *
     * <p>Events are routed by the {@code sessionId} argument alone. Events whose seq does not follow the log's
     * last seq are skipped, matching what the log itself accepts.
     *
     * @throws IllegalArgumentException if an event cannot be serialized; nothing is appended in that case
     */
    public DispatchOutcome dispatch(String sessionId, List<DomainEvent> events) {
        if (sessionId == null || sessionId.isBlank()) {
            throw new IllegalArgumentException("Missing sessionId");
        }
        Objects.requireNonNull(events, "events");
        if (events.isEmpty()) return DispatchOutcome.EMPTY;

        List<SseFrame> rendered = new ArrayList<>(events.size());
        for (DomainEvent event : events) {
            rendered.add(frames.domain(event));
        }

        return locks.call(sessionId, () -> {
            long last = eventLog.lastSeq(sessionId).orElse(0L);
            List<DomainEvent> accepted = new ArrayList<>(events.size());
            List<SseFrame> toSend = new ArrayList<>(events.size());
            for (int i = 0; i < events.size(); i++) {
                DomainEvent event = events.get(i);
                if (event.seq() <= last) continue;
                accepted.add(event);
                toSend.add(rendered.get(i));
                last = event.seq();
            }
            if (accepted.isEmpty()) {
                log.debug("Dispatch to session {} carried no new events", sessionId);
                return DispatchOutcome.EMPTY;
            }
            eventLog.append(sessionId, accepted);

            int delivered = 0;
            int pruned = 0;
            for (SessionConnection connection : registry.connections(sessionId)) {
                if (push(connection, toSend)) {
                    delivered++;
                } else {
                    registry.remove(sessionId, connection);
                    pruned++;
                }
            }
            log.debug("Dispatched {} event(s) to session {}: delivered={} pruned={}",
                    accepted.size(), sessionId, delivered, pruned);
            return new DispatchOutcome(accepted.size(), delivered, pruned);
        });
    }

    private static boolean push(SessionConnection connection, List<SseFrame> batch) {
        for (SseFrame frame : batch) {
            if (!connection.send(frame)) {
                return false;
            }
        }
        return true;
    }
}
