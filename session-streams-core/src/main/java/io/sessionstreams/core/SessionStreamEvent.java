package io.sessionstreams.core;

import java.util.Objects;

/**
 * Normalized view of a session event stream.
 *
 * <p>The server emits {@code connected} once per connection, {@code reconnected} after a non-empty replay,
 * and one named event per domain event. {@link Gap} is never sent by the server; clients synthesize it
 * when they observe a jump in sequence numbers (events evicted before replay could serve them).
 */
public sealed interface SessionStreamEvent
        permits SessionStreamEvent.Connected, SessionStreamEvent.Reconnected, SessionStreamEvent.Domain, SessionStreamEvent.Gap {

    /**
     * Acknowledgment sent as the first frame of every connection.
     *
     * @param sessionId the joined session
     * @param lastSeq the resume point the server accepted (0 when none)
     */
    record Connected(String sessionId, long lastSeq) implements SessionStreamEvent {
        public Connected {
            Objects.requireNonNull(sessionId, "sessionId");
        }
    }

    /**
     * Summary of a replay window.
     *
     * @param missedCount number of replayed events
     * @param fromSeq the client's resume point
     * @param toSeq seq of the last replayed event
     */
    record Reconnected(int missedCount, long fromSeq, long toSeq) implements SessionStreamEvent {}

    record Domain(DomainEvent event) implements SessionStreamEvent {
        public Domain {
            Objects.requireNonNull(event, "event");
        }
    }

    /**
     * Sequence discontinuity observed by a client.
     *
     * @param expectedSeq the seq that should have come next
     * @param receivedSeq the seq that actually arrived
     */
    record Gap(long expectedSeq, long receivedSeq) implements SessionStreamEvent {}
}
