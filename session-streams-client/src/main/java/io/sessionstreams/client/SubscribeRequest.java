package io.sessionstreams.client;

import io.sessionstreams.core.EventId;

import java.net.URI;
import java.util.Objects;

/**
 * Parameters of a live subscription.
 *
 * @param streamUrl endpoint serving {@code GET ?sessionId=..}
 * @param sessionId session to join
 * @param lastEventId resume token ({@code "<sessionId>:<seq>"}) or {@code null} to start live
 * @throws io.sessionstreams.core.SessionStreamsException.InvalidEventId if {@code lastEventId} is malformed
 */
public record SubscribeRequest(URI streamUrl, String sessionId, String lastEventId) {
    public SubscribeRequest {
        Objects.requireNonNull(streamUrl, "streamUrl");
        Objects.requireNonNull(sessionId, "sessionId");
        if (sessionId.isBlank()) throw new IllegalArgumentException("sessionId must not be blank");
        if (lastEventId != null) {
            EventId.requireSeq(lastEventId);
        }
    }

    public SubscribeRequest(URI streamUrl, String sessionId) {
        this(streamUrl, sessionId, null);
    }
}
