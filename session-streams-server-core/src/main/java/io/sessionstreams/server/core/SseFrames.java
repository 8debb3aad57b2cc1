package io.sessionstreams.server.core;

import io.sessionstreams.core.DomainEvent;
import io.sessionstreams.core.Protocol;
import io.sessionstreams.core.SessionStreamEvent;
import io.sessionstreams.json.spi.JsonCodec;
import io.sessionstreams.json.spi.JsonException;

import java.util.Objects;

/**
 * Renders protocol events into {@link SseFrame}s.
 */
final class SseFrames {

    static final SseFrame HEARTBEAT = SseFrame.comment(Protocol.HEARTBEAT_COMMENT);

    private final JsonCodec codec;

    SseFrames(JsonCodec codec) {
        this.codec = Objects.requireNonNull(codec, "codec");
    }

    /**
     * Frame named after the event type, carrying the event id and the serialized event.
     *
     * @throws IllegalArgumentException if the event (its payload, in practice) cannot be serialized
     */
    SseFrame domain(DomainEvent event) {
        try {
            return new SseFrame(event.type(), event.id(), codec.writeString(event));
        } catch (JsonException e) {
            throw new IllegalArgumentException("event " + event.id() + " is not serializable", e);
        }
    }

    SseFrame connected(String sessionId, long lastSeq) {
        return control(Protocol.EVENT_CONNECTED, new SessionStreamEvent.Connected(sessionId, lastSeq));
    }

    SseFrame reconnected(int missedCount, long fromSeq, long toSeq) {
        return control(Protocol.EVENT_RECONNECTED, new SessionStreamEvent.Reconnected(missedCount, fromSeq, toSeq));
    }

    private SseFrame control(String name, SessionStreamEvent body) {
        try {
            return new SseFrame(name, codec.writeString(body));
        } catch (JsonException e) {
            throw new IllegalStateException("cannot render " + name + " event", e);
        }
    }
}
