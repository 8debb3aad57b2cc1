package io.sessionstreams.client;

import io.sessionstreams.core.DomainEvent;
import io.sessionstreams.core.EventId;
import io.sessionstreams.core.Protocol;
import io.sessionstreams.core.SessionStreamEvent;
import io.sessionstreams.core.SessionStreamsException;
import io.sessionstreams.core.SseParser;
import io.sessionstreams.json.spi.JsonCodec;
import io.sessionstreams.json.spi.JsonException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.net.URI;
import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.Flow;
import java.util.concurrent.SubmissionPublisher;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Resumable subscription to one session's event stream.
 *
 * <p>A daemon thread owns the HTTP stream. It starts when the subscriber arrives, so nothing is published
 * before anyone listens, and stops when the subscriber cancels. After every disconnect it waits the reconnect
 * delay and reopens the stream with {@code lastEventId = sessionId:lastSeq}.
 */
final class SseLoop implements Flow.Publisher<SessionStreamEvent> {

    private static final Logger log = LoggerFactory.getLogger(SseLoop.class);

    private static final long UNKNOWN = -1L;

    private final SessionStreamsTransport transport;
    private final JsonCodec codec;
    private final SubscribeRequest request;
    private final Duration reconnectDelay;
    private final int maxReconnectAttempts;

    private final SubmissionPublisher<SessionStreamEvent> pub = new SubmissionPublisher<>();
    private final AtomicBoolean subscribed = new AtomicBoolean();
    private volatile boolean stopped;
    private volatile InputStream current;

    // loop thread only
    private long lastSeq;
    private boolean baselineFromAck;

    SseLoop(
            SessionStreamsTransport transport,
            JsonCodec codec,
            SubscribeRequest request,
            Duration reconnectDelay,
            int maxReconnectAttempts
    ) {
        this.transport = Objects.requireNonNull(transport, "transport");
        this.codec = Objects.requireNonNull(codec, "codec");
        this.request = Objects.requireNonNull(request, "request");
        this.reconnectDelay = Objects.requireNonNull(reconnectDelay, "reconnectDelay");
        this.maxReconnectAttempts = maxReconnectAttempts;
        this.lastSeq = request.lastEventId() == null ? UNKNOWN : EventId.requireSeq(request.lastEventId());
    }

    @Override
    public void subscribe(Flow.Subscriber<? super SessionStreamEvent> subscriber) {
        Objects.requireNonNull(subscriber, "subscriber");
        if (!subscribed.compareAndSet(false, true)) {
            subscriber.onSubscribe(new Flow.Subscription() {
                @Override
                public void request(long n) {
                }

                @Override
                public void cancel() {
                }
            });
            subscriber.onError(new IllegalStateException("subscription already has a subscriber"));
            return;
        }
        pub.subscribe(new StoppingSubscriber(subscriber));
        Thread t = new Thread(this::run, "session-streams-sse-" + request.sessionId());
        t.setDaemon(true);
        t.start();
    }

    private void run() {
        int failures = 0;
        while (!stopped) {
            try {
                TransportResponse<InputStream> resp = transport.sendStream(TransportRequest.stream(streamUrl()));
                int status = resp.status();
                if (resp.isClientError()) {
                    closeQuietly(resp.body());
                    String reason = resp.header(Protocol.H_X_ERROR).orElse("status " + status);
                    pub.closeExceptionally(new SessionStreamsException.ClientError(status, "subscription rejected: " + reason));
                    return;
                }
                if (status != 200) {
                    closeQuietly(resp.body());
                    throw new SessionStreamsException.ServerError(status, "stream status=" + status);
                }
                failures = 0;
                consume(resp.body());
                if (stopped) return;
                log.debug("Stream for session {} ended at seq {}", request.sessionId(), lastSeq);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                pub.close();
                return;
            } catch (IllegalStateException e) {
                // publisher closed under us
                return;
            } catch (Exception e) {
                if (stopped) return;
                failures++;
                if (failures > maxReconnectAttempts) {
                    pub.closeExceptionally(e);
                    return;
                }
                log.warn("Stream for session {} failed (attempt {}): {}", request.sessionId(), failures, e.toString());
            }
            if (!pause()) return;
        }
    }

    private void consume(InputStream body) throws IOException {
        current = body;
        try (SseParser parser = new SseParser(body)) {
            SseParser.Event ev;
            while (!stopped && (ev = parser.next()) != null) {
                try {
                    onFrame(ev);
                } catch (JsonException e) {
                    log.warn("Skipping unreadable '{}' frame on session {}", ev.eventType(), request.sessionId(), e);
                }
            }
        } finally {
            current = null;
        }
    }

    private void onFrame(SseParser.Event ev) throws JsonException {
        switch (ev.eventType()) {
            case Protocol.EVENT_CONNECTED -> onConnected(codec.readValue(ev.data(), SessionStreamEvent.Connected.class));
            case Protocol.EVENT_RECONNECTED -> pub.submit(codec.readValue(ev.data(), SessionStreamEvent.Reconnected.class));
            default -> onDomainEvent(codec.readValue(ev.data(), DomainEvent.class));
        }
    }

    private void onConnected(SessionStreamEvent.Connected connected) {
        // the acknowledged seq is the baseline for the next reconnect, even if no event ever arrives
        if (lastSeq == UNKNOWN) {
            lastSeq = connected.lastSeq();
            baselineFromAck = true;
        }
        pub.submit(connected);
    }

    private void onDomainEvent(DomainEvent event) {
        long seq = event.seq();
        if (lastSeq != UNKNOWN) {
            if (seq <= lastSeq) {
                log.debug("Dropping duplicate event {} on session {}", event.id(), request.sessionId());
                return;
            }
            // a fresh join starts wherever the session is; only a baseline the client actually saw can gap
            if (seq > lastSeq + 1 && !baselineFromAck) {
                pub.submit(new SessionStreamEvent.Gap(lastSeq + 1, seq));
            }
        }
        baselineFromAck = false;
        lastSeq = seq;
        pub.submit(new SessionStreamEvent.Domain(event));
    }

    private URI streamUrl() {
        Map<String, String> params = new LinkedHashMap<>();
        params.put(Protocol.Q_SESSION_ID, request.sessionId());
        if (lastSeq != UNKNOWN) {
            params.put(Protocol.Q_LAST_EVENT_ID, EventId.format(request.sessionId(), lastSeq));
        }
        return Urls.withQuery(request.streamUrl(), params);
    }

    private boolean pause() {
        try {
            Thread.sleep(reconnectDelay.toMillis());
            return !stopped;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            pub.close();
            return false;
        }
    }

    private void stop() {
        stopped = true;
        pub.close();
        closeQuietly(current);
    }

    private static void closeQuietly(InputStream in) {
        if (in == null) return;
        try {
            in.close();
        } catch (IOException e) {
            log.debug("Failed to close event stream body", e);
        }
    }

    private final class StoppingSubscriber implements Flow.Subscriber<SessionStreamEvent> {
        private final Flow.Subscriber<? super SessionStreamEvent> downstream;

        StoppingSubscriber(Flow.Subscriber<? super SessionStreamEvent> downstream) {
            this.downstream = downstream;
        }

        @Override
        public void onSubscribe(Flow.Subscription subscription) {
            downstream.onSubscribe(new Flow.Subscription() {
                @Override
                public void request(long n) {
                    subscription.request(n);
                }

                @Override
                public void cancel() {
                    subscription.cancel();
                    stop();
                }
            });
        }

        @Override
        public void onNext(SessionStreamEvent item) {
            downstream.onNext(item);
        }

        @Override
        public void onError(Throwable throwable) {
            downstream.onError(throwable);
        }

        @Override
        public void onComplete() {
            downstream.onComplete();
        }
    }
}
