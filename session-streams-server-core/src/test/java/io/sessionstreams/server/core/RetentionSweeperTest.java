package io.sessionstreams.server.core;

import io.sessionstreams.json.jackson.JacksonJsonCodec;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;

import static io.sessionstreams.server.core.InMemorySessionEventLogTest.events;
import static org.assertj.core.api.Assertions.assertThat;

class RetentionSweeperTest {

    private final MutableClock clock = new MutableClock(Instant.parse("2025-01-01T00:00:00Z"));
    private final InMemorySessionEventLog eventLog = new InMemorySessionEventLog(100, clock);
    private final ConnectionRegistry registry = new ConnectionRegistry();
    private final SessionLocks locks = new SessionLocks(8);
    private final HeartbeatScheduler heartbeats = new HeartbeatScheduler(Duration.ofHours(1));
    private final SseFrames frames = new SseFrames(new JacksonJsonCodec());
    private final SessionStreamer streamer =
            new SessionStreamer(eventLog, registry, locks, heartbeats, frames, Runnable::run, 64, clock);
    private final EventDispatcher dispatcher = new EventDispatcher(eventLog, registry, locks, frames);
    private final RetentionSweeper sweeper = new RetentionSweeper(
            eventLog, registry, locks, Duration.ofHours(1), Duration.ofMinutes(1), clock);

    @AfterEach
    void tearDown() {
        heartbeats.close();
    }

    @Test
    void evictsSessionsIdleLongerThanTimeout() {
        dispatcher.dispatch("old", events("old", 1, 3));
        clock.advance(Duration.ofMinutes(50));
        dispatcher.dispatch("fresh", events("fresh", 1, 1));
        clock.advance(Duration.ofMinutes(11));

        int swept = sweeper.sweep(clock.instant());

        assertThat(swept).isEqualTo(1);
        assertThat(eventLog.sessionIds()).containsExactly("fresh");
        assertThat(eventLog.since("old", 0)).isEmpty();
    }

    @Test
    void sessionExactlyAtTimeoutIsKept() {
        dispatcher.dispatch("s1", events("s1", 1, 1));
        clock.advance(Duration.ofHours(1));

        assertThat(sweeper.sweep(clock.instant())).isZero();
        assertThat(eventLog.sessionIds()).containsExactly("s1");
    }

    @Test
    void evictionCompletesOpenConnections() {
        dispatcher.dispatch("s1", events("s1", 1, 2));
        RecordingSubscriber client = new RecordingSubscriber();
        streamer.open("s1", null).subscribe(client);
        clock.advance(Duration.ofHours(2));

        sweeper.sweep(clock.instant());

        assertThat(client.completed()).isTrue();
        assertThat(registry.contains("s1")).isFalse();
        assertThat(registry.connectionCount()).isZero();
    }

    @Test
    void newAppendRefreshesSession() {
        dispatcher.dispatch("s1", events("s1", 1, 1));
        clock.advance(Duration.ofMinutes(59));
        dispatcher.dispatch("s1", events("s1", 2, 2));
        clock.advance(Duration.ofMinutes(59));

        assertThat(sweeper.sweep(clock.instant())).isZero();
    }

    @Test
    void maybeSweepRunsAtMostOncePerInterval() {
        RetentionSweeper eager = new RetentionSweeper(
                eventLog, registry, locks, Duration.ofSeconds(10), Duration.ofMinutes(1), clock);
        dispatcher.dispatch("a", events("a", 1, 1));
        clock.advance(Duration.ofSeconds(20));

        assertThat(eager.maybeSweep()).isEqualTo(1);

        dispatcher.dispatch("b", events("b", 1, 1));
        clock.advance(Duration.ofSeconds(20));
        assertThat(eager.maybeSweep()).isZero();
        assertThat(eventLog.sessionIds()).containsExactly("b");

        clock.advance(Duration.ofSeconds(41));
        assertThat(eager.maybeSweep()).isEqualTo(1);
        assertThat(eventLog.sessionIds()).isEmpty();
    }
}
