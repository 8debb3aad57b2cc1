package io.sessionstreams.server.core;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.Objects;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;

/**
 * Periodically enqueues a comment frame on each open connection so idle proxies keep the stream open.
 *
 * <p>A heartbeat that cannot be queued means the connection is already closed (or just overflowed and was
 * closed by that attempt); the caller's close hook cancels the returned future.
 */
public final class HeartbeatScheduler implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(HeartbeatScheduler.class);

    public static final Duration DEFAULT_INTERVAL = Duration.ofSeconds(30);

    private final Duration interval;
    private final ScheduledExecutorService scheduler;
    private final boolean ownsScheduler;

    public HeartbeatScheduler() {
        this(DEFAULT_INTERVAL);
    }

    public HeartbeatScheduler(Duration interval) {
        this(interval, Executors.newSingleThreadScheduledExecutor(VirtualThreads.daemonThreads("session-streams-heartbeat")), true);
    }

    /**
     * Uses a caller-owned scheduler, which {@link #close()} leaves running.
     */
    public HeartbeatScheduler(Duration interval, ScheduledExecutorService scheduler) {
        this(interval, scheduler, false);
    }

    private HeartbeatScheduler(Duration interval, ScheduledExecutorService scheduler, boolean ownsScheduler) {
        Objects.requireNonNull(interval, "interval");
        if (interval.isZero() || interval.isNegative()) {
            throw new IllegalArgumentException("heartbeat interval must be positive: " + interval);
        }
        this.interval = interval;
        this.scheduler = Objects.requireNonNull(scheduler, "scheduler");
        this.ownsScheduler = ownsScheduler;
    }

    public Duration interval() {
        return interval;
    }

    public ScheduledFuture<?> schedule(SessionConnection connection) {
        Objects.requireNonNull(connection, "connection");
        long millis = interval.toMillis();
        return scheduler.scheduleAtFixedRate(() -> beat(connection), millis, millis, TimeUnit.MILLISECONDS);
    }

    static boolean beat(SessionConnection connection) {
        boolean sent = connection.send(SseFrames.HEARTBEAT);
        if (!sent) {
            log.debug("Heartbeat not delivered to {}", connection);
        }
        return sent;
    }

    @Override
    public void close() {
        if (ownsScheduler) {
            scheduler.shutdownNow();
        }
    }
}
