package io.sessionstreams.server.core;

import io.sessionstreams.core.SessionStreamsException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.Objects;
import java.util.Queue;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.Executor;
import java.util.concurrent.Flow;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.atomic.AtomicReference;

/**
 * One client's open event stream.
 *
 * <p>Producers (connect-time replay, dispatch, heartbeats) call {@link #send(SseFrame)}, which only enqueues.
 * A single drain task on the supplied executor hands frames to the subscriber in enqueue order, so the
 * transport is never written from two threads at once and a slow peer never blocks a producer.
 *
 * <p>Lifecycle: {@code CONNECTING -> LIVE -> CLOSED}. A connection closes when the subscriber cancels (client
 * gone or write failed), when its queue overflows, or when {@link #close()} is called. Close hooks run exactly
 * once.
 */
public final class SessionConnection implements Flow.Publisher<SseFrame> {

    private static final Logger log = LoggerFactory.getLogger(SessionConnection.class);

    public static final int DEFAULT_MAX_QUEUED_FRAMES = 1024;

    private static final AtomicLong IDS = new AtomicLong();

    public enum State {
        CONNECTING,
        LIVE,
        CLOSED
    }

    private final long id = IDS.incrementAndGet();
    private final String sessionId;
    private final Executor executor;
    private final Clock clock;
    private final Queue<SseFrame> queue;

    private final AtomicReference<State> state = new AtomicReference<>(State.CONNECTING);
    private final AtomicReference<Flow.Subscriber<? super SseFrame>> subscriber = new AtomicReference<>();
    private final AtomicInteger wip = new AtomicInteger();
    private final AtomicLong demand = new AtomicLong();
    private final AtomicBoolean hooksRun = new AtomicBoolean();
    private final List<Runnable> closeHooks = new CopyOnWriteArrayList<>();

    private volatile Throwable failure;
    private volatile boolean cancelled;
    private volatile boolean terminated;
    private volatile Instant lastActivity;

    public SessionConnection(String sessionId, int maxQueuedFrames, Executor executor, Clock clock) {
        this.sessionId = Objects.requireNonNull(sessionId, "sessionId");
        if (maxQueuedFrames <= 0) throw new IllegalArgumentException("maxQueuedFrames must be > 0: " + maxQueuedFrames);
        this.queue = new LinkedBlockingQueue<>(maxQueuedFrames);
        this.executor = Objects.requireNonNull(executor, "executor");
        this.clock = Objects.requireNonNull(clock, "clock");
        this.lastActivity = clock.instant();
    }

    public long id() {
        return id;
    }

    public String sessionId() {
        return sessionId;
    }

    public State state() {
        return state.get();
    }

    public boolean isOpen() {
        return state.get() != State.CLOSED;
    }

    /** Time of the last frame handed to the transport (creation time before that). */
    public Instant lastActivity() {
        return lastActivity;
    }

    int queuedFrames() {
        return queue.size();
    }

    /**
     * Enqueues a frame for delivery.
     *
     * @return {@code false} if the connection is closed or the frame could not be queued; a full queue closes
     *         the connection with {@link SessionStreamsException.Backpressure}
     */
    public boolean send(SseFrame frame) {
        Objects.requireNonNull(frame, "frame");
        if (state.get() == State.CLOSED) return false;
        if (!queue.offer(frame)) {
            log.debug("Connection {} on session {} overflowed its queue", id, sessionId);
            abort(new SessionStreamsException.Backpressure("connection " + id + " outbound queue is full"));
            return false;
        }
        drain();
        return true;
    }

    /** CONNECTING to LIVE; no-op in any other state. */
    public void markLive() {
        state.compareAndSet(State.CONNECTING, State.LIVE);
    }

    /**
     * Closes gracefully: frames already queued are still delivered, then the subscriber completes.
     */
    public void close() {
        if (transitionToClosed()) {
            runCloseHooks();
        }
        drain();
    }

    /**
     * Closes without flushing; the subscriber receives {@code onError(cause)}.
     */
    void abort(Throwable cause) {
        if (transitionToClosed()) {
            failure = cause;
            runCloseHooks();
        }
        drain();
    }

    /**
     * Registers a hook run once when the connection closes. Runs immediately if it is already closed.
     */
    public void onClose(Runnable hook) {
        Objects.requireNonNull(hook, "hook");
        closeHooks.add(hook);
        if (hooksRun.get() && closeHooks.remove(hook)) {
            runHook(hook);
        }
    }

    @Override
    public void subscribe(Flow.Subscriber<? super SseFrame> s) {
        Objects.requireNonNull(s, "subscriber");
        if (!subscriber.compareAndSet(null, s)) {
            s.onSubscribe(new NoopSubscription());
            s.onError(new IllegalStateException("connection " + id + " already has a subscriber"));
            return;
        }
        s.onSubscribe(new ConnectionSubscription());
        drain();
    }

    private boolean transitionToClosed() {
        State prev = state.getAndSet(State.CLOSED);
        return prev != State.CLOSED;
    }

    private void runCloseHooks() {
        if (!hooksRun.compareAndSet(false, true)) return;
        for (Runnable hook : closeHooks) {
            if (closeHooks.remove(hook)) {
                runHook(hook);
            }
        }
    }

    private void runHook(Runnable hook) {
        try {
            hook.run();
        } catch (RuntimeException e) {
            log.warn("Close hook failed for connection {} on session {}", id, sessionId, e);
        }
    }

    private void drain() {
        if (wip.getAndIncrement() != 0) return;
        try {
            executor.execute(this::drainLoop);
        } catch (RejectedExecutionException e) {
            // writer pool is shut down; nothing can be delivered any more
            log.debug("Writer executor rejected drain for connection {}", id, e);
            cancelled = true;
            queue.clear();
            if (transitionToClosed()) {
                runCloseHooks();
            }
            wip.set(0);
        }
    }

    private void drainLoop() {
        int missed = 1;
        do {
            Flow.Subscriber<? super SseFrame> s = subscriber.get();
            if (s != null) {
                deliver(s);
            }
            missed = wip.addAndGet(-missed);
        } while (missed != 0);
    }

    private void deliver(Flow.Subscriber<? super SseFrame> s) {
        if (cancelled || terminated) {
            queue.clear();
            return;
        }
        Throwable err = failure;
        if (err != null) {
            queue.clear();
            terminated = true;
            s.onError(err);
            return;
        }
        while (demand.get() > 0) {
            SseFrame frame = queue.poll();
            if (frame == null) break;
            try {
                s.onNext(frame);
            } catch (RuntimeException e) {
                log.debug("Subscriber of connection {} threw while writing; closing", id, e);
                cancelled = true;
                queue.clear();
                if (transitionToClosed()) {
                    runCloseHooks();
                }
                return;
            }
            lastActivity = clock.instant();
            if (demand.get() != Long.MAX_VALUE) {
                demand.decrementAndGet();
            }
            if (cancelled) {
                queue.clear();
                return;
            }
        }
        if (state.get() == State.CLOSED && queue.isEmpty() && !cancelled) {
            terminated = true;
            s.onComplete();
        }
    }

    private void addDemand(long n) {
        long current;
        long updated;
        do {
            current = demand.get();
            if (current == Long.MAX_VALUE) return;
            updated = current + n;
            if (updated < 0) updated = Long.MAX_VALUE;
        } while (!demand.compareAndSet(current, updated));
    }

    @Override
    public String toString() {
        return "SessionConnection[id=" + id + ", session=" + sessionId + ", state=" + state.get() + "]";
    }

    private final class ConnectionSubscription implements Flow.Subscription {
        @Override
        public void request(long n) {
            if (n <= 0) {
                abort(new IllegalArgumentException("non-positive request: " + n));
                return;
            }
            addDemand(n);
            drain();
        }

        @Override
        public void cancel() {
            if (cancelled) return;
            cancelled = true;
            if (transitionToClosed()) {
                log.debug("Connection {} on session {} cancelled by transport", id, sessionId);
                runCloseHooks();
            }
            drain();
        }
    }

    private static final class NoopSubscription implements Flow.Subscription {
        @Override
        public void request(long n) {
        }

        @Override
        public void cancel() {
        }
    }
}
