package io.sessionstreams.server.core;

import java.util.Objects;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Supplier;

/**
 * Striped per-session locks.
 *
 * <p>Two sessions may share a stripe; a session always maps to the same one. Sections guarded here must not
 * take another session's lock.
 */
public final class SessionLocks {

    public static final int DEFAULT_STRIPES = 64;

    private final ReentrantLock[] stripes;

    public SessionLocks() {
        this(DEFAULT_STRIPES);
    }

    public SessionLocks(int stripes) {
        if (stripes <= 0) throw new IllegalArgumentException("stripes must be > 0: " + stripes);
        int size = Integer.highestOneBit(stripes);
        if (size < stripes) size <<= 1;
        this.stripes = new ReentrantLock[size];
        for (int i = 0; i < size; i++) {
            this.stripes[i] = new ReentrantLock();
        }
    }

    public <T> T call(String sessionId, Supplier<T> action) {
        ReentrantLock lock = lockFor(sessionId);
        lock.lock();
        try {
            return action.get();
        } finally {
            lock.unlock();
        }
    }

    public void run(String sessionId, Runnable action) {
        ReentrantLock lock = lockFor(sessionId);
        lock.lock();
        try {
            action.run();
        } finally {
            lock.unlock();
        }
    }

    int stripeCount() {
        return stripes.length;
    }

    ReentrantLock lockFor(String sessionId) {
        Objects.requireNonNull(sessionId, "sessionId");
        int h = sessionId.hashCode();
        h ^= (h >>> 16);
        return stripes[h & (stripes.length - 1)];
    }
}
