package io.sessionstreams.server.core;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Open connections per session.
 *
 * <p>A session's entry disappears as soon as its last connection is removed; the event log is untouched so
 * later reconnects can still replay.
 */
public final class ConnectionRegistry {

    private final Map<String, Set<SessionConnection>> bySession = new ConcurrentHashMap<>();

    public void register(String sessionId, SessionConnection connection) {
        Objects.requireNonNull(sessionId, "sessionId");
        Objects.requireNonNull(connection, "connection");
        bySession.compute(sessionId, (k, set) -> {
            Set<SessionConnection> s = set == null ? ConcurrentHashMap.newKeySet() : set;
            s.add(connection);
            return s;
        });
    }

    /**
     * @return {@code true} if the connection was registered
     */
    public boolean remove(String sessionId, SessionConnection connection) {
        boolean[] removed = {false};
        bySession.computeIfPresent(sessionId, (k, set) -> {
            removed[0] = set.remove(connection);
            return set.isEmpty() ? null : set;
        });
        return removed[0];
    }

    /** Snapshot of the session's connections. */
    public List<SessionConnection> connections(String sessionId) {
        Set<SessionConnection> set = bySession.get(sessionId);
        return set == null ? List.of() : List.copyOf(set);
    }

    /**
     * Drops the session's whole connection set.
     *
     * @return the connections that were registered
     */
    public List<SessionConnection> evict(String sessionId) {
        Set<SessionConnection> set = bySession.remove(sessionId);
        return set == null ? List.of() : List.copyOf(set);
    }

    public boolean contains(String sessionId) {
        return bySession.containsKey(sessionId);
    }

    public int sessionCount() {
        return bySession.size();
    }

    public int connectionCount() {
        int n = 0;
        for (Set<SessionConnection> set : bySession.values()) {
            n += set.size();
        }
        return n;
    }

    List<SessionConnection> all() {
        List<SessionConnection> out = new ArrayList<>();
        for (Set<SessionConnection> set : bySession.values()) {
            out.addAll(set);
        }
        return out;
    }
}
