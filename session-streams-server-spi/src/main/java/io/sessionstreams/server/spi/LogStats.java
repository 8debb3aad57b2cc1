package io.sessionstreams.server.spi;

/**
 * Point-in-time buffer statistics.
 *
 * @param sessions number of sessions with a buffer
 * @param totalEvents events buffered across all sessions
 */
public record LogStats(int sessions, long totalEvents) {}
