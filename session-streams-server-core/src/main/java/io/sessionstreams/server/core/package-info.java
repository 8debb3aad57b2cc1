/**
 * Framework-neutral server core for Session Streams.
 *
 * <p>Contains:
 * <ul>
 *   <li>{@link io.sessionstreams.server.core.SessionStreamsHandler} (HTTP entry points)</li>
 *   <li>{@link io.sessionstreams.server.core.InMemorySessionEventLog} (bounded per-session replay buffer)</li>
 *   <li>{@link io.sessionstreams.server.core.SessionStreamer}, {@link io.sessionstreams.server.core.EventDispatcher}
 *       and {@link io.sessionstreams.server.core.RetentionSweeper}, which share a
 *       {@link io.sessionstreams.server.core.ConnectionRegistry} and striped {@link io.sessionstreams.server.core.SessionLocks}</li>
 * </ul>
 *
 * <p>Framework integrations adapt {@link io.sessionstreams.server.core.ServerRequest} and
 * {@link io.sessionstreams.server.core.ServerResponse} to their HTTP runtimes and subscribe to
 * {@link io.sessionstreams.server.core.ResponseBody.Sse} publishers.
 */
package io.sessionstreams.server.core;
