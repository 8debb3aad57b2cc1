/**
 * Protocol-centric core for Session Streams.
 *
 * <p>This module is framework-neutral. It contains only:
 * <ul>
 *   <li>The wire model: {@link io.sessionstreams.core.DomainEvent}, {@link io.sessionstreams.core.ActionResult}
 *       and the client-side {@link io.sessionstreams.core.SessionStreamEvent} view</li>
 *   <li>Resumption token handling ({@link io.sessionstreams.core.EventId}) and per-session sequencing</li>
 *   <li>Header lookup and a minimal SSE parser</li>
 * </ul>
 *
 * <p>HTTP client/server bindings live in other modules.
 */
package io.sessionstreams.core;
