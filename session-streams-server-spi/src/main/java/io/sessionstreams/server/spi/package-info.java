/**
 * Extension points for the Session Streams server: event storage ({@link io.sessionstreams.server.spi.SessionEventLog}),
 * the pluggable domain-action handler ({@link io.sessionstreams.server.spi.DomainActionHandler}) and ingress limits.
 */
package io.sessionstreams.server.spi;
