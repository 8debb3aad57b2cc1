package io.sessionstreams.client;

/**
 * Server answer to a direct dispatch.
 */
public record DispatchResult(int appended, int delivered, int pruned) {}
