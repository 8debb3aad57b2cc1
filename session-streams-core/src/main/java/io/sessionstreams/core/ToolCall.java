package io.sessionstreams.core;

import java.util.Map;

/**
 * Ingress body for a domain action: {@code {tool, args}}.
 */
public record ToolCall(String tool, Map<String, Object> args) {

    /** Argument naming the session that receives the action's events. */
    public static final String ARG_SESSION_ID = "sessionId";
}
