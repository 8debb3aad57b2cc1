package io.sessionstreams.core;

/**
 * Session Streams protocol constants (query keys, header names, event names and content types).
 *
 * <p>Shared by the server handler and the client; carries no HTTP bindings.
 */
public final class Protocol {
    private Protocol() {}

    // Query parameter keys
    public static final String Q_SESSION_ID = "sessionId";
    public static final String Q_LAST_EVENT_ID = "lastEventId";

    // HTTP headers
    public static final String H_LAST_EVENT_ID = "Last-Event-ID";
    public static final String H_CONTENT_TYPE = "Content-Type";
    public static final String H_ACCEPT = "Accept";
    public static final String H_CACHE_CONTROL = "Cache-Control";
    public static final String H_X_ACCEL_BUFFERING = "X-Accel-Buffering";
    public static final String H_X_ERROR = "X-Error";

    // Content types
    public static final String CT_EVENT_STREAM = "text/event-stream";
    public static final String CT_JSON = "application/json";

    // Server-emitted event names
    public static final String EVENT_CONNECTED = "connected";
    public static final String EVENT_RECONNECTED = "reconnected";

    /** Comment text of the keepalive frame. */
    public static final String HEARTBEAT_COMMENT = "heartbeat";

    /** Ingress path suffix for direct event dispatch (as opposed to tool calls). */
    public static final String EVENTS_PATH_SUFFIX = "/events";

    /** Separator between session id and sequence number in a resumption token. */
    public static final char EVENT_ID_SEPARATOR = ':';
}
