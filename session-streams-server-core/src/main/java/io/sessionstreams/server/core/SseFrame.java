package io.sessionstreams.server.core;

import java.util.Objects;

/**
 * Server-Sent Events (SSE) frame.
 *
 * <p>Either a named event with optional {@code id} and JSON {@code data}, or a comment-only frame used as a
 * heartbeat.
 */
public final class SseFrame {
    private final String event;
    private final String id;
    private final String data;
    private final String comment;

    public SseFrame(String event, String data) {
        this(event, null, data);
    }

    public SseFrame(String event, String id, String data) {
        this.event = Objects.requireNonNull(event, "event");
        this.id = id;
        this.data = data == null ? "" : data;
        this.comment = null;
    }

    private SseFrame(String comment) {
        this.event = null;
        this.id = null;
        this.data = null;
        this.comment = comment;
    }

    public static SseFrame comment(String text) {
        return new SseFrame(Objects.requireNonNull(text, "text"));
    }

    /** Event name, {@code null} for comment frames. */
    public String event() {
        return event;
    }

    public String id() {
        return id;
    }

    public String data() {
        return data;
    }

    public String comment() {
        return comment;
    }

    public boolean isComment() {
        return comment != null;
    }

    /**
     * Render as an SSE event block (without HTTP headers).
     */
    public String render() {
        StringBuilder sb = new StringBuilder();
        if (comment != null) {
            sb.append(": ").append(comment).append("\n\n");
            return sb.toString();
        }
        if (id != null) {
            sb.append("id: ").append(id).append("\n");
        }
        sb.append("event: ").append(event).append("\n");
        // data can include newlines; each line must be prefixed with "data:"
        String[] lines = data.split("\r?\n", -1);
        for (String line : lines) {
            sb.append("data: ").append(line).append("\n");
        }
        sb.append("\n");
        return sb.toString();
    }

    @Override
    public String toString() {
        return isComment() ? "SseFrame[comment=" + comment + "]" : "SseFrame[event=" + event + ", id=" + id + "]";
    }
}
