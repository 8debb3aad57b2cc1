package io.sessionstreams.core;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.nio.charset.StandardCharsets;

/**
 * Minimal SSE parser.
 *
 * <p>Comment-only blocks (heartbeats) are skipped. A single space after the field colon is stripped, as the
 * SSE format requires.
 */
public final class SseParser implements AutoCloseable {

    /**
     * One dispatched SSE event.
     *
     * @param id value of the {@code id:} field, or {@code null}
     * @param eventType value of the {@code event:} field, {@code "message"} when absent
     * @param data joined {@code data:} lines
     */
    public record Event(String id, String eventType, String data) {}

    private final BufferedReader in;

    public SseParser(InputStream is) {
        this.in = new BufferedReader(new InputStreamReader(is, StandardCharsets.UTF_8));
    }

    /** @return next event, or {@code null} if EOF */
    public Event next() throws IOException {
        while (true) {
            String id = null;
            String eventType = null;
            StringBuilder data = null;
            boolean seenAny = false;

            String line;
            while ((line = in.readLine()) != null) {
                if (line.isEmpty()) {
                    if (seenAny) break;
                    continue;
                }
                seenAny = true;
                if (line.charAt(0) == ':') continue;

                int colon = line.indexOf(':');
                String field = colon < 0 ? line : line.substring(0, colon);
                String value = colon < 0 ? "" : fieldValue(line, colon);
                switch (field) {
                    case "id" -> id = value;
                    case "event" -> eventType = value;
                    case "data" -> {
                        if (data == null) data = new StringBuilder();
                        else data.append('\n');
                        data.append(value);
                    }
                    default -> {
                        // retry and unknown fields are ignored
                    }
                }
            }

            if (!seenAny) return null;
            if (eventType == null && data == null && id == null) {
                // comment-only block
                if (line == null) return null;
                continue;
            }
            return new Event(id, eventType == null ? "message" : eventType, data == null ? "" : data.toString());
        }
    }

    private static String fieldValue(String line, int colon) {
        int start = colon + 1;
        if (start < line.length() && line.charAt(start) == ' ') start++;
        return line.substring(start);
    }

    @Override
    public void close() throws IOException {
        in.close();
    }
}
