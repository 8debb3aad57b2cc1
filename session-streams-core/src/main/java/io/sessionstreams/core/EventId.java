package io.sessionstreams.core;

import java.util.Objects;
import java.util.OptionalLong;

/**
 * Resumption token codec.
 *
 * <p>A token has the form {@code "<sessionId>:<seq>"}. Only the sequence part drives replay; the
 * session part is informational and is not checked against the session being joined.
 */
public final class EventId {
    private EventId() {}

    /**
     * Formats the canonical token for an event.
     */
    public static String format(String sessionId, long seq) {
        Objects.requireNonNull(sessionId, "sessionId");
        if (seq < 0) throw new IllegalArgumentException("seq must be >= 0: " + seq);
        return sessionId + Protocol.EVENT_ID_SEPARATOR + seq;
    }

    /**
     * Parses the sequence part of a token.
     *
     * <p>The token must split on {@code ':'} into exactly two parts and the second must be a non-negative
     * decimal number. Anything else (including {@code null}) yields an empty result, which callers treat as
     * "no resume point".
     */
    public static OptionalLong parseSeq(String token) {
        if (token == null || token.isBlank()) return OptionalLong.empty();
        String[] parts = token.trim().split(String.valueOf(Protocol.EVENT_ID_SEPARATOR), -1);
        if (parts.length != 2) return OptionalLong.empty();
        try {
            long seq = Long.parseLong(parts[1]);
            return seq < 0 ? OptionalLong.empty() : OptionalLong.of(seq);
        } catch (NumberFormatException e) {
            return OptionalLong.empty();
        }
    }

    /**
     * Strict variant of {@link #parseSeq(String)} for callers that must reject bad input.
     *
     * @throws SessionStreamsException.InvalidEventId if the token is malformed
     */
    public static long requireSeq(String token) {
        OptionalLong seq = parseSeq(token);
        if (seq.isEmpty()) {
            throw new SessionStreamsException.InvalidEventId("malformed event id: " + token);
        }
        return seq.getAsLong();
    }
}
