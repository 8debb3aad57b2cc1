package io.sessionstreams.server.core;

import java.util.concurrent.Flow;

/**
 * Framework-neutral response body abstraction.
 *
 * <p>{@link Sse} publishers are single-subscriber; adapters must cancel the subscription when the client goes
 * away or a write fails.
 */
public sealed interface ResponseBody permits ResponseBody.Empty, ResponseBody.Bytes, ResponseBody.Sse {

    record Empty() implements ResponseBody {}

    record Bytes(byte[] bytes) implements ResponseBody {}

    record Sse(Flow.Publisher<SseFrame> publisher) implements ResponseBody {}
}
