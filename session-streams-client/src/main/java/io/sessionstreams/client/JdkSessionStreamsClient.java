package io.sessionstreams.client;

import io.sessionstreams.core.ActionResult;
import io.sessionstreams.core.DispatchRequest;
import io.sessionstreams.core.DomainEvent;
import io.sessionstreams.core.Protocol;
import io.sessionstreams.core.SessionStreamEvent;
import io.sessionstreams.core.SessionStreamsException;
import io.sessionstreams.core.ToolCall;
import io.sessionstreams.json.spi.JsonCodec;
import io.sessionstreams.json.spi.JsonException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.net.URI;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.Flow;

public final class JdkSessionStreamsClient implements SessionStreamsClient {

    private static final Logger log = LoggerFactory.getLogger(JdkSessionStreamsClient.class);

    private final SessionStreamsTransport transport;
    private final JsonCodec codec;
    private final Duration reconnectDelay;
    private final int maxReconnectAttempts;

    JdkSessionStreamsClient(SessionStreamsTransport transport, JsonCodec codec, Duration reconnectDelay, int maxReconnectAttempts) {
        this.transport = Objects.requireNonNull(transport, "transport");
        this.codec = Objects.requireNonNull(codec, "codec");
        this.reconnectDelay = Objects.requireNonNull(reconnectDelay, "reconnectDelay");
        this.maxReconnectAttempts = maxReconnectAttempts;
    }

    @Override
    public Flow.Publisher<SessionStreamEvent> subscribe(SubscribeRequest request) {
        return new SseLoop(transport, codec, request, reconnectDelay, maxReconnectAttempts);
    }

    @Override
    public ActionResult callTool(URI toolUrl, String tool, Map<String, Object> args) throws Exception {
        Objects.requireNonNull(tool, "tool");
        TransportResponse<byte[]> resp = postJson(toolUrl, new ToolCall(tool, args == null ? Map.of() : args));
        int status = resp.status();
        if (status == 200 || status == 400) {
            return readBody(resp, ActionResult.class);
        }
        if (status == 500) {
            ActionResult failure = tryRead(resp, ActionResult.class);
            String message = failure != null && failure.error() != null ? failure.error() : "tool call failed";
            throw new SessionStreamsException.ServerError(status, message);
        }
        throw statusError(resp, "tool call " + tool);
    }

    @Override
    public DispatchResult dispatch(URI eventsUrl, String sessionId, List<DomainEvent> events) throws Exception {
        Objects.requireNonNull(events, "events");
        TransportResponse<byte[]> resp = postJson(eventsUrl, new DispatchRequest(sessionId, events));
        if (resp.status() != 200) {
            throw statusError(resp, "dispatch to " + sessionId);
        }
        DispatchResult result = readBody(resp, DispatchResult.class);
        log.debug("Dispatched {} event(s) to session {}: {}", events.size(), sessionId, result);
        return result;
    }

    private TransportResponse<byte[]> postJson(URI url, Object body) throws Exception {
        return transport.sendBytes(TransportRequest.postJson(url, codec.writeBytes(body)));
    }

    private <T> T readBody(TransportResponse<byte[]> resp, Class<T> type) {
        try {
            return codec.readValue(resp.body(), type);
        } catch (JsonException e) {
            throw new SessionStreamsException.ServerError(resp.status(), "unreadable " + type.getSimpleName() + " body", e);
        }
    }

    private <T> T tryRead(TransportResponse<byte[]> resp, Class<T> type) {
        try {
            return codec.readValue(resp.body(), type);
        } catch (JsonException e) {
            log.debug("Error body is not a {}", type.getSimpleName(), e);
            return null;
        }
    }

    private static SessionStreamsException statusError(TransportResponse<byte[]> resp, String what) {
        int status = resp.status();
        String reason = resp.header(Protocol.H_X_ERROR)
                .orElseGet(() -> new String(resp.body(), StandardCharsets.UTF_8));
        String message = what + " failed with status " + status + (reason.isBlank() ? "" : ": " + reason);
        if (resp.isClientError()) {
            return new SessionStreamsException.ClientError(status, message);
        }
        return new SessionStreamsException.ServerError(status, message);
    }
}
