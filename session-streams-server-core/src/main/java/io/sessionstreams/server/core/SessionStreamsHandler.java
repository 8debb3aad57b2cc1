package io.sessionstreams.server.core;

import io.sessionstreams.core.ActionResult;
import io.sessionstreams.core.DispatchRequest;
import io.sessionstreams.core.DomainEvent;
import io.sessionstreams.core.Protocol;
import io.sessionstreams.core.ToolCall;
import io.sessionstreams.json.spi.JsonCodec;
import io.sessionstreams.json.spi.JsonCodecs;
import io.sessionstreams.json.spi.JsonException;
import io.sessionstreams.server.spi.BodySizeLimiter;
import io.sessionstreams.server.spi.DomainActionHandler;
import io.sessionstreams.server.spi.LogStats;
import io.sessionstreams.server.spi.SessionEventLog;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ExecutorService;

/**
 * Framework-neutral HTTP handler for session event streams.
 *
 * <ul>
 *   <li>{@code GET ?sessionId=..&lastEventId=..} opens an SSE stream ({@link SessionStreamer})</li>
 *   <li>{@code POST .../events} with {@code {sessionId, events}} dispatches events directly</li>
 *   <li>any other {@code POST} with {@code {tool, args}} runs the {@link DomainActionHandler} and dispatches the
 *       events it returns</li>
 * </ul>
 *
 * <p>Every request first gives the {@link RetentionSweeper} a chance to run.
 *
 * <p>Use {@link #builder(SessionEventLog)} to create instances with custom configuration:
 * <pre>{@code
 * SessionStreamsHandler handler = SessionStreamsHandler.builder(new InMemorySessionEventLog())
 *     .actionHandler(gameTools)
 *     .heartbeatInterval(Duration.ofSeconds(15))
 *     .maxBodySize(256 * 1024)
 *     .build();
 * }</pre>
 */
public final class SessionStreamsHandler implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(SessionStreamsHandler.class);

    /** Default ingress body limit: 1 MB. */
    public static final long DEFAULT_MAX_BODY_SIZE = 1024 * 1024;

    /**
     * Disable body size limiting (unlimited).
     */
    public static final long NO_BODY_SIZE_LIMIT = Long.MAX_VALUE;

    static final String MISSING_TOOL = "Missing or invalid \"tool\" field";

    private final SessionEventLog eventLog;
    private final ConnectionRegistry registry;
    private final JsonCodec codec;
    private final DomainActionHandler actionHandler;
    private final HeartbeatScheduler heartbeats;
    private final ExecutorService writerExecutor;
    private final boolean ownsWriterExecutor;
    private final SessionStreamer streamer;
    private final EventDispatcher dispatcher;
    private final RetentionSweeper sweeper;
    private final long maxBodySize;

    /**
     * Creates a new builder for configuring a handler.
     *
     * @param eventLog the replay buffer (required)
     * @return a new builder instance
     */
    public static Builder builder(SessionEventLog eventLog) {
        return new Builder(eventLog);
    }

    public SessionStreamsHandler(SessionEventLog eventLog) {
        this(builder(eventLog));
    }

    private SessionStreamsHandler(Builder builder) {
        Clock clock = builder.clock != null ? builder.clock : Clock.systemUTC();
        this.eventLog = Objects.requireNonNull(builder.eventLog, "eventLog");
        this.registry = new ConnectionRegistry();
        this.codec = builder.jsonCodec != null ? builder.jsonCodec : JsonCodecs.load();
        this.actionHandler = builder.actionHandler != null ? builder.actionHandler : DomainActionHandler.unavailable();
        this.heartbeats = new HeartbeatScheduler(
                builder.heartbeatInterval != null ? builder.heartbeatInterval : HeartbeatScheduler.DEFAULT_INTERVAL);
        this.ownsWriterExecutor = builder.writerExecutor == null;
        this.writerExecutor = ownsWriterExecutor ? VirtualThreads.newExecutor("session-streams-writer") : builder.writerExecutor;
        this.maxBodySize = builder.maxBodySize > 0 ? builder.maxBodySize : DEFAULT_MAX_BODY_SIZE;

        int maxQueuedFrames = builder.maxQueuedFrames > 0 ? builder.maxQueuedFrames : SessionConnection.DEFAULT_MAX_QUEUED_FRAMES;
        SessionLocks locks = new SessionLocks(builder.lockStripes > 0 ? builder.lockStripes : SessionLocks.DEFAULT_STRIPES);
        SseFrames frames = new SseFrames(codec);

        this.streamer = new SessionStreamer(eventLog, registry, locks, heartbeats, frames, writerExecutor, maxQueuedFrames, clock);
        this.dispatcher = new EventDispatcher(eventLog, registry, locks, frames);
        this.sweeper = new RetentionSweeper(
                eventLog,
                registry,
                locks,
                builder.sessionTimeout != null ? builder.sessionTimeout : RetentionSweeper.DEFAULT_SESSION_TIMEOUT,
                builder.sweepInterval != null ? builder.sweepInterval : RetentionSweeper.DEFAULT_SWEEP_INTERVAL,
                clock);
    }

    /**
     * Builder for {@link SessionStreamsHandler}.
     */
    public static final class Builder {
        private final SessionEventLog eventLog;
        private DomainActionHandler actionHandler;
        private JsonCodec jsonCodec;
        private Duration heartbeatInterval;
        private Duration sessionTimeout;
        private Duration sweepInterval;
        private int maxQueuedFrames;
        private int lockStripes;
        private long maxBodySize;
        private ExecutorService writerExecutor;
        private Clock clock = Clock.systemUTC();

        private Builder(SessionEventLog eventLog) {
            this.eventLog = Objects.requireNonNull(eventLog, "eventLog");
        }

        /** Sets the tool-call handler. Default: {@link DomainActionHandler#unavailable()}. */
        public Builder actionHandler(DomainActionHandler actionHandler) {
            this.actionHandler = actionHandler;
            return this;
        }

        /** Sets the JSON codec. Default: the one found via {@link JsonCodecs#load()}. */
        public Builder jsonCodec(JsonCodec jsonCodec) {
            this.jsonCodec = jsonCodec;
            return this;
        }

        /** Sets the heartbeat interval. Default: 30 seconds. */
        public Builder heartbeatInterval(Duration heartbeatInterval) {
            this.heartbeatInterval = heartbeatInterval;
            return this;
        }

        /** Sets how long a session's log may stay idle before it is swept. Default: 1 hour. */
        public Builder sessionTimeout(Duration sessionTimeout) {
            this.sessionTimeout = sessionTimeout;
            return this;
        }

        /** Sets the minimum time between two sweeps. Default: 1 minute. */
        public Builder sweepInterval(Duration sweepInterval) {
            this.sweepInterval = sweepInterval;
            return this;
        }

        /** Sets the per-connection outbound queue bound. Default: 1024 frames. */
        public Builder maxQueuedFrames(int maxQueuedFrames) {
            this.maxQueuedFrames = maxQueuedFrames;
            return this;
        }

        /** Sets the number of session lock stripes (rounded up to a power of two). Default: 64. */
        public Builder lockStripes(int lockStripes) {
            this.lockStripes = lockStripes;
            return this;
        }

        /**
         * Sets the maximum ingress body size in bytes. Default: {@link SessionStreamsHandler#DEFAULT_MAX_BODY_SIZE}.
         *
         * <p>Use {@link SessionStreamsHandler#NO_BODY_SIZE_LIMIT} when the framework enforces limits.
         */
        public Builder maxBodySize(long maxBodySize) {
            this.maxBodySize = maxBodySize;
            return this;
        }

        /**
         * Sets the executor running connection writer tasks. Default: virtual threads when available. A supplied
         * executor is not shut down by {@link SessionStreamsHandler#close()}.
         */
        public Builder writerExecutor(ExecutorService writerExecutor) {
            this.writerExecutor = writerExecutor;
            return this;
        }

        /** Sets the clock for time-based operations. Default: system UTC. */
        public Builder clock(Clock clock) {
            this.clock = clock;
            return this;
        }

        /** Builds the handler with the configured settings. */
        public SessionStreamsHandler build() {
            return new SessionStreamsHandler(this);
        }
    }

    public ServerResponse handle(ServerRequest req) {
        try {
            sweeper.maybeSweep();
            return switch (req.method()) {
                case GET -> handleStream(req);
                case POST -> req.pathEndsWith(Protocol.EVENTS_PATH_SUFFIX) ? handleDispatch(req) : handleToolCall(req);
                default -> new ServerResponse(405, new ResponseBody.Empty())
                        .header("Allow", "GET, POST")
                        .header(Protocol.H_CACHE_CONTROL, "no-store");
            };
        } catch (BadRequest | IllegalArgumentException br) {
            return error(400, br.getMessage());
        } catch (BodySizeLimiter.PayloadTooLargeException ptle) {
            return new ServerResponse(413, new ResponseBody.Empty())
                    .header(Protocol.H_CACHE_CONTROL, "no-store")
                    .header(Protocol.H_X_ERROR, "payload_too_large")
                    .header("X-Max-Size", Long.toString(ptle.maxBytes()));
        } catch (Exception e) {
            log.error("Unhandled error for {} {}", req.method(), req.uri().getPath(), e);
            return new ServerResponse(500, new ResponseBody.Empty())
                    .header(Protocol.H_CACHE_CONTROL, "no-store")
                    .header(Protocol.H_X_ERROR, "internal_error");
        }
    }

    /**
     * Appends and pushes events for a session without going through HTTP.
     */
    public DispatchOutcome dispatch(String sessionId, List<DomainEvent> events) {
        sweeper.maybeSweep();
        return dispatcher.dispatch(sessionId, events);
    }

    public LogStats bufferStats() {
        return eventLog.stats();
    }

    public int connectionCount() {
        return registry.connectionCount();
    }

    /**
     * Completes every open stream and stops the heartbeat and writer threads owned by this handler.
     */
    @Override
    public void close() {
        List<SessionConnection> open = registry.all();
        open.forEach(SessionConnection::close);
        heartbeats.close();
        if (ownsWriterExecutor) {
            writerExecutor.shutdown();
        }
        log.info("Session streams handler closed ({} open connection(s) completed)", open.size());
    }

    private ServerResponse handleStream(ServerRequest req) {
        String sessionId = req.queryParam(Protocol.Q_SESSION_ID)
                .orElseThrow(() -> new BadRequest("Missing sessionId"));
        String lastEventId = req.queryParam(Protocol.Q_LAST_EVENT_ID)
                .or(() -> req.header(Protocol.H_LAST_EVENT_ID))
                .orElse(null);

        SessionConnection connection = streamer.open(sessionId, lastEventId);
        return new ServerResponse(200, new ResponseBody.Sse(connection))
                .header(Protocol.H_CONTENT_TYPE, Protocol.CT_EVENT_STREAM)
                .header(Protocol.H_CACHE_CONTROL, "no-cache, no-transform")
                .header(Protocol.H_X_ACCEL_BUFFERING, "no");
    }

    private ServerResponse handleDispatch(ServerRequest req) throws Exception {
        DispatchRequest body = readJson(req, DispatchRequest.class);
        List<DomainEvent> events = body.events();
        if (events == null) {
            throw new BadRequest("Missing events");
        }
        String sessionId = body.sessionId();
        if ((sessionId == null || sessionId.isBlank()) && !events.isEmpty()) {
            sessionId = events.get(0).sessionId();
        }
        if (sessionId == null || sessionId.isBlank()) {
            throw new BadRequest("Missing sessionId");
        }
        return json(200, dispatcher.dispatch(sessionId, events));
    }

    private ServerResponse handleToolCall(ServerRequest req) throws Exception {
        ToolCall call = readJson(req, ToolCall.class);
        if (call.tool() == null || call.tool().isBlank()) {
            return json(400, ActionResult.failure(MISSING_TOOL));
        }
        Map<String, Object> args = call.args() == null ? Map.of() : call.args();

        ActionResult result;
        try {
            result = Objects.requireNonNull(actionHandler.handle(call.tool(), args), "action result");
            if (!result.events().isEmpty()) {
                dispatcher.dispatch(targetSession(args, result), result.events());
            }
        } catch (Exception e) {
            log.error("Tool call {} failed", call.tool(), e);
            String message = e.getMessage() != null ? e.getMessage() : "Internal error";
            return json(500, ActionResult.failure(message));
        }
        return json(result.success() ? 200 : 400, result);
    }

    private static String targetSession(Map<String, Object> args, ActionResult result) {
        if (args.get(ToolCall.ARG_SESSION_ID) instanceof String s && !s.isBlank()) {
            return s;
        }
        return result.events().get(0).sessionId();
    }

    private <T> T readJson(ServerRequest req, Class<T> type) throws Exception {
        byte[] bytes = BodySizeLimiter.readAll(req.body(), maxBodySize);
        if (bytes.length == 0) {
            throw new BadRequest("Missing request body");
        }
        try {
            return codec.readValue(bytes, type);
        } catch (JsonException e) {
            throw new BadRequest("Invalid JSON body");
        }
    }

    private ServerResponse json(int status, Object body) throws JsonException {
        return new ServerResponse(status, new ResponseBody.Bytes(codec.writeBytes(body)))
                .header(Protocol.H_CONTENT_TYPE, Protocol.CT_JSON)
                .header(Protocol.H_CACHE_CONTROL, "no-store");
    }

    private ServerResponse error(int status, String message) {
        String text = message == null ? "Bad request" : message;
        byte[] body;
        try {
            body = codec.writeBytes(Map.of("error", text));
        } catch (JsonException e) {
            log.warn("Could not render error body for status {}", status, e);
            body = new byte[0];
        }
        return new ServerResponse(status, new ResponseBody.Bytes(body))
                .header(Protocol.H_CONTENT_TYPE, Protocol.CT_JSON)
                .header(Protocol.H_CACHE_CONTROL, "no-store")
                .header(Protocol.H_X_ERROR, text);
    }

    private static final class BadRequest extends RuntimeException {
        BadRequest(String message) {
            super(message);
        }
    }
}
