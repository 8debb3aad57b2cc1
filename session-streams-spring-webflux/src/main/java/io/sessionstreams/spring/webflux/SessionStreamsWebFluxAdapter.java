package io.sessionstreams.spring.webflux;

import io.sessionstreams.server.core.HttpMethod;
import io.sessionstreams.server.core.ResponseBody;
import io.sessionstreams.server.core.SessionStreamsHandler;
import io.sessionstreams.server.core.SseFrame;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.codec.ServerSentEvent;
import org.springframework.web.reactive.function.BodyInserters;
import org.springframework.web.reactive.function.server.ServerRequest;
import org.springframework.web.reactive.function.server.ServerResponse;
import reactor.adapter.JdkFlowAdapter;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

import java.io.ByteArrayInputStream;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Spring WebFlux functional-endpoint adapter for {@link SessionStreamsHandler}.
 *
 * <pre>{@code
 * RouterFunctions.route(RequestPredicates.path("/api/stream/**"), adapter::handle)
 * }</pre>
 *
 * <p>Engine calls may wait on a session lock, so they run on the bounded-elastic scheduler. Event streams follow
 * the client's demand; a client that stops reading overflows its connection queue and is dropped.
 */
public final class SessionStreamsWebFluxAdapter {

    private static final Logger log = LoggerFactory.getLogger(SessionStreamsWebFluxAdapter.class);

    private final SessionStreamsHandler handler;

    public SessionStreamsWebFluxAdapter(SessionStreamsHandler handler) {
        this.handler = Objects.requireNonNull(handler, "handler");
    }

    public Mono<ServerResponse> handle(ServerRequest req) {
        HttpMethod method;
        try {
            method = HttpMethod.valueOf(req.methodName());
        } catch (IllegalArgumentException e) {
            return ServerResponse.status(405).header("Allow", "GET, POST").build();
        }
        return req.bodyToMono(byte[].class)
                .defaultIfEmpty(new byte[0])
                .publishOn(Schedulers.boundedElastic())
                .map(body -> handler.handle(toEngineRequest(method, req, body)))
                .flatMap(SessionStreamsWebFluxAdapter::toWebResponse);
    }

    private static io.sessionstreams.server.core.ServerRequest toEngineRequest(HttpMethod method, ServerRequest req, byte[] body) {
        Map<String, List<String>> headers = new LinkedHashMap<>();
        req.headers().asHttpHeaders().forEach((k, v) -> headers.put(k, List.copyOf(v)));
        ByteArrayInputStream in = body.length == 0 ? null : new ByteArrayInputStream(body);
        return new io.sessionstreams.server.core.ServerRequest(method, req.uri(), headers, in);
    }

    private static Mono<ServerResponse> toWebResponse(io.sessionstreams.server.core.ServerResponse response) {
        ServerResponse.BodyBuilder builder = ServerResponse.status(response.status());
        response.headers().forEach((k, v) -> v.forEach(value -> builder.header(k, value)));

        ResponseBody body = response.body();
        if (body instanceof ResponseBody.Bytes bytes) {
            return builder.bodyValue(bytes.bytes());
        }
        if (body instanceof ResponseBody.Sse sse) {
            Flux<ServerSentEvent<String>> events = JdkFlowAdapter.flowPublisherToFlux(sse.publisher())
                    .map(SessionStreamsWebFluxAdapter::toServerSentEvent)
                    .doOnCancel(() -> log.debug("Event stream cancelled by client"));
            return builder.body(BodyInserters.fromServerSentEvents(events));
        }
        return builder.build();
    }

    static ServerSentEvent<String> toServerSentEvent(SseFrame frame) {
        if (frame.isComment()) {
            return ServerSentEvent.<String>builder().comment(frame.comment()).build();
        }
        ServerSentEvent.Builder<String> sse = ServerSentEvent.<String>builder(frame.data()).event(frame.event());
        if (frame.id() != null) {
            sse.id(frame.id());
        }
        return sse.build();
    }
}
