package io.sessionstreams.servlet;

import io.sessionstreams.server.core.HttpMethod;
import io.sessionstreams.server.core.ResponseBody;
import io.sessionstreams.server.core.ServerRequest;
import io.sessionstreams.server.core.ServerResponse;
import io.sessionstreams.server.core.SessionStreamsHandler;
import io.sessionstreams.server.core.SseFrame;
import jakarta.servlet.AsyncContext;
import jakarta.servlet.AsyncEvent;
import jakarta.servlet.AsyncListener;
import jakarta.servlet.ServletOutputStream;
import jakarta.servlet.http.HttpServlet;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.URI;
import java.net.URISyntaxException;
import java.nio.charset.StandardCharsets;
import java.util.Collections;
import java.util.Enumeration;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.Flow;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Jakarta Servlet adapter for {@link SessionStreamsHandler}.
 *
 * <p>Event streams run in async mode with no timeout. A failed write cancels the stream, which unregisters the
 * connection from its session.
 */
public final class SessionStreamsServlet extends HttpServlet {

    private static final Logger log = LoggerFactory.getLogger(SessionStreamsServlet.class);

    private final transient SessionStreamsHandler handler;

    public SessionStreamsServlet(SessionStreamsHandler handler) {
        this.handler = Objects.requireNonNull(handler, "handler");
    }

    @Override
    protected void service(HttpServletRequest req, HttpServletResponse resp) throws IOException {
        HttpMethod method;
        try {
            method = HttpMethod.valueOf(req.getMethod());
        } catch (IllegalArgumentException e) {
            resp.setStatus(405);
            resp.setHeader("Allow", "GET, POST");
            return;
        }

        ServerResponse engineResp;
        try {
            engineResp = handler.handle(toEngineRequest(method, req));
        } catch (URISyntaxException e) {
            resp.setStatus(400);
            return;
        }

        resp.setStatus(engineResp.status());
        engineResp.headers().forEach((k, vals) -> vals.forEach(v -> resp.addHeader(k, v)));

        ResponseBody body = engineResp.body();
        if (body instanceof ResponseBody.Bytes bytes) {
            resp.getOutputStream().write(bytes.bytes());
        } else if (body instanceof ResponseBody.Sse sse) {
            stream(req, resp, sse.publisher());
        }
    }

    private static void stream(HttpServletRequest req, HttpServletResponse resp, Flow.Publisher<SseFrame> publisher)
            throws IOException {
        resp.flushBuffer();
        AsyncContext async = req.startAsync();
        async.setTimeout(0);
        ServletOutputStream out = resp.getOutputStream();
        FrameWriter writer = new FrameWriter(async, out);
        async.addListener(writer);
        publisher.subscribe(writer);
    }

    private static ServerRequest toEngineRequest(HttpMethod method, HttpServletRequest req)
            throws URISyntaxException, IOException {
        String query = req.getQueryString();
        URI uri = new URI(req.getRequestURL().toString() + (query == null ? "" : "?" + query));

        Map<String, List<String>> headers = new LinkedHashMap<>();
        Enumeration<String> names = req.getHeaderNames();
        while (names != null && names.hasMoreElements()) {
            String name = names.nextElement();
            headers.put(name, Collections.list(req.getHeaders(name)));
        }

        return new ServerRequest(method, uri, headers, method == HttpMethod.POST ? req.getInputStream() : null);
    }

    /**
     * Writes frames to the async response; completes the async context exactly once.
     */
    private static final class FrameWriter implements Flow.Subscriber<SseFrame>, AsyncListener {
        private final AsyncContext async;
        private final ServletOutputStream out;
        private final AtomicBoolean completed = new AtomicBoolean();
        private volatile Flow.Subscription subscription;

        FrameWriter(AsyncContext async, ServletOutputStream out) {
            this.async = async;
            this.out = out;
        }

        @Override
        public void onSubscribe(Flow.Subscription subscription) {
            this.subscription = subscription;
            subscription.request(Long.MAX_VALUE);
        }

        @Override
        public void onNext(SseFrame item) {
            try {
                out.write(item.render().getBytes(StandardCharsets.UTF_8));
                out.flush();
            } catch (IOException e) {
                log.debug("Client went away while writing event stream", e);
                subscription.cancel();
                complete();
            }
        }

        @Override
        public void onError(Throwable throwable) {
            log.debug("Event stream terminated with error", throwable);
            complete();
        }

        @Override
        public void onComplete() {
            complete();
        }

        @Override
        public void onComplete(AsyncEvent event) {
            cancel();
        }

        @Override
        public void onTimeout(AsyncEvent event) {
            cancel();
            complete();
        }

        @Override
        public void onError(AsyncEvent event) {
            cancel();
            complete();
        }

        @Override
        public void onStartAsync(AsyncEvent event) {
        }

        private void cancel() {
            Flow.Subscription s = subscription;
            if (s != null) {
                s.cancel();
            }
        }

        private void complete() {
            if (completed.compareAndSet(false, true)) {
                async.complete();
            }
        }
    }
}
