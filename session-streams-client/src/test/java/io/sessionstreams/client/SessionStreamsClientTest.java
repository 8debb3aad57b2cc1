package io.sessionstreams.client;

import io.sessionstreams.core.ActionResult;
import io.sessionstreams.core.DomainEvent;
import io.sessionstreams.core.SessionStreamEvent;
import io.sessionstreams.core.SessionStreamsException;
import io.sessionstreams.json.jackson.JacksonJsonCodec;
import okhttp3.mockwebserver.MockResponse;
import okhttp3.mockwebserver.MockWebServer;
import okhttp3.mockwebserver.RecordedRequest;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.net.URI;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.Flow;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class SessionStreamsClientTest {

    private MockWebServer server;
    private SessionStreamsClient client;

    @BeforeEach
    void setUp() throws Exception {
        server = new MockWebServer();
        server.start();
        client = SessionStreamsClient.builder()
                .jsonCodec(new JacksonJsonCodec())
                .reconnectDelay(Duration.ofMillis(50))
                .build();
    }

    @AfterEach
    void tearDown() throws Exception {
        server.shutdown();
    }

    @Test
    void subscribeEmitsConnectedAndDomainEvents() throws Exception {
        server.enqueue(sse(connected(0) + domain(1) + domain(2)));
        server.enqueue(new MockResponse().setResponseCode(404));

        Collector collector = subscribe(new SubscribeRequest(streamUrl(), "s1"));

        assertThat(collector.awaitTermination()).isTrue();
        assertThat(collector.events()).hasSize(3);
        assertThat(collector.events().get(0)).isEqualTo(new SessionStreamEvent.Connected("s1", 0));
        assertThat(collector.domainSeqs()).containsExactly(1L, 2L);
        assertThat(collector.error()).isInstanceOf(SessionStreamsException.ClientError.class);

        RecordedRequest first = server.takeRequest(1, TimeUnit.SECONDS);
        assertThat(first.getMethod()).isEqualTo("GET");
        assertThat(first.getHeader("Accept")).isEqualTo("text/event-stream");
        assertThat(first.getRequestUrl().queryParameter("sessionId")).isEqualTo("s1");
        assertThat(first.getRequestUrl().queryParameter("lastEventId")).isNull();

        RecordedRequest second = server.takeRequest(1, TimeUnit.SECONDS);
        assertThat(second.getRequestUrl().queryParameter("lastEventId")).isEqualTo("s1:2");
    }

    @Test
    void reconnectBeforeAnyEventResumesFromAcknowledgedSeq() throws Exception {
        server.enqueue(sse(connected(0)));
        server.enqueue(new MockResponse().setResponseCode(404));

        Collector collector = subscribe(new SubscribeRequest(streamUrl(), "s1"));

        assertThat(collector.awaitTermination()).isTrue();
        assertThat(collector.events()).containsExactly(new SessionStreamEvent.Connected("s1", 0));
        assertThat(server.takeRequest(1, TimeUnit.SECONDS).getRequestUrl().queryParameter("lastEventId")).isNull();
        RecordedRequest second = server.takeRequest(1, TimeUnit.SECONDS);
        assertThat(second.getRequestUrl().queryParameter("lastEventId")).isEqualTo("s1:0");
    }

    @Test
    void firstLiveEventAfterFreshJoinIsNotReportedAsGap() throws Exception {
        server.enqueue(sse(connected(0) + domain(6) + domain(8)));
        server.enqueue(new MockResponse().setResponseCode(404));

        Collector collector = subscribe(new SubscribeRequest(streamUrl(), "s1"));

        assertThat(collector.awaitTermination()).isTrue();
        assertThat(collector.domainSeqs()).containsExactly(6L, 8L);
        assertThat(collector.events()).filteredOn(e -> e instanceof SessionStreamEvent.Gap)
                .containsExactly(new SessionStreamEvent.Gap(7, 8));
    }

    @Test
    void malformedInitialLastEventIdIsRejected() {
        assertThatThrownBy(() -> new SubscribeRequest(streamUrl(), "s1", "s1:latest"))
                .isInstanceOf(SessionStreamsException.InvalidEventId.class)
                .hasMessageContaining("s1:latest");
    }

    @Test
    void reconnectDropsDuplicatesAndReportsGaps() throws Exception {
        server.enqueue(sse(connected(0) + domain(1) + domain(2)));
        server.enqueue(sse(connected(2) + domain(2) + domain(5) + reconnected(2, 2, 5)));
        server.enqueue(new MockResponse().setResponseCode(410));

        Collector collector = subscribe(new SubscribeRequest(streamUrl(), "s1"));

        assertThat(collector.awaitTermination()).isTrue();
        assertThat(collector.events()).containsSubsequence(
                new SessionStreamEvent.Connected("s1", 2),
                new SessionStreamEvent.Gap(3, 5));
        assertThat(collector.domainSeqs()).containsExactly(1L, 2L, 5L);
        assertThat(collector.events().get(collector.events().size() - 1))
                .isEqualTo(new SessionStreamEvent.Reconnected(2, 2, 5));
    }

    @Test
    void resumesFromInitialLastEventId() throws Exception {
        server.enqueue(new MockResponse().setResponseCode(400).addHeader("X-Error", "Missing sessionId"));

        Collector collector = subscribe(new SubscribeRequest(streamUrl(), "s1", "s1:3"));

        assertThat(collector.awaitTermination()).isTrue();
        assertThat(collector.error()).hasMessageContaining("Missing sessionId");
        RecordedRequest request = server.takeRequest(1, TimeUnit.SECONDS);
        assertThat(request.getRequestUrl().queryParameter("lastEventId")).isEqualTo("s1:3");
    }

    @Test
    void serverErrorsAreRetriedUntilAttemptsRunOut() throws Exception {
        SessionStreamsClient strict = SessionStreamsClient.builder()
                .jsonCodec(new JacksonJsonCodec())
                .reconnectDelay(Duration.ofMillis(50))
                .maxReconnectAttempts(1)
                .build();
        server.enqueue(new MockResponse().setResponseCode(503));
        server.enqueue(new MockResponse().setResponseCode(503));

        Collector collector = new Collector();
        strict.subscribe(new SubscribeRequest(streamUrl(), "s1")).subscribe(collector);

        assertThat(collector.awaitTermination()).isTrue();
        assertThat(collector.error()).isInstanceOf(SessionStreamsException.ServerError.class);
        assertThat(server.getRequestCount()).isEqualTo(2);
    }

    @Test
    void callToolReturnsResultForSuccessAndRejection() throws Exception {
        server.enqueue(json(200, "{\"success\":true,\"data\":{\"ok\":1},\"events\":[" + domainJson(1) + "]}"));
        server.enqueue(json(400, "{\"success\":false,\"error\":\"Invalid move\",\"events\":[]}"));

        ActionResult ok = client.callTool(server.url("/api/stream").uri(), "move", Map.of("sessionId", "s1"));
        ActionResult rejected = client.callTool(server.url("/api/stream").uri(), "move", Map.of());

        assertThat(ok.success()).isTrue();
        assertThat(ok.events()).extracting(DomainEvent::id).containsExactly("s1:1");
        assertThat(rejected.success()).isFalse();
        assertThat(rejected.error()).isEqualTo("Invalid move");

        RecordedRequest request = server.takeRequest(1, TimeUnit.SECONDS);
        assertThat(request.getMethod()).isEqualTo("POST");
        assertThat(request.getHeader("Content-Type")).isEqualTo("application/json");
        assertThat(request.getBody().readUtf8()).contains("\"tool\":\"move\"").contains("\"sessionId\":\"s1\"");
    }

    @Test
    void callToolSurfacesServerFailure() {
        server.enqueue(json(500, "{\"success\":false,\"error\":\"engine crashed\",\"events\":[]}"));

        assertThatThrownBy(() -> client.callTool(server.url("/api/stream").uri(), "move", null))
                .isInstanceOf(SessionStreamsException.ServerError.class)
                .hasMessage("engine crashed");
    }

    @Test
    void dispatchPostsEventsAndReadsOutcome() throws Exception {
        server.enqueue(json(200, "{\"appended\":1,\"delivered\":2,\"pruned\":0}"));
        DomainEvent event = new DomainEvent("s1:1", 1, "move", "s1", Map.of("x", 1), 0L);

        DispatchResult result = client.dispatch(server.url("/api/stream/events").uri(), "s1", List.of(event));

        assertThat(result).isEqualTo(new DispatchResult(1, 2, 0));
        String body = server.takeRequest(1, TimeUnit.SECONDS).getBody().readUtf8();
        assertThat(body).contains("\"sessionId\":\"s1\"").contains("\"id\":\"s1:1\"");
    }

    @Test
    void dispatchRejectionIsClientError() {
        server.enqueue(json(400, "{\"error\":\"Missing sessionId\"}").addHeader("X-Error", "Missing sessionId"));

        assertThatThrownBy(() -> client.dispatch(server.url("/api/stream/events").uri(), null, List.of()))
                .isInstanceOf(SessionStreamsException.ClientError.class)
                .hasMessageContaining("Missing sessionId");
    }

    private URI streamUrl() {
        return server.url("/api/stream").uri();
    }

    private Collector subscribe(SubscribeRequest request) {
        Collector collector = new Collector();
        client.subscribe(request).subscribe(collector);
        return collector;
    }

    private static MockResponse sse(String body) {
        return new MockResponse()
                .setResponseCode(200)
                .addHeader("Content-Type", "text/event-stream")
                .setBody(": heartbeat\n\n" + body);
    }

    private static MockResponse json(int status, String body) {
        return new MockResponse()
                .setResponseCode(status)
                .addHeader("Content-Type", "application/json")
                .setBody(body);
    }

    private static String connected(long lastSeq) {
        return "event: connected\ndata: {\"sessionId\":\"s1\",\"lastSeq\":" + lastSeq + "}\n\n";
    }

    private static String reconnected(int missed, long from, long to) {
        return "event: reconnected\ndata: {\"missedCount\":" + missed + ",\"fromSeq\":" + from + ",\"toSeq\":" + to + "}\n\n";
    }

    private static String domain(long seq) {
        return "id: s1:" + seq + "\nevent: move\ndata: " + domainJson(seq) + "\n\n";
    }

    private static String domainJson(long seq) {
        return "{\"id\":\"s1:" + seq + "\",\"seq\":" + seq
                + ",\"type\":\"move\",\"sessionId\":\"s1\",\"payload\":{\"x\":" + seq + "},\"timestamp\":0}";
    }

    private static final class Collector implements Flow.Subscriber<SessionStreamEvent> {
        private final List<SessionStreamEvent> events = new ArrayList<>();
        private final CountDownLatch done = new CountDownLatch(1);
        private volatile Throwable error;

        @Override
        public void onSubscribe(Flow.Subscription subscription) {
            subscription.request(Long.MAX_VALUE);
        }

        @Override
        public synchronized void onNext(SessionStreamEvent item) {
            events.add(item);
        }

        @Override
        public void onError(Throwable throwable) {
            error = throwable;
            done.countDown();
        }

        @Override
        public void onComplete() {
            done.countDown();
        }

        boolean awaitTermination() throws InterruptedException {
            return done.await(10, TimeUnit.SECONDS);
        }

        synchronized List<SessionStreamEvent> events() {
            return List.copyOf(events);
        }

        List<Long> domainSeqs() {
            return events().stream()
                    .filter(SessionStreamEvent.Domain.class::isInstance)
                    .map(e -> ((SessionStreamEvent.Domain) e).event().seq())
                    .toList();
        }

        Throwable error() {
            return error;
        }
    }
}
