package io.sessionstreams.client;

import io.sessionstreams.json.spi.JsonCodec;
import io.sessionstreams.json.spi.JsonCodecs;

import java.net.http.HttpClient;
import java.time.Duration;
import java.util.Objects;

public final class SessionStreamsClientBuilder {

    /** Pause before a dropped stream is reopened. */
    public static final Duration DEFAULT_RECONNECT_DELAY = Duration.ofSeconds(1);

    private SessionStreamsTransport transport;
    private JsonCodec jsonCodec;
    private Duration reconnectDelay = DEFAULT_RECONNECT_DELAY;
    private int maxReconnectAttempts = Integer.MAX_VALUE;

    public SessionStreamsClientBuilder transport(SessionStreamsTransport transport) {
        this.transport = Objects.requireNonNull(transport, "transport");
        return this;
    }

    public SessionStreamsClientBuilder jdkHttpClient(HttpClient httpClient) {
        this.transport = new JdkHttpTransport(Objects.requireNonNull(httpClient, "httpClient"));
        return this;
    }

    public SessionStreamsClientBuilder jsonCodec(JsonCodec jsonCodec) {
        this.jsonCodec = Objects.requireNonNull(jsonCodec, "jsonCodec");
        return this;
    }

    public SessionStreamsClientBuilder reconnectDelay(Duration reconnectDelay) {
        Objects.requireNonNull(reconnectDelay, "reconnectDelay");
        if (reconnectDelay.isNegative()) throw new IllegalArgumentException("reconnectDelay must not be negative");
        this.reconnectDelay = reconnectDelay;
        return this;
    }

    /**
     * Consecutive failed connection attempts tolerated before a subscription fails. Default: unlimited.
     */
    public SessionStreamsClientBuilder maxReconnectAttempts(int maxReconnectAttempts) {
        if (maxReconnectAttempts < 0) throw new IllegalArgumentException("maxReconnectAttempts must be >= 0");
        this.maxReconnectAttempts = maxReconnectAttempts;
        return this;
    }

    public SessionStreamsClient build() {
        SessionStreamsTransport resolved = transport != null ? transport : new JdkHttpTransport(HttpClient.newHttpClient());
        JsonCodec codec = jsonCodec != null ? jsonCodec : JsonCodecs.load();
        return new JdkSessionStreamsClient(resolved, codec, reconnectDelay, maxReconnectAttempts);
    }
}
