package io.sessionstreams.client;

import io.sessionstreams.core.Protocol;

import java.net.URI;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * One outgoing HTTP call. Streams carry no timeout; they stay open until the server or the subscriber ends them.
 */
public record TransportRequest(String method, URI url, Map<String, List<String>> headers, byte[] body) {

    public TransportRequest {
        Objects.requireNonNull(method, "method");
        Objects.requireNonNull(url, "url");
        headers = headers == null ? Map.of() : Map.copyOf(headers);
    }

    /** {@code GET} asking for an event stream. */
    public static TransportRequest stream(URI url) {
        return new TransportRequest("GET", url, Map.of(Protocol.H_ACCEPT, List.of(Protocol.CT_EVENT_STREAM)), null);
    }

    /** {@code POST} of a JSON document expecting JSON back. */
    public static TransportRequest postJson(URI url, byte[] json) {
        return new TransportRequest("POST", url, Map.of(
                Protocol.H_CONTENT_TYPE, List.of(Protocol.CT_JSON),
                Protocol.H_ACCEPT, List.of(Protocol.CT_JSON)), Objects.requireNonNull(json, "json"));
    }
}
