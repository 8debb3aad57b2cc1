package io.sessionstreams.server.core;

import io.sessionstreams.core.Headers;

import java.io.InputStream;
import java.net.URI;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Framework-neutral request abstraction built by each adapter.
 */
public final class ServerRequest {
    private final HttpMethod method;
    private final URI uri;
    private final Map<String, List<String>> headers;
    private final InputStream body;
    private Map<String, String> query;

    /**
     * @param body request body, {@code null} when there is none
     */
    public ServerRequest(HttpMethod method, URI uri, Map<String, List<String>> headers, InputStream body) {
        this.method = Objects.requireNonNull(method, "method");
        this.uri = Objects.requireNonNull(uri, "uri");
        this.headers = headers == null ? Map.of() : headers;
        this.body = body;
    }

    public HttpMethod method() {
        return method;
    }

    public URI uri() {
        return uri;
    }

    public Map<String, List<String>> headers() {
        return headers;
    }

    public InputStream body() {
        return body;
    }

    /** Decoded query parameter; blank values count as absent. */
    public Optional<String> queryParam(String name) {
        if (query == null) {
            query = QueryString.parse(uri);
        }
        String value = query.get(name);
        return value == null || value.isBlank() ? Optional.empty() : Optional.of(value);
    }

    /** Header value, matched case-insensitively. */
    public Optional<String> header(String name) {
        return Headers.firstValue(headers, name);
    }

    boolean pathEndsWith(String suffix) {
        String path = uri.getPath();
        return path != null && path.endsWith(suffix);
    }
}
