package io.sessionstreams.client;

import io.sessionstreams.core.Headers;

import java.util.List;
import java.util.Map;
import java.util.Optional;

public record TransportResponse<T>(int status, Map<String, List<String>> headers, T body) {

    public TransportResponse {
        if (headers == null) {
            headers = Map.of();
        }
    }

    /** First non-blank value of a header, matched case-insensitively. */
    public Optional<String> header(String name) {
        return Headers.firstValue(headers, name);
    }

    /** 4xx: the request itself was rejected and retrying it unchanged will not help. */
    public boolean isClientError() {
        return status >= 400 && status < 500;
    }
}
