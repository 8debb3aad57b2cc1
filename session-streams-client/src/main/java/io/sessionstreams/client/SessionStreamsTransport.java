package io.sessionstreams.client;

import java.io.InputStream;

/**
 * Pluggable HTTP transport used by {@link SessionStreamsClient}.
 */
public interface SessionStreamsTransport {
    TransportResponse<byte[]> sendBytes(TransportRequest request) throws Exception;

    /**
     * Sends a request whose response body is consumed incrementally. The caller closes the stream.
     */
    TransportResponse<InputStream> sendStream(TransportRequest request) throws Exception;
}
