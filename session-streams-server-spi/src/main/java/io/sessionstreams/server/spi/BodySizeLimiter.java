package io.sessionstreams.server.spi;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.InputStream;

/**
 * Reads ingress request bodies under a byte cap so oversized payloads can be answered with 413.
 */
public final class BodySizeLimiter {

    private static final int CHUNK = 8192;

    private BodySizeLimiter() {}

    /**
     * Reads the whole body.
     *
     * @param body request body, may be {@code null}
     * @param maxBytes maximum accepted size; {@code <= 0} or {@link Long#MAX_VALUE} means unlimited
     * @return the body bytes, empty for a {@code null} body
     * @throws PayloadTooLargeException as soon as more than {@code maxBytes} have been seen
     */
    public static byte[] readAll(InputStream body, long maxBytes) throws IOException {
        if (body == null) return new byte[0];
        boolean unlimited = maxBytes <= 0 || maxBytes == Long.MAX_VALUE;

        ByteArrayOutputStream out = new ByteArrayOutputStream();
        byte[] buf = new byte[CHUNK];
        long total = 0;
        int n;
        while ((n = body.read(buf)) >= 0) {
            total += n;
            if (!unlimited && total > maxBytes) {
                throw new PayloadTooLargeException(maxBytes);
            }
            out.write(buf, 0, n);
        }
        return out.toByteArray();
    }

    /**
     * Exception thrown when payload size exceeds the configured limit.
     */
    public static final class PayloadTooLargeException extends IOException {
        private final long maxBytes;

        public PayloadTooLargeException(long maxBytes) {
            super("Payload exceeds maximum size of " + maxBytes + " bytes");
            this.maxBytes = maxBytes;
        }

        public long maxBytes() {
            return maxBytes;
        }
    }
}
