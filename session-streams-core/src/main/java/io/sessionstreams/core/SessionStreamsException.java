package io.sessionstreams.core;

/**
 * Base class for Session Streams related exceptions.
 *
 * <p>Subclasses name the specific condition and keep the original cause when there is one.
 */
public abstract class SessionStreamsException extends RuntimeException {

    protected SessionStreamsException(String message) {
        super(message);
    }

    protected SessionStreamsException(String message, Throwable cause) {
        super(message, cause);
    }

    /**
     * Raised when a resumption token cannot be parsed.
     */
    public static class InvalidEventId extends SessionStreamsException {
        public InvalidEventId(String message) {
            super(message);
        }
    }

    /**
     * Raised when a connection's outbound queue is full and the frame was dropped.
     */
    public static class Backpressure extends SessionStreamsException {
        public Backpressure(String message) {
            super(message);
        }
    }

    /**
     * Raised by the client when the server rejects a request with a 4xx status.
     */
    public static class ClientError extends SessionStreamsException {
        private final int status;

        public ClientError(int status, String message) {
            super(message);
            this.status = status;
        }

        public int status() {
            return status;
        }
    }

    /**
     * Raised by the client when the server fails with a 5xx status or returns an unreadable body.
     */
    public static class ServerError extends SessionStreamsException {
        private final int status;

        public ServerError(int status, String message) {
            super(message);
            this.status = status;
        }

        public ServerError(int status, String message, Throwable cause) {
            super(message, cause);
            this.status = status;
        }

        public int status() {
            return status;
        }
    }
}
