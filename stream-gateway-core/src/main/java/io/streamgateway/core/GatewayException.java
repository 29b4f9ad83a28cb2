package io.streamgateway.core;

/**
 * Base class for gateway errors.
 *
 * <p>Each subclass carries a stable machine-readable {@link #code()} that is surfaced to clients
 * together with the message. Causes are preserved when a lower layer failed.
 */
public abstract class GatewayException extends RuntimeException {

    protected GatewayException(String message) {
        super(message);
    }

    protected GatewayException(String message, Throwable cause) {
        super(message, cause);
    }

    /**
     * Stable error code, e.g. {@code session_not_found}.
     */
    public abstract String code();

    /**
     * Raised by {@code connect} when the registry cannot resolve the requested name.
     * No session is created.
     */
    public static class NameNotFound extends GatewayException {
        public NameNotFound(String name) {
            super("server not found: " + name);
        }

        @Override
        public String code() {
            return "name_not_found";
        }
    }

    /**
     * Raised when a session id is unknown or the session has already closed.
     */
    public static class SessionNotFound extends GatewayException {
        public SessionNotFound(String sessionId) {
            super("session not found: " + sessionId);
        }

        @Override
        public String code() {
            return "session_not_found";
        }
    }

    /**
     * Raised when a second stream consumer tries to attach to a session.
     */
    public static class SessionBusy extends GatewayException {
        public SessionBusy(String sessionId) {
            super("session already has an attached stream: " + sessionId);
        }

        @Override
        public String code() {
            return "session_busy";
        }
    }

    /**
     * Raised when the backend stream cannot be opened or a backend call cannot be delivered.
     */
    public static class BackendUnreachable extends GatewayException {
        public BackendUnreachable(String message) {
            super(message);
        }

        public BackendUnreachable(String message, Throwable cause) {
            super(message, cause);
        }

        @Override
        public String code() {
            return "backend_unreachable";
        }
    }

    /**
     * A backend stream failed after it was opened. Terminates the session; never returned from a call.
     */
    public static class BackendStreamError extends GatewayException {
        public BackendStreamError(String message) {
            super(message);
        }

        public BackendStreamError(String message, Throwable cause) {
            super(message, cause);
        }

        @Override
        public String code() {
            return "backend_stream_error";
        }
    }

    /**
     * The backend answered a call with a structured error. Code and message are passed through.
     */
    public static class BackendCallError extends GatewayException {
        private final int status;
        private final String backendCode;

        public BackendCallError(int status, String backendCode, String message) {
            super(message);
            this.status = status;
            this.backendCode = backendCode;
        }

        /** HTTP status reported by the backend. */
        public int status() {
            return status;
        }

        /** Backend-provided error code. */
        public String backendCode() {
            return backendCode;
        }

        @Override
        public String code() {
            return "backend_call_error";
        }
    }

    /**
     * The client transport went away. Internal signal that drives cleanup; never surfaced.
     */
    public static class ClientDisconnected extends GatewayException {
        public ClientDisconnected(String message, Throwable cause) {
            super(message, cause);
        }

        @Override
        public String code() {
            return "client_disconnected";
        }
    }
}
