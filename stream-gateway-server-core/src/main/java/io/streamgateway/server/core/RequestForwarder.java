package io.streamgateway.server.core;

import io.streamgateway.core.GatewayException;
import io.streamgateway.server.spi.BackendConnector;
import io.streamgateway.server.spi.CallOutcome;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;
import java.util.regex.Pattern;

/**
 * Sends request/response calls to the backend of a session.
 *
 * <p>Calls run on the caller's thread and never touch the session's stream, buffer, or state.
 * Concurrent calls on one session are not ordered.
 */
public final class RequestForwarder {

    private static final Logger log = LoggerFactory.getLogger(RequestForwarder.class);
    private static final Pattern METHOD_NAME = Pattern.compile("[A-Za-z0-9_.\\-]+");

    private final SessionTable sessions;
    private final BackendConnector connector;

    public RequestForwarder(SessionTable sessions, BackendConnector connector) {
        this.sessions = Objects.requireNonNull(sessions, "sessions");
        this.connector = Objects.requireNonNull(connector, "connector");
    }

    /**
     * @throws GatewayException.SessionNotFound if the session is unknown or closed
     * @throws GatewayException.BackendCallError if the backend answered with an error
     * @throws GatewayException.BackendUnreachable if the call could not be delivered
     * @throws IllegalArgumentException if {@code method} is not a plain method name
     */
    public CallResult forward(String sessionId, String method, byte[] payload, String contentType) {
        Session session = sessions.require(sessionId);
        if (method == null || !METHOD_NAME.matcher(method).matches()) {
            throw new IllegalArgumentException("invalid method name: " + method);
        }

        CallOutcome out = connector.call(session.backendAddress(), method, payload, contentType);
        if (out.status() == CallOutcome.Status.ERROR) {
            log.debug("Call {} on session {} failed: HTTP {} {}", method, sessionId, out.httpStatus(), out.errorCode());
            throw new GatewayException.BackendCallError(out.httpStatus(), out.errorCode(), out.errorMessage());
        }
        return new CallResult(out.httpStatus(), out.body(), out.contentType());
    }
}
