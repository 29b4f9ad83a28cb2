package io.streamgateway.server.core;

/**
 * Point-in-time view of a live session.
 *
 * @param sessionId session id
 * @param backendName registry name the session was created for
 * @param state lifecycle state at snapshot time
 * @param attached whether a stream consumer is attached
 * @param buffered frames waiting in the buffer
 * @param capacity buffer capacity
 * @param dropped frames evicted from the buffer so far
 */
public record SessionInfo(String sessionId, String backendName, SessionState state, boolean attached,
                          int buffered, int capacity, long dropped) {

    static SessionInfo of(Session s) {
        return new SessionInfo(s.id(), s.backendName(), s.state(), s.isAttached(),
                s.buffer().size(), s.buffer().capacity(), s.buffer().dropCount());
    }
}
