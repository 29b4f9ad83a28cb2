package io.streamgateway.core;

/**
 * Why a session left the streaming state. Carried by the terminal stream event.
 */
public enum CloseReason {
    /** The backend ended its stream cleanly. */
    BACKEND_COMPLETE("backend-complete"),
    /** The backend stream failed or went idle for longer than allowed. */
    BACKEND_ERROR("backend-error"),
    /** The client disconnected or the gateway cancelled the session. */
    CLIENT_CANCEL("client-cancel"),
    /** The backend was unregistered from the control plane. */
    BACKEND_UNREGISTERED("backend-unregistered");

    private final String wireName;

    CloseReason(String wireName) {
        this.wireName = wireName;
    }

    public String wireName() {
        return wireName;
    }
}
