package io.streamgateway.server.core;

/**
 * Session lifecycle. Transitions only move forward:
 * {@code CONNECTING -> STREAMING -> CLOSING -> CLOSED}, with {@code CONNECTING -> CLOSING} allowed
 * when a session is cancelled before its bridge starts.
 */
public enum SessionState {
    CONNECTING,
    STREAMING,
    CLOSING,
    CLOSED
}
