package io.streamgateway.server.spi;

import java.util.Optional;

/**
 * Name to backend address lookup, as seen by the data plane.
 *
 * <p>The session engine resolves a name exactly once, when a session is created, and never
 * again for that session's lifetime.
 */
public interface BackendRegistry {

    /**
     * @return the registration for {@code name}, or empty if no backend is registered under it
     */
    Optional<Registration> resolve(String name);

    /**
     * Subscribes to unregister events. Default: events are not supported and the listener is ignored.
     */
    default void addListener(RegistryListener listener) {
    }

    /**
     * Stops delivering events to a listener added with {@link #addListener}. Unknown listeners
     * are ignored.
     */
    default void removeListener(RegistryListener listener) {
    }
}
