package io.streamgateway.server.spi;

/**
 * Callback for control plane changes that affect live sessions.
 */
@FunctionalInterface
public interface RegistryListener {

    /**
     * Invoked after {@code registration} was removed from the registry.
     */
    void unregistered(Registration registration);
}
