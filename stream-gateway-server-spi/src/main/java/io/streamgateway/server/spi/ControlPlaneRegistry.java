package io.streamgateway.server.spi;

import java.net.URI;
import java.util.Map;
import java.util.Optional;

/**
 * A {@link BackendRegistry} that can also be changed at runtime.
 */
public interface ControlPlaneRegistry extends BackendRegistry {

    RegisterOutcome register(String name, URI baseUrl, Map<String, Object> meta);

    /**
     * @return the removed registration, or empty if the name was unknown
     */
    Optional<Registration> unregister(String name);

    /**
     * @return a name-sorted snapshot of every registration
     */
    Map<String, Registration> list();
}
