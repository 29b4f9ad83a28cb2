package io.streamgateway.server.spi;

import java.net.URI;
import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * A named backend known to the control plane.
 *
 * @param name unique registry key
 * @param backendAddress base URL of the backend, without trailing slash
 * @param meta free-form registration metadata
 * @param registeredAt registration time
 */
public record Registration(String name, URI backendAddress, Map<String, Object> meta, Instant registeredAt) {
    public Registration {
        Objects.requireNonNull(name, "name");
        Objects.requireNonNull(backendAddress, "backendAddress");
        Objects.requireNonNull(registeredAt, "registeredAt");
        meta = meta == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(meta));
    }
}
