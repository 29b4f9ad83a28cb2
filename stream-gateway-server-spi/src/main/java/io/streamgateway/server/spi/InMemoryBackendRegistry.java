package io.streamgateway.server.spi;

import io.streamgateway.core.Urls;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.net.URI;
import java.time.Clock;
import java.util.Collections;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.TreeMap;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * Reference in-memory {@link BackendRegistry} with register, unregister, and list.
 *
 * <p>State lives for the lifetime of the process; nothing is persisted.
 */
public final class InMemoryBackendRegistry implements ControlPlaneRegistry {

    private static final Logger log = LoggerFactory.getLogger(InMemoryBackendRegistry.class);

    private final Map<String, Registration> registrations = new ConcurrentHashMap<>();
    private final CopyOnWriteArrayList<RegistryListener> listeners = new CopyOnWriteArrayList<>();
    private final Clock clock;

    public InMemoryBackendRegistry() {
        this(Clock.systemUTC());
    }

    public InMemoryBackendRegistry(Clock clock) {
        this.clock = Objects.requireNonNull(clock, "clock");
    }

    /**
     * Registers {@code name} unless it is already taken. The base URL is stored without trailing slashes.
     */
    @Override
    public RegisterOutcome register(String name, URI baseUrl, Map<String, Object> meta) {
        Objects.requireNonNull(name, "name");
        Objects.requireNonNull(baseUrl, "baseUrl");
        if (name.isBlank()) throw new IllegalArgumentException("name must not be blank");
        if (baseUrl.getScheme() == null || baseUrl.getHost() == null) {
            throw new IllegalArgumentException("base_url must be an absolute URL: " + baseUrl);
        }

        Registration candidate = new Registration(
                name, URI.create(Urls.stripTrailingSlash(baseUrl.toString())), meta, clock.instant());
        Registration existing = registrations.putIfAbsent(name, candidate);
        if (existing != null) {
            return new RegisterOutcome(RegisterOutcome.Status.NAME_TAKEN, existing);
        }
        log.info("Registered backend {} at {}", name, candidate.backendAddress());
        return new RegisterOutcome(RegisterOutcome.Status.REGISTERED, candidate);
    }

    /**
     * Removes {@code name} and notifies listeners.
     *
     * @return the removed registration, or empty if the name was unknown
     */
    @Override
    public Optional<Registration> unregister(String name) {
        Registration removed = registrations.remove(name);
        if (removed == null) return Optional.empty();

        log.info("Unregistered backend {}", name);
        for (RegistryListener l : listeners) {
            try {
                l.unregistered(removed);
            } catch (RuntimeException e) {
                log.warn("Registry listener failed for {}", name, e);
            }
        }
        return Optional.of(removed);
    }

    @Override
    public Map<String, Registration> list() {
        return Collections.unmodifiableMap(new TreeMap<>(registrations));
    }

    @Override
    public Optional<Registration> resolve(String name) {
        if (name == null) return Optional.empty();
        return Optional.ofNullable(registrations.get(name));
    }

    @Override
    public void addListener(RegistryListener listener) {
        listeners.add(Objects.requireNonNull(listener, "listener"));
    }

    @Override
    public void removeListener(RegistryListener listener) {
        listeners.remove(listener);
    }
}
