package io.streamgateway.server.core;

import io.streamgateway.core.CloseReason;
import io.streamgateway.core.GatewayException;
import io.streamgateway.server.spi.BackendConnector;
import io.streamgateway.server.spi.BackendRegistry;
import io.streamgateway.server.spi.Registration;
import io.streamgateway.server.spi.RegistryListener;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.util.Objects;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.TimeUnit;

/**
 * The data plane: connect, attach a stream, and call, on top of a {@link SessionTable}.
 *
 * <p>Unregistering a backend from the registry closes its live sessions with
 * {@code backend-unregistered}.
 *
 * <pre>{@code
 * Gateway gateway = Gateway.builder(registry, HttpBackendConnector.create())
 *     .heartbeatInterval(Duration.ofSeconds(15))
 *     .bufferCapacity(100)
 *     .build();
 * Session session = gateway.connect("math1");
 * }</pre>
 */
public final class Gateway implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(Gateway.class);

    private final BackendRegistry registry;
    private final SessionTable sessions;
    private final RequestForwarder forwarder;
    private final Duration heartbeatInterval;
    private final ExecutorService publisherExecutor;
    private final RegistryListener unregisterListener;

    public static Builder builder(BackendRegistry registry, BackendConnector connector) {
        return new Builder(registry, connector);
    }

    private Gateway(Builder builder) {
        this.registry = Objects.requireNonNull(builder.registry, "registry");
        this.heartbeatInterval = builder.heartbeatInterval != null ? builder.heartbeatInterval : Duration.ofSeconds(15);
        this.sessions = SessionTable.builder(builder.connector)
                .bufferCapacity(builder.bufferCapacity)
                .backendIdleTimeout(builder.backendIdleTimeout)
                .clock(builder.clock)
                .build();
        this.forwarder = new RequestForwarder(sessions, builder.connector);
        this.publisherExecutor = GatewayThreads.newExecutor("gateway-stream");
        this.unregisterListener = r -> sessions.closeByBackend(r.name(), CloseReason.BACKEND_UNREGISTERED);
        registry.addListener(unregisterListener);
    }

    /**
     * Builder for {@link Gateway}.
     */
    public static final class Builder {
        private final BackendRegistry registry;
        private final BackendConnector connector;
        private int bufferCapacity;
        private Duration heartbeatInterval;
        private Duration backendIdleTimeout;
        private Clock clock;

        private Builder(BackendRegistry registry, BackendConnector connector) {
            this.registry = Objects.requireNonNull(registry, "registry");
            this.connector = Objects.requireNonNull(connector, "connector");
        }

        /** Sets the per-session event buffer capacity. Default: 100 frames. */
        public Builder bufferCapacity(int bufferCapacity) {
            this.bufferCapacity = bufferCapacity;
            return this;
        }

        /** Sets the idle time after which an attached stream gets a heartbeat. Default: 15 seconds. */
        public Builder heartbeatInterval(Duration heartbeatInterval) {
            this.heartbeatInterval = heartbeatInterval;
            return this;
        }

        /** Sets the backend silence limit. Default: 30 seconds; {@link Duration#ZERO} disables it. */
        public Builder backendIdleTimeout(Duration backendIdleTimeout) {
            this.backendIdleTimeout = backendIdleTimeout;
            return this;
        }

        /** Sets the clock for time-based operations. Default: system UTC. */
        public Builder clock(Clock clock) {
            this.clock = clock;
            return this;
        }

        public Gateway build() {
            return new Gateway(this);
        }
    }

    /**
     * Resolves {@code backendName} once and opens a session to it.
     *
     * @throws GatewayException.NameNotFound if the name is not registered
     * @throws GatewayException.BackendUnreachable if the backend stream cannot be opened
     */
    public Session connect(String backendName) {
        Registration registration = registry.resolve(backendName)
                .orElseThrow(() -> new GatewayException.NameNotFound(backendName));
        return sessions.create(registration.name(), registration.backendAddress());
    }

    /**
     * Attaches the single stream consumer of a session.
     *
     * @throws GatewayException.SessionNotFound if the session is unknown or closed
     * @throws GatewayException.SessionBusy if a consumer is already attached
     */
    public StreamPublisher attachStream(String sessionId) {
        Session session = sessions.require(sessionId);
        session.attach();
        return new StreamPublisher(session, heartbeatInterval, publisherExecutor);
    }

    /**
     * Forwards one call to the backend of a session.
     *
     * @see RequestForwarder#forward(String, String, byte[], String)
     */
    public CallResult call(String sessionId, String method, byte[] payload, String contentType) {
        return forwarder.forward(sessionId, method, payload, contentType);
    }

    public BackendRegistry registry() {
        return registry;
    }

    public SessionTable sessions() {
        return sessions;
    }

    /**
     * Cancels every session and stops all gateway threads.
     */
    @Override
    public void close() {
        registry.removeListener(unregisterListener);
        sessions.close();
        publisherExecutor.shutdown();
        try {
            if (!publisherExecutor.awaitTermination(5, TimeUnit.SECONDS)) {
                publisherExecutor.shutdownNow();
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            publisherExecutor.shutdownNow();
        }
        log.info("Gateway stopped");
    }
}
