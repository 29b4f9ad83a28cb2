package io.streamgateway.server.core;

import io.streamgateway.core.CloseReason;
import io.streamgateway.core.GatewayException;
import io.streamgateway.server.spi.BackendConnector;
import io.streamgateway.server.spi.BackendStream;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.net.URI;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.Supplier;

/**
 * Registry of live sessions keyed by session id.
 *
 * <p>{@link #create(String, URI)} opens the backend stream on the caller's thread before a session
 * exists, so a failed connect leaves nothing behind. Sessions remove themselves once their bridge
 * has finished; {@link #remove(String)} is idempotent.
 *
 * <p>Use {@link #builder(BackendConnector)} to create instances:
 * <pre>{@code
 * SessionTable sessions = SessionTable.builder(connector)
 *     .bufferCapacity(100)
 *     .backendIdleTimeout(Duration.ofSeconds(30))
 *     .build();
 * }</pre>
 */
public final class SessionTable implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(SessionTable.class);

    private final Map<String, Session> sessions = new ConcurrentHashMap<>();
    private final BackendConnector connector;
    private final ExecutorService bridgeExecutor;
    private final boolean ownsExecutor;
    private final ScheduledExecutorService watchdog;
    private final int bufferCapacity;
    private final Duration backendIdleTimeout;
    private final Clock clock;
    private final Supplier<String> idGenerator;
    private final AtomicBoolean closed = new AtomicBoolean(false);

    public static Builder builder(BackendConnector connector) {
        return new Builder(connector);
    }

    private SessionTable(Builder builder) {
        this.connector = Objects.requireNonNull(builder.connector, "connector");
        this.bufferCapacity = builder.bufferCapacity > 0 ? builder.bufferCapacity : EventBuffer.DEFAULT_CAPACITY;
        this.backendIdleTimeout = builder.backendIdleTimeout != null ? builder.backendIdleTimeout : Duration.ofSeconds(30);
        this.clock = builder.clock != null ? builder.clock : Clock.systemUTC();
        this.idGenerator = builder.idGenerator != null ? builder.idGenerator : () -> UUID.randomUUID().toString();
        this.ownsExecutor = builder.executor == null;
        this.bridgeExecutor = ownsExecutor ? GatewayThreads.newExecutor("gateway-bridge") : builder.executor;

        if (backendIdleTimeout.isZero() || backendIdleTimeout.isNegative()) {
            this.watchdog = null;
        } else {
            this.watchdog = GatewayThreads.newScheduler("gateway-idle-watchdog");
            long period = Math.max(10, backendIdleTimeout.toMillis() / 4);
            watchdog.scheduleAtFixedRate(this::closeIdleSessions, period, period, TimeUnit.MILLISECONDS);
        }
    }

    /**
     * Builder for {@link SessionTable}.
     */
    public static final class Builder {
        private final BackendConnector connector;
        private int bufferCapacity;
        private Duration backendIdleTimeout;
        private Clock clock;
        private ExecutorService executor;
        private Supplier<String> idGenerator;

        private Builder(BackendConnector connector) {
            this.connector = Objects.requireNonNull(connector, "connector");
        }

        /** Sets the per-session event buffer capacity. Default: 100 frames. */
        public Builder bufferCapacity(int bufferCapacity) {
            this.bufferCapacity = bufferCapacity;
            return this;
        }

        /**
         * Sets how long a backend stream may stay silent before the session closes with
         * {@code backend-error}. Default: 30 seconds. {@link Duration#ZERO} disables the check.
         */
        public Builder backendIdleTimeout(Duration backendIdleTimeout) {
            this.backendIdleTimeout = backendIdleTimeout;
            return this;
        }

        /** Sets the clock used for idle tracking. Default: system UTC. */
        public Builder clock(Clock clock) {
            this.clock = clock;
            return this;
        }

        /**
         * Runs bridge tasks on the given executor. The table does not shut it down.
         * Default: a table-owned executor from {@link GatewayThreads}.
         */
        public Builder executor(ExecutorService executor) {
            this.executor = executor;
            return this;
        }

        /** Sets the session id source. Default: random UUIDs. */
        public Builder idGenerator(Supplier<String> idGenerator) {
            this.idGenerator = idGenerator;
            return this;
        }

        public SessionTable build() {
            return new SessionTable(this);
        }
    }

    /**
     * Opens the backend stream, registers a new session, and starts its bridge.
     *
     * @throws GatewayException.BackendUnreachable if the backend stream cannot be opened
     * @throws IllegalStateException if the table is closed
     */
    public Session create(String backendName, URI backendAddress) {
        Objects.requireNonNull(backendName, "backendName");
        Objects.requireNonNull(backendAddress, "backendAddress");
        if (closed.get()) throw new IllegalStateException("session table is closed");

        BackendStream stream = connector.openStream(backendAddress);
        Session session = null;
        try {
            Instant now = clock.instant();
            while (true) {
                Session candidate = new Session(idGenerator.get(), backendName, backendAddress, now,
                        new EventBuffer(bufferCapacity), stream, this::finished);
                if (sessions.putIfAbsent(candidate.id(), candidate) == null) {
                    session = candidate;
                    break;
                }
                log.warn("Session id clash on {}, retrying", candidate.id());
            }
            session.bridge(bridgeExecutor.submit(new BridgeTask(session, clock)));
        } catch (RejectedExecutionException e) {
            session.close(CloseReason.CLIENT_CANCEL);
            throw new IllegalStateException("session table is closed", e);
        } catch (RuntimeException e) {
            if (session != null) {
                session.close(CloseReason.CLIENT_CANCEL);
            } else {
                stream.close();
            }
            throw e;
        }
        log.info("Session {} opened to {} at {}", session.id(), backendName, backendAddress);
        return session;
    }

    public Optional<Session> lookup(String sessionId) {
        if (sessionId == null) return Optional.empty();
        return Optional.ofNullable(sessions.get(sessionId));
    }

    /**
     * @throws GatewayException.SessionNotFound if no live session has this id
     */
    public Session require(String sessionId) {
        return lookup(sessionId)
                .filter(s -> s.state() != SessionState.CLOSED)
                .orElseThrow(() -> new GatewayException.SessionNotFound(sessionId));
    }

    /**
     * Removes the entry without closing the session. Returns {@code false} if it was already gone.
     */
    public boolean remove(String sessionId) {
        if (sessionId == null) return false;
        return sessions.remove(sessionId) != null;
    }

    public int size() {
        return sessions.size();
    }

    /**
     * @return live sessions ordered by creation time
     */
    public List<SessionInfo> snapshot() {
        List<Session> live = new ArrayList<>(sessions.values());
        live.sort(Comparator.comparing(Session::createdAt).thenComparing(Session::id));
        List<SessionInfo> out = new ArrayList<>(live.size());
        for (Session s : live) out.add(SessionInfo.of(s));
        return out;
    }

    /**
     * Closes every session bound to {@code backendName}.
     *
     * @return number of sessions this call closed
     */
    public int closeByBackend(String backendName, CloseReason reason) {
        int n = 0;
        for (Session s : sessions.values()) {
            if (s.backendName().equals(backendName) && s.close(reason)) n++;
        }
        if (n > 0) log.info("Closed {} session(s) of {}: {}", n, backendName, reason.wireName());
        return n;
    }

    public int closeAll(CloseReason reason) {
        int n = 0;
        for (Session s : sessions.values()) {
            if (s.close(reason)) n++;
        }
        return n;
    }

    /**
     * Closes all sessions with {@code client-cancel} and stops the table's threads. Later
     * {@link #create} calls fail.
     */
    @Override
    public void close() {
        if (!closed.compareAndSet(false, true)) return;
        int n = closeAll(CloseReason.CLIENT_CANCEL);
        log.info("Session table closed, {} session(s) cancelled", n);
        if (watchdog != null) watchdog.shutdownNow();
        if (ownsExecutor) {
            bridgeExecutor.shutdown();
            try {
                if (!bridgeExecutor.awaitTermination(5, TimeUnit.SECONDS)) {
                    bridgeExecutor.shutdownNow();
                }
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                bridgeExecutor.shutdownNow();
            }
        }
    }

    private void finished(Session session) {
        sessions.remove(session.id(), session);
    }

    private void closeIdleSessions() {
        Instant now = clock.instant();
        for (Session s : sessions.values()) {
            if (s.state() != SessionState.STREAMING) continue;
            Duration silent = Duration.between(s.lastBackendActivity(), now);
            if (silent.compareTo(backendIdleTimeout) > 0 && s.close(CloseReason.BACKEND_ERROR)) {
                s.recordFailure(new GatewayException.BackendStreamError(
                        "backend silent for " + silent.toMillis() + " ms"));
                log.warn("Session {} to {} closed: backend idle for {} ms", s.id(), s.backendName(), silent.toMillis());
            }
        }
    }
}
