package io.streamgateway.server.core;

import io.streamgateway.core.CloseReason;
import io.streamgateway.core.GatewayException;
import io.streamgateway.server.spi.BackendStream;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.net.URI;
import java.time.Instant;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.Future;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.Consumer;

/**
 * One client's logical connection to one backend.
 *
 * <p>The backend address is copied at creation and never re-resolved. Cancellation is a single
 * idempotent {@link #close(CloseReason)}: it records the reason (first one wins), closes the
 * buffer, releases the backend stream and interrupts the bridge. The bridge then calls
 * {@link #finish()}, which marks the session {@link SessionState#CLOSED} and removes it from its
 * table.
 */
public final class Session {

    private static final Logger log = LoggerFactory.getLogger(Session.class);

    private final String id;
    private final String backendName;
    private final URI backendAddress;
    private final Instant createdAt;
    private final EventBuffer buffer;
    private final BackendStream backend;
    private final Consumer<Session> onFinished;

    private final AtomicReference<SessionState> state = new AtomicReference<>(SessionState.CONNECTING);
    private final AtomicReference<CloseReason> closeReason = new AtomicReference<>();
    private final AtomicBoolean attached = new AtomicBoolean(false);
    private final AtomicBoolean released = new AtomicBoolean(false);
    private final AtomicBoolean bridgeClaimed = new AtomicBoolean(false);
    private final AtomicBoolean finished = new AtomicBoolean(false);
    private volatile Future<?> bridge;
    private volatile Instant lastBackendActivity;
    private volatile GatewayException failure;

    Session(String id, String backendName, URI backendAddress, Instant createdAt, EventBuffer buffer,
            BackendStream backend, Consumer<Session> onFinished) {
        this.id = Objects.requireNonNull(id, "id");
        this.backendName = Objects.requireNonNull(backendName, "backendName");
        this.backendAddress = Objects.requireNonNull(backendAddress, "backendAddress");
        this.createdAt = Objects.requireNonNull(createdAt, "createdAt");
        this.buffer = Objects.requireNonNull(buffer, "buffer");
        this.backend = Objects.requireNonNull(backend, "backend");
        this.onFinished = Objects.requireNonNull(onFinished, "onFinished");
        this.lastBackendActivity = createdAt;
    }

    public String id() {
        return id;
    }

    public String backendName() {
        return backendName;
    }

    public URI backendAddress() {
        return backendAddress;
    }

    public Instant createdAt() {
        return createdAt;
    }

    public EventBuffer buffer() {
        return buffer;
    }

    public SessionState state() {
        return state.get();
    }

    public Optional<CloseReason> closeReason() {
        return Optional.ofNullable(closeReason.get());
    }

    /** The backend failure that ended the session, if any. */
    public Optional<GatewayException> failure() {
        return Optional.ofNullable(failure);
    }

    public boolean isCancelled() {
        return closeReason.get() != null;
    }

    public boolean isAttached() {
        return attached.get();
    }

    Instant lastBackendActivity() {
        return lastBackendActivity;
    }

    void touch(Instant now) {
        lastBackendActivity = now;
    }

    BackendStream backend() {
        return backend;
    }

    void bridge(Future<?> future) {
        this.bridge = future;
        // close() may have run before the future existed
        if (isCancelled()) future.cancel(true);
    }

    /**
     * Claims the right to run the bridge. Fails if the session was closed before the bridge
     * started, in which case {@link #close(CloseReason)} has already finished the session.
     */
    boolean claimBridge() {
        return bridgeClaimed.compareAndSet(false, true);
    }

    void recordFailure(GatewayException e) {
        this.failure = e;
    }

    /**
     * Claims the single stream consumer slot.
     *
     * @throws GatewayException.SessionBusy if a consumer is already attached
     */
    void attach() {
        if (!attached.compareAndSet(false, true)) {
            throw new GatewayException.SessionBusy(id);
        }
    }

    boolean markStreaming() {
        return state.compareAndSet(SessionState.CONNECTING, SessionState.STREAMING);
    }

    /**
     * Starts closing the session. Safe to call from any thread, any number of times.
     *
     * @return {@code true} if this call recorded the close reason
     */
    public boolean close(CloseReason reason) {
        return close(reason, true);
    }

    boolean close(CloseReason reason, boolean interruptBridge) {
        Objects.requireNonNull(reason, "reason");
        boolean first = closeReason.compareAndSet(null, reason);
        state.updateAndGet(s -> s == SessionState.CLOSED ? s : SessionState.CLOSING);
        buffer.close(closeReason.get());
        if (reason == CloseReason.CLIENT_CANCEL) buffer.clear();
        releaseBackend();
        if (first) log.debug("Session {} closing: {}", id, reason.wireName());
        if (claimBridge()) {
            // bridge never started, nobody else will finish
            finish();
        } else if (interruptBridge) {
            Future<?> f = bridge;
            if (f != null) f.cancel(true);
        }
        return first;
    }

    /**
     * Releases the backend stream. Only the first call reaches the stream.
     */
    void releaseBackend() {
        if (released.compareAndSet(false, true)) {
            try {
                backend.close();
            } catch (RuntimeException e) {
                log.warn("Releasing backend stream of session {} failed", id, e);
            }
        }
    }

    /**
     * Terminal transition. Called by the bridge after it released the backend, or by
     * {@link #close(CloseReason)} when no bridge ever ran. Idempotent.
     */
    void finish() {
        if (!finished.compareAndSet(false, true)) return;
        // leave the table before CLOSED becomes visible
        onFinished.accept(this);
        state.set(SessionState.CLOSED);
        log.info("Session {} to {} closed ({}, dropped {})",
                id, backendName, closeReason().map(CloseReason::wireName).orElse("unknown"), buffer.dropCount());
    }

    @Override
    public String toString() {
        return "Session{" + id + ", " + backendName + ", " + state.get() + "}";
    }
}
