package io.streamgateway.server.core;

import io.streamgateway.core.CloseReason;
import io.streamgateway.core.GatewayException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.time.Clock;
import java.util.Objects;

/**
 * Pumps frames from a session's backend stream into its event buffer.
 *
 * <p>Ends on a clean backend finish ({@code backend-complete}), a read failure
 * ({@code backend-error}), or cancellation (whatever reason the canceller recorded). On every
 * path it releases the backend stream, then finishes the session. No retries.
 */
final class BridgeTask implements Runnable {

    private static final Logger log = LoggerFactory.getLogger(BridgeTask.class);

    private final Session session;
    private final Clock clock;

    BridgeTask(Session session, Clock clock) {
        this.session = Objects.requireNonNull(session, "session");
        this.clock = Objects.requireNonNull(clock, "clock");
    }

    @Override
    public void run() {
        if (!session.claimBridge()) return;
        CloseReason outcome = CloseReason.CLIENT_CANCEL;
        try {
            if (session.markStreaming()) {
                log.debug("Bridge for session {} streaming from {}", session.id(), session.backendAddress());
            }
            while (!session.isCancelled()) {
                byte[] frame = session.backend().nextFrame();
                if (frame == null) {
                    outcome = CloseReason.BACKEND_COMPLETE;
                    break;
                }
                session.touch(clock.instant());
                session.buffer().offer(frame);
            }
        } catch (IOException | GatewayException.BackendStreamError e) {
            if (!session.isCancelled()) {
                GatewayException failure = e instanceof GatewayException.BackendStreamError bse
                        ? bse
                        : new GatewayException.BackendStreamError("backend stream failed: " + e.getMessage(), e);
                session.recordFailure(failure);
                log.warn("Backend stream of session {} ({}) failed", session.id(), session.backendName(), failure);
                outcome = CloseReason.BACKEND_ERROR;
            }
        } catch (RuntimeException e) {
            log.error("Bridge for session {} failed", session.id(), e);
            outcome = CloseReason.BACKEND_ERROR;
        } finally {
            // no-op when a canceller already recorded its reason
            session.close(outcome, false);
            session.releaseBackend();
            session.finish();
        }
    }
}
