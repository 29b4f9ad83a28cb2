package io.streamgateway.server.core;

import io.streamgateway.core.CloseReason;
import io.streamgateway.core.GatewayException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.Objects;
import java.util.concurrent.Executor;
import java.util.concurrent.Flow;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Drains one session's event buffer to one client as SSE frames.
 *
 * <p>Frames go out in FIFO order. When the buffer stays empty for the heartbeat interval a
 * heartbeat comment is emitted; the timer restarts on every dequeue. When the buffer ends, a final
 * {@code end} frame with the close reason is emitted and the subscriber completes.
 *
 * <p>A cancelled subscription or a subscriber that throws from {@code onNext} counts as a client
 * disconnect: the session is closed with {@code client-cancel} at once and the publisher stops.
 */
public final class StreamPublisher implements Flow.Publisher<SseFrame> {

    private static final Logger log = LoggerFactory.getLogger(StreamPublisher.class);

    private final Session session;
    private final Duration heartbeatInterval;
    private final Executor executor;
    private final AtomicBoolean subscribed = new AtomicBoolean(false);

    StreamPublisher(Session session, Duration heartbeatInterval, Executor executor) {
        this.session = Objects.requireNonNull(session, "session");
        this.heartbeatInterval = Objects.requireNonNull(heartbeatInterval, "heartbeatInterval");
        this.executor = Objects.requireNonNull(executor, "executor");
        if (heartbeatInterval.isZero() || heartbeatInterval.isNegative()) {
            throw new IllegalArgumentException("heartbeatInterval must be positive");
        }
    }

    public Session session() {
        return session;
    }

    /**
     * Gives up the stream before anyone subscribed, e.g. because the client connection failed
     * while the response was being set up. Closes the session with {@code client-cancel}. No-op
     * once a subscriber exists.
     *
     * @return {@code true} if this call closed the session
     */
    public boolean abandon() {
        if (!subscribed.compareAndSet(false, true)) return false;
        log.debug("Stream of session {} abandoned before subscription", session.id());
        return session.close(CloseReason.CLIENT_CANCEL);
    }

    @Override
    public void subscribe(Flow.Subscriber<? super SseFrame> subscriber) {
        Objects.requireNonNull(subscriber, "subscriber");
        if (!subscribed.compareAndSet(false, true)) {
            subscriber.onSubscribe(new NoopSubscription());
            subscriber.onError(new GatewayException.SessionBusy(session.id()));
            return;
        }
        Sub sub = new Sub(subscriber);
        subscriber.onSubscribe(sub);
        executor.execute(sub);
    }

    private final class Sub implements Flow.Subscription, Runnable {
        private final Flow.Subscriber<? super SseFrame> sub;
        private final AtomicBoolean cancelled = new AtomicBoolean(false);
        private volatile long demand;

        Sub(Flow.Subscriber<? super SseFrame> sub) {
            this.sub = sub;
        }

        @Override
        public void request(long n) {
            if (n <= 0) {
                cancel();
                sub.onError(new IllegalArgumentException("non-positive request: " + n));
                return;
            }
            synchronized (this) {
                long d = demand + n;
                demand = d < 0 ? Long.MAX_VALUE : d;
            }
        }

        @Override
        public void cancel() {
            if (cancelled.compareAndSet(false, true)) {
                log.debug("Stream consumer of session {} cancelled", session.id());
                session.close(CloseReason.CLIENT_CANCEL);
            }
        }

        @Override
        public void run() {
            try {
                while (!cancelled.get()) {
                    if (demand <= 0) {
                        Thread.sleep(5);
                        continue;
                    }

                    EventBuffer.Read read = session.buffer().poll(heartbeatInterval);
                    if (cancelled.get()) return;

                    if (read instanceof EventBuffer.Read.Frame frame) {
                        emit(SseFrame.data(frame.payload()));
                    } else if (read instanceof EventBuffer.Read.Idle) {
                        emit(SseFrame.heartbeat());
                    } else if (read instanceof EventBuffer.Read.End end) {
                        emit(SseFrame.end(end.reason()));
                        cancelled.set(true);
                        sub.onComplete();
                        return;
                    }
                }
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                disconnected(new GatewayException.ClientDisconnected("stream publisher interrupted", e));
            } catch (RuntimeException e) {
                disconnected(new GatewayException.ClientDisconnected("stream consumer failed", e));
            }
        }

        private void emit(SseFrame frame) {
            sub.onNext(frame);
            synchronized (this) {
                if (demand != Long.MAX_VALUE) demand--;
            }
        }

        private void disconnected(GatewayException.ClientDisconnected e) {
            log.debug("Session {}: {}", session.id(), e.getMessage(), e);
            cancel();
        }
    }

    private static final class NoopSubscription implements Flow.Subscription {
        @Override
        public void request(long n) {
        }

        @Override
        public void cancel() {
        }
    }
}
