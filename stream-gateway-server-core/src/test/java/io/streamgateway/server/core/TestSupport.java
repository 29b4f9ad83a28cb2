package io.streamgateway.server.core;

import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.Flow;
import java.util.function.BooleanSupplier;

final class TestSupport {
    private TestSupport() {
    }

    static void await(BooleanSupplier condition) throws InterruptedException {
        await(condition, Duration.ofSeconds(5));
    }

    static void await(BooleanSupplier condition, Duration timeout) throws InterruptedException {
        long deadline = System.nanoTime() + timeout.toNanos();
        while (!condition.getAsBoolean()) {
            if (System.nanoTime() > deadline) throw new AssertionError("condition not met within " + timeout);
            Thread.sleep(5);
        }
    }

    static byte[] utf8(String s) {
        return s.getBytes(StandardCharsets.UTF_8);
    }

    /**
     * Records every frame; unbounded demand.
     */
    static final class RecordingSubscriber implements Flow.Subscriber<SseFrame> {
        final List<SseFrame> frames = new CopyOnWriteArrayList<>();
        volatile Flow.Subscription subscription;
        volatile boolean completed;
        volatile Throwable error;

        @Override
        public void onSubscribe(Flow.Subscription subscription) {
            this.subscription = subscription;
            subscription.request(Long.MAX_VALUE);
        }

        @Override
        public void onNext(SseFrame item) {
            frames.add(item);
        }

        @Override
        public void onError(Throwable throwable) {
            this.error = throwable;
        }

        @Override
        public void onComplete() {
            this.completed = true;
        }

        boolean has(SseFrame.Kind kind) {
            return frames.stream().anyMatch(f -> f.kind() == kind);
        }

        List<String> data() {
            return frames.stream().filter(f -> f.kind() == SseFrame.Kind.DATA).map(SseFrame::data).toList();
        }
    }
}
