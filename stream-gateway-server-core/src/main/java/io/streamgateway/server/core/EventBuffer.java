package io.streamgateway.server.core;

import io.streamgateway.core.CloseReason;

import java.time.Duration;
import java.util.ArrayDeque;
import java.util.Objects;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.locks.Condition;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Bounded FIFO of backend frames between one writer (the bridge) and at most one reader (the
 * stream publisher).
 *
 * <p>On overflow the oldest frame is dropped and {@link #dropCount()} increments; the writer never
 * blocks. After {@link #close(CloseReason)} the reader still drains what is buffered and then sees
 * {@link Read.End}.
 */
public final class EventBuffer {

    public static final int DEFAULT_CAPACITY = 100;

    /**
     * Outcome of a {@link #poll(Duration)}.
     */
    public sealed interface Read permits Read.Frame, Read.Idle, Read.End {

        record Frame(byte[] payload) implements Read {}

        /** Nothing arrived within the timeout. */
        record Idle() implements Read {}

        /** The buffer is closed and fully drained. */
        record End(CloseReason reason) implements Read {}
    }

    private static final Read IDLE = new Read.Idle();

    private final int capacity;
    private final ArrayDeque<byte[]> frames;
    private final ReentrantLock lock = new ReentrantLock();
    private final Condition changed = lock.newCondition();
    private long dropped;
    private CloseReason closedWith;

    public EventBuffer(int capacity) {
        if (capacity <= 0) throw new IllegalArgumentException("capacity must be > 0");
        this.capacity = capacity;
        this.frames = new ArrayDeque<>(Math.min(capacity, 1024));
    }

    /**
     * Appends a frame, evicting the oldest one if full.
     *
     * @return {@code false} if the buffer is closed and the frame was discarded
     */
    public boolean offer(byte[] frame) {
        Objects.requireNonNull(frame, "frame");
        lock.lock();
        try {
            if (closedWith != null) return false;
            if (frames.size() == capacity) {
                frames.pollFirst();
                dropped++;
            }
            frames.addLast(frame);
            changed.signalAll();
            return true;
        } finally {
            lock.unlock();
        }
    }

    /**
     * Waits up to {@code timeout} for the next frame.
     */
    public Read poll(Duration timeout) throws InterruptedException {
        long remaining = timeout.toNanos();
        lock.lockInterruptibly();
        try {
            while (true) {
                byte[] next = frames.pollFirst();
                if (next != null) return new Read.Frame(next);
                if (closedWith != null) return new Read.End(closedWith);
                if (remaining <= 0) return IDLE;
                remaining = changed.awaitNanos(remaining);
            }
        } finally {
            lock.unlock();
        }
    }

    /**
     * Closes the buffer. Later offers are discarded; the first reason wins.
     *
     * @return {@code true} if this call closed the buffer
     */
    public boolean close(CloseReason reason) {
        Objects.requireNonNull(reason, "reason");
        lock.lock();
        try {
            if (closedWith != null) return false;
            closedWith = reason;
            changed.signalAll();
            return true;
        } finally {
            lock.unlock();
        }
    }

    /**
     * Discards buffered frames without closing. Used when the reader is gone for good.
     */
    void clear() {
        lock.lock();
        try {
            frames.clear();
        } finally {
            lock.unlock();
        }
    }

    public long dropCount() {
        lock.lock();
        try {
            return dropped;
        } finally {
            lock.unlock();
        }
    }

    public int size() {
        lock.lock();
        try {
            return frames.size();
        } finally {
            lock.unlock();
        }
    }

    public int capacity() {
        return capacity;
    }

}
