package io.streamgateway.server.core;

import io.streamgateway.core.GatewayException;
import io.streamgateway.server.spi.BackendConnector;
import io.streamgateway.server.spi.BackendStream;
import io.streamgateway.server.spi.CallOutcome;

import java.io.IOException;
import java.net.URI;
import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * In-process backend: streams are fed by the test, calls answer from a scripted handler.
 */
final class FakeBackendConnector implements BackendConnector {

    interface CallHandler {
        CallOutcome handle(URI address, String method, byte[] payload);
    }

    final List<FakeStream> opened = new CopyOnWriteArrayList<>();
    final AtomicInteger calls = new AtomicInteger();
    volatile boolean refuseStreams;
    volatile CallHandler callHandler = (address, method, payload) ->
            CallOutcome.ok(200, ("{\"method\":\"" + method + "\"}").getBytes(StandardCharsets.UTF_8), "application/json");

    @Override
    public BackendStream openStream(URI backendAddress) {
        if (refuseStreams) throw new GatewayException.BackendUnreachable("connection refused: " + backendAddress);
        FakeStream stream = new FakeStream(backendAddress);
        opened.add(stream);
        return stream;
    }

    @Override
    public CallOutcome call(URI backendAddress, String method, byte[] payload, String contentType) {
        calls.incrementAndGet();
        return callHandler.handle(backendAddress, method, payload);
    }

    FakeStream lastStream() {
        return opened.get(opened.size() - 1);
    }

    static final class FakeStream implements BackendStream {
        private static final Object END = new Object();
        private static final Object FAIL = new Object();
        private static final Object CLOSED = new Object();

        final URI address;
        final AtomicInteger closeCalls = new AtomicInteger();
        private final LinkedBlockingQueue<Object> items = new LinkedBlockingQueue<>();

        FakeStream(URI address) {
            this.address = address;
        }

        void emit(String... frames) {
            for (String f : frames) items.add(f.getBytes(StandardCharsets.UTF_8));
        }

        void complete() {
            items.add(END);
        }

        void fail() {
            items.add(FAIL);
        }

        @Override
        public byte[] nextFrame() throws IOException {
            Object item;
            try {
                item = items.take();
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                throw new java.io.InterruptedIOException("interrupted");
            }
            if (item == END) return null;
            if (item == FAIL) throw new IOException("connection reset");
            if (item == CLOSED) throw new IOException("stream closed");
            return (byte[]) item;
        }

        @Override
        public void close() {
            closeCalls.incrementAndGet();
            items.add(CLOSED);
        }
    }
}
