package io.streamgateway.server.spi;

import java.io.IOException;

/**
 * An open streaming read from a backend.
 *
 * <p>Read by exactly one thread. {@link #close()} may be called from any thread, is idempotent,
 * and makes a blocked {@link #nextFrame()} fail or return promptly.
 */
public interface BackendStream extends AutoCloseable {

    /**
     * Blocks until the backend emits the next frame.
     *
     * @return the frame payload, or {@code null} when the backend ended the stream cleanly
     * @throws IOException if the stream failed or was closed underneath the reader
     */
    byte[] nextFrame() throws IOException;

    @Override
    void close();
}
