package io.streamgateway.http.spi;

import java.io.Closeable;
import java.io.InputStream;
import java.util.Optional;

/**
 * Represents an HTTP response from an {@link HttpClientAdapter}.
 *
 * <p>Buffered responses expose {@link #body()}; streaming responses expose
 * {@link #bodyAsStream()}. Closing a streaming response releases the underlying connection and
 * is idempotent. Closing a buffered response is a no-op.
 */
public interface HttpClientResponse extends Closeable {

    /**
     * Returns the HTTP status code.
     * @return the status code (e.g., 200, 404, 500)
     */
    int statusCode();

    /**
     * Returns the first value for the specified header name.
     * @param name the header name (case-insensitive)
     * @return the header value, or empty if not present
     */
    Optional<String> header(String name);

    /**
     * Returns the response body as a byte array.
     * @return the body bytes, or null for streaming responses
     */
    byte[] body();

    /**
     * Returns the response body as an input stream.
     * @return the body stream, or null for buffered responses
     */
    InputStream bodyAsStream();

    @Override
    default void close() {
    }
}
