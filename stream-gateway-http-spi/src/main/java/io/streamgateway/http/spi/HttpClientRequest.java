package io.streamgateway.http.spi;

import java.net.URI;
import java.time.Duration;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Immutable request handed to an {@link HttpClientAdapter}.
 *
 * <p>Only the two shapes the gateway needs exist: a bodiless {@code GET} that opens a backend
 * stream and a {@code POST} carrying a call payload.
 */
public final class HttpClientRequest {

    private static final String CONTENT_TYPE = "Content-Type";

    private final URI uri;
    private final String method;
    private final Map<String, String> headers;
    private final byte[] body;
    private final Duration timeout;

    private HttpClientRequest(Builder b) {
        this.uri = b.uri;
        this.method = b.method;
        this.headers = Collections.unmodifiableMap(new LinkedHashMap<>(b.headers));
        this.body = b.body;
        this.timeout = b.timeout;
    }

    public static Builder get(URI uri) {
        return new Builder(uri, "GET");
    }

    public static Builder post(URI uri) {
        return new Builder(uri, "POST");
    }

    public URI uri() {
        return uri;
    }

    public String method() {
        return method;
    }

    /** Request headers in insertion order. */
    public Map<String, String> headers() {
        return headers;
    }

    /** Payload bytes, or {@code null} for a bodiless request. */
    public byte[] body() {
        return body;
    }

    public String contentType() {
        return headers.get(CONTENT_TYPE);
    }

    /** Upper bound for the wait on response headers (streams) or the whole exchange (calls). */
    public Duration timeout() {
        return timeout;
    }

    /** {@code METHOD uri}, used in log lines and error messages. */
    public String target() {
        return method + " " + uri;
    }

    @Override
    public String toString() {
        return target();
    }

    public static final class Builder {
        private final URI uri;
        private final String method;
        private final Map<String, String> headers = new LinkedHashMap<>();
        private byte[] body;
        private Duration timeout;

        private Builder(URI uri, String method) {
            this.uri = Objects.requireNonNull(uri, "uri");
            this.method = method;
        }

        public Builder header(String name, String value) {
            if (name == null || name.isBlank()) throw new IllegalArgumentException("header name required");
            headers.put(name, Objects.requireNonNull(value, name));
            return this;
        }

        /** Sets the payload; a {@code null} content type leaves the header unset. */
        public Builder body(byte[] body, String contentType) {
            if ("GET".equals(method)) throw new IllegalStateException("GET requests carry no body");
            this.body = Objects.requireNonNull(body, "body");
            if (contentType != null) header(CONTENT_TYPE, contentType);
            return this;
        }

        public Builder timeout(Duration timeout) {
            if (timeout != null && (timeout.isZero() || timeout.isNegative())) {
                throw new IllegalArgumentException("timeout must be positive: " + timeout);
            }
            this.timeout = timeout;
            return this;
        }

        public HttpClientRequest build() {
            return new HttpClientRequest(this);
        }
    }
}
