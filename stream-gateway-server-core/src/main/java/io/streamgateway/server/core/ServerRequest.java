package io.streamgateway.server.core;

import io.streamgateway.core.Headers;
import io.streamgateway.core.Protocol;

import java.io.IOException;
import java.io.InputStream;
import java.net.URI;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * An incoming gateway request, detached from the HTTP server that received it.
 */
public final class ServerRequest {
    private final HttpMethod method;
    private final URI uri;
    private final Map<String, List<String>> headers;
    private final InputStream body; // null when the request has none

    public ServerRequest(HttpMethod method, URI uri, Map<String, List<String>> headers, InputStream body) {
        this.method = Objects.requireNonNull(method, "method");
        this.uri = Objects.requireNonNull(uri, "uri");
        this.headers = Objects.requireNonNull(headers, "headers");
        this.body = body;
    }

    public HttpMethod method() {
        return method;
    }

    public URI uri() {
        return uri;
    }

    /** Decoded request path, never {@code null}. */
    public String path() {
        String p = uri.getPath();
        return p == null || p.isEmpty() ? "/" : p;
    }

    public Map<String, List<String>> headers() {
        return headers;
    }

    /** First value of a header, matched case-insensitively. */
    public Optional<String> header(String name) {
        return Headers.firstValue(headers, name);
    }

    public Optional<String> contentType() {
        return header(Protocol.H_CONTENT_TYPE);
    }

    /**
     * Reads the whole body. Returns an empty array when there is none. The stream can be read once.
     */
    public byte[] bodyBytes() throws IOException {
        if (body == null) return new byte[0];
        return body.readAllBytes();
    }
}
