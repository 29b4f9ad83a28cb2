package io.streamgateway.http.spi;

/**
 * Abstraction for the HTTP client used to reach backend servers.
 *
 * <p>Lets backend connectors run on different HTTP client libraries (JDK HttpClient, OkHttp)
 * without a direct dependency on either.
 *
 * <p>Implementations must be thread-safe: one adapter is shared by every session's bridge task
 * and by concurrent forwarded calls.
 *
 * <p>Example usage:
 * <pre>{@code
 * HttpClientAdapter adapter = JdkHttpClientAdapter.create();
 * HttpClientRequest request = HttpClientRequest.get(URI.create("http://localhost:9001/stream")).build();
 * try (HttpClientResponse response = adapter.sendStreaming(request)) {
 *     ...
 * }
 * }</pre>
 */
public interface HttpClientAdapter {

    /**
     * Sends an HTTP request and reads the whole response body into memory.
     *
     * @param request the HTTP request to send
     * @return the HTTP response with body as bytes
     * @throws HttpClientException if the request fails
     * @throws HttpTimeoutException if the request times out
     */
    HttpClientResponse send(HttpClientRequest request) throws HttpClientException;

    /**
     * Sends an HTTP request and returns as soon as the response headers arrive.
     *
     * <p>The body is read incrementally through {@link HttpClientResponse#bodyAsStream()}. The
     * caller owns the response and must close it; closing may happen from another thread to
     * abort a blocked read.
     *
     * @param request the HTTP request to send
     * @return the HTTP response with body as InputStream
     * @throws HttpClientException if the request fails
     * @throws HttpTimeoutException if the request times out
     */
    HttpClientResponse sendStreaming(HttpClientRequest request) throws HttpClientException;
}
