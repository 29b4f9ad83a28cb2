package io.streamgateway.http.spi;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.net.http.HttpClient;
import java.net.http.HttpHeaders;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * {@link HttpClientAdapter} on the JDK {@link HttpClient}. The default client of the gateway.
 *
 * <p>Backend streams use HTTP/1.1: one connection per session, closed with the session.
 */
public final class JdkHttpClientAdapter implements HttpClientAdapter {

    private final HttpClient httpClient;

    public JdkHttpClientAdapter(HttpClient httpClient) {
        this.httpClient = Objects.requireNonNull(httpClient, "httpClient");
    }

    public static JdkHttpClientAdapter create() {
        return create(Duration.ofSeconds(5));
    }

    /**
     * @param connectTimeout how long to wait for the TCP connection to a backend
     */
    public static JdkHttpClientAdapter create(Duration connectTimeout) {
        return new JdkHttpClientAdapter(HttpClient.newBuilder()
                .version(HttpClient.Version.HTTP_1_1)
                .connectTimeout(connectTimeout)
                .followRedirects(HttpClient.Redirect.NEVER)
                .build());
    }

    @Override
    public HttpClientResponse send(HttpClientRequest request) throws HttpClientException {
        HttpResponse<byte[]> response = exchange(request, HttpResponse.BodyHandlers.ofByteArray());
        return new Buffered(response.statusCode(), response.headers(), response.body());
    }

    @Override
    public HttpClientResponse sendStreaming(HttpClientRequest request) throws HttpClientException {
        HttpResponse<InputStream> response = exchange(request, HttpResponse.BodyHandlers.ofInputStream());
        return new Streaming(response);
    }

    private <T> HttpResponse<T> exchange(HttpClientRequest request, HttpResponse.BodyHandler<T> handler)
            throws HttpClientException {
        try {
            return httpClient.send(toJdkRequest(request), handler);
        } catch (java.net.http.HttpTimeoutException e) {
            throw new HttpTimeoutException(request, e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new HttpClientException(request, "interrupted", e);
        } catch (IOException | IllegalArgumentException e) {
            throw new HttpClientException(request, e);
        }
    }

    private static HttpRequest toJdkRequest(HttpClientRequest request) {
        HttpRequest.BodyPublisher body = request.body() == null
                ? HttpRequest.BodyPublishers.noBody()
                : HttpRequest.BodyPublishers.ofByteArray(request.body());
        HttpRequest.Builder builder = HttpRequest.newBuilder(request.uri()).method(request.method(), body);
        request.headers().forEach(builder::header);
        if (request.timeout() != null) builder.timeout(request.timeout());
        return builder.build();
    }

    private static final class Buffered implements HttpClientResponse {
        private final int status;
        private final HttpHeaders headers;
        private final byte[] body;

        private Buffered(int status, HttpHeaders headers, byte[] body) {
            this.status = status;
            this.headers = headers;
            this.body = body;
        }

        @Override
        public int statusCode() {
            return status;
        }

        @Override
        public Optional<String> header(String name) {
            return headers.firstValue(name);
        }

        @Override
        public byte[] body() {
            return body;
        }

        @Override
        public InputStream bodyAsStream() {
            return null;
        }
    }

    private static final class Streaming implements HttpClientResponse {
        private final HttpResponse<InputStream> response;
        private final AtomicBoolean closed = new AtomicBoolean(false);

        private Streaming(HttpResponse<InputStream> response) {
            this.response = response;
        }

        @Override
        public int statusCode() {
            return response.statusCode();
        }

        @Override
        public Optional<String> header(String name) {
            return response.headers().firstValue(name);
        }

        @Override
        public byte[] body() {
            return null;
        }

        @Override
        public InputStream bodyAsStream() {
            return response.body();
        }

        @Override
        public void close() {
            if (!closed.compareAndSet(false, true)) return;
            try {
                response.body().close();
            } catch (IOException e) {
                throw new UncheckedIOException("closing " + response.uri() + " failed", e);
            }
        }
    }
}
