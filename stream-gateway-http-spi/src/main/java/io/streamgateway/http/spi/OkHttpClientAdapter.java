package io.streamgateway.http.spi;

import okhttp3.Call;
import okhttp3.MediaType;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.RequestBody;
import okhttp3.Response;
import okhttp3.ResponseBody;

import java.io.IOException;
import java.io.InputStream;
import java.io.InterruptedIOException;
import java.time.Duration;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * {@link HttpClientAdapter} on OkHttp ({@code com.squareup.okhttp3:okhttp}).
 *
 * <p>Calls are bounded by the request timeout end to end. Streams only bound the connect phase,
 * since a backend stream may stay quiet for long stretches and the gateway watches idleness
 * itself. Closing a streaming response cancels its call, which unblocks a reader parked on the
 * body.
 */
public final class OkHttpClientAdapter implements HttpClientAdapter {

    private final OkHttpClient httpClient;

    public OkHttpClientAdapter(OkHttpClient httpClient) {
        this.httpClient = Objects.requireNonNull(httpClient, "httpClient");
    }

    public static OkHttpClientAdapter create() {
        return new OkHttpClientAdapter(new OkHttpClient.Builder()
                .readTimeout(Duration.ZERO)
                .build());
    }

    public static OkHttpClientAdapter create(OkHttpClient httpClient) {
        return new OkHttpClientAdapter(httpClient);
    }

    @Override
    public HttpClientResponse send(HttpClientRequest request) throws HttpClientException {
        OkHttpClient client = httpClient;
        if (request.timeout() != null) {
            client = httpClient.newBuilder()
                    .callTimeout(request.timeout())
                    .readTimeout(request.timeout())
                    .build();
        }
        Response response = execute(client.newCall(toOkHttpRequest(request)), request);
        try (response) {
            ResponseBody body = response.body();
            return new Buffered(response.code(), response.headers(), body != null ? body.bytes() : new byte[0]);
        } catch (IOException e) {
            throw new HttpClientException(request, "reading response body failed", e);
        }
    }

    @Override
    public HttpClientResponse sendStreaming(HttpClientRequest request) throws HttpClientException {
        OkHttpClient client = httpClient;
        if (request.timeout() != null) {
            client = httpClient.newBuilder().connectTimeout(request.timeout()).build();
        }
        Call call = client.newCall(toOkHttpRequest(request));
        return new Streaming(call, execute(call, request));
    }

    private static Response execute(Call call, HttpClientRequest request) throws HttpClientException {
        try {
            return call.execute();
        } catch (InterruptedIOException e) {
            // SocketTimeoutException and call timeouts both land here
            throw new HttpTimeoutException(request, e);
        } catch (IOException e) {
            throw new HttpClientException(request, e);
        }
    }

    private static Request toOkHttpRequest(HttpClientRequest request) {
        Request.Builder builder = new Request.Builder().url(request.uri().toString());
        request.headers().forEach(builder::header);
        if (request.body() == null && "GET".equals(request.method())) {
            return builder.get().build();
        }
        String contentType = request.contentType();
        byte[] bytes = request.body() != null ? request.body() : new byte[0];
        RequestBody body = RequestBody.create(bytes, contentType != null ? MediaType.parse(contentType) : null);
        return builder.method(request.method(), body).build();
    }

    private static final class Buffered implements HttpClientResponse {
        private final int status;
        private final okhttp3.Headers headers;
        private final byte[] body;

        private Buffered(int status, okhttp3.Headers headers, byte[] body) {
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
            return Optional.ofNullable(headers.get(name));
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
        private final Call call;
        private final Response response;
        private final AtomicBoolean closed = new AtomicBoolean(false);

        private Streaming(Call call, Response response) {
            this.call = call;
            this.response = response;
        }

        @Override
        public int statusCode() {
            return response.code();
        }

        @Override
        public Optional<String> header(String name) {
            return Optional.ofNullable(response.header(name));
        }

        @Override
        public byte[] body() {
            return null;
        }

        @Override
        public InputStream bodyAsStream() {
            ResponseBody body = response.body();
            return body != null ? body.byteStream() : null;
        }

        @Override
        public void close() {
            if (closed.compareAndSet(false, true)) {
                call.cancel();
                response.close();
            }
        }
    }
}
