package io.streamgateway.server.core;

import io.streamgateway.core.GatewayException;
import io.streamgateway.core.Headers;
import io.streamgateway.core.Protocol;
import io.streamgateway.core.SseParser;
import io.streamgateway.core.Urls;
import io.streamgateway.http.spi.HttpClientAdapter;
import io.streamgateway.http.spi.HttpClientException;
import io.streamgateway.http.spi.HttpClientRequest;
import io.streamgateway.http.spi.HttpClientResponse;
import io.streamgateway.http.spi.HttpTimeoutException;
import io.streamgateway.http.spi.JdkHttpClientAdapter;
import io.streamgateway.json.spi.JsonCodec;
import io.streamgateway.json.spi.JsonCodecs;
import io.streamgateway.json.spi.JsonException;
import io.streamgateway.server.spi.BackendConnector;
import io.streamgateway.server.spi.BackendStream;
import io.streamgateway.server.spi.CallOutcome;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.net.URI;
import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * {@link BackendConnector} for HTTP backends.
 *
 * <p>Streams are {@code GET {address}{streamPath}} Server-Sent Events, one frame per {@code data:}
 * event. Calls are {@code POST {address}{callPathTemplate}} with {@code {method}} substituted;
 * a 4xx/5xx answer becomes a {@link CallOutcome.Status#ERROR} outcome with the backend's
 * {@code error}/{@code message}/{@code code} fields when its body is a JSON object.
 */
public final class HttpBackendConnector implements BackendConnector {

    private static final Logger log = LoggerFactory.getLogger(HttpBackendConnector.class);

    public static final String DEFAULT_STREAM_PATH = "/stream";
    public static final String DEFAULT_CALL_PATH_TEMPLATE = "/math/" + Protocol.METHOD_PLACEHOLDER;

    private final HttpClientAdapter http;
    private final JsonCodec json;
    private final String streamPath;
    private final Map<String, String> streamQuery;
    private final String callPathTemplate;
    private final Duration requestTimeout;

    public static HttpBackendConnector create() {
        return builder().build();
    }

    public static Builder builder() {
        return new Builder();
    }

    private HttpBackendConnector(Builder builder) {
        this.http = builder.http != null ? builder.http : JdkHttpClientAdapter.create();
        this.json = builder.json != null ? builder.json : JsonCodecs.load();
        this.streamPath = builder.streamPath != null ? builder.streamPath : DEFAULT_STREAM_PATH;
        this.streamQuery = Map.copyOf(builder.streamQuery);
        this.callPathTemplate = builder.callPathTemplate != null ? builder.callPathTemplate : DEFAULT_CALL_PATH_TEMPLATE;
        this.requestTimeout = builder.requestTimeout != null ? builder.requestTimeout : Duration.ofSeconds(30);
        if (!callPathTemplate.contains(Protocol.METHOD_PLACEHOLDER)) {
            throw new IllegalArgumentException("call path template must contain " + Protocol.METHOD_PLACEHOLDER);
        }
    }

    /**
     * Builder for {@link HttpBackendConnector}.
     */
    public static final class Builder {
        private HttpClientAdapter http;
        private JsonCodec json;
        private String streamPath;
        private final Map<String, String> streamQuery = new LinkedHashMap<>();
        private String callPathTemplate;
        private Duration requestTimeout;

        private Builder() {
        }

        /** Sets the HTTP client. Default: {@link JdkHttpClientAdapter#create()}. */
        public Builder httpClient(HttpClientAdapter http) {
            this.http = http;
            return this;
        }

        /** Sets the JSON codec used to read backend errors. Default: {@link JsonCodecs#load()}. */
        public Builder jsonCodec(JsonCodec json) {
            this.json = json;
            return this;
        }

        /** Sets the backend stream path. Default: {@code /stream}. */
        public Builder streamPath(String streamPath) {
            this.streamPath = streamPath;
            return this;
        }

        /** Adds a query parameter sent when opening backend streams, e.g. {@code n=50}. */
        public Builder streamQueryParam(String name, String value) {
            this.streamQuery.put(Objects.requireNonNull(name, "name"), Objects.requireNonNull(value, "value"));
            return this;
        }

        /** Sets the call path; must contain {@code {method}}. Default: {@code /math/{method}}. */
        public Builder callPathTemplate(String callPathTemplate) {
            this.callPathTemplate = callPathTemplate;
            return this;
        }

        /**
         * Bounds a call, and the wait for a stream's response headers. Default: 30 seconds.
         */
        public Builder requestTimeout(Duration requestTimeout) {
            this.requestTimeout = requestTimeout;
            return this;
        }

        public HttpBackendConnector build() {
            return new HttpBackendConnector(this);
        }
    }

    @Override
    public BackendStream openStream(URI backendAddress) {
        URI uri = Urls.withQuery(Urls.resolve(backendAddress, streamPath), streamQuery);
        HttpClientRequest request = HttpClientRequest.get(uri)
                .header(Protocol.H_ACCEPT, Protocol.CT_EVENT_STREAM)
                .timeout(requestTimeout)
                .build();

        HttpClientResponse response;
        try {
            response = http.sendStreaming(request);
        } catch (HttpTimeoutException e) {
            throw new GatewayException.BackendUnreachable("backend stream timed out: " + e.getMessage(), e);
        } catch (HttpClientException e) {
            throw new GatewayException.BackendUnreachable("cannot open backend stream: " + e.getMessage(), e);
        }

        int status = response.statusCode();
        InputStream body = response.bodyAsStream();
        if (status != 200 || body == null) {
            response.close();
            throw new GatewayException.BackendUnreachable("backend stream " + uri + " answered HTTP " + status);
        }
        String type = response.header(Protocol.H_CONTENT_TYPE).orElse(null);
        if (!Headers.isEventStream(type)) {
            log.warn("Backend stream {} answered with content type {}, reading it as SSE anyway", uri, type);
        }
        log.debug("Opened backend stream {}", uri);
        return new HttpBackendStream(uri, response, new SseParser(body));
    }

    @Override
    public CallOutcome call(URI backendAddress, String method, byte[] payload, String contentType) {
        String path = callPathTemplate.replace(Protocol.METHOD_PLACEHOLDER, URLEncoder.encode(method, StandardCharsets.UTF_8));
        URI uri = Urls.resolve(backendAddress, path);
        HttpClientRequest request = HttpClientRequest.post(uri)
                .header(Protocol.H_ACCEPT, Protocol.CT_JSON)
                .body(payload == null ? new byte[0] : payload, contentType != null ? contentType : Protocol.CT_JSON)
                .timeout(requestTimeout)
                .build();

        HttpClientResponse response;
        try {
            response = http.send(request);
        } catch (HttpTimeoutException e) {
            throw new GatewayException.BackendUnreachable("backend call timed out: " + e.getMessage(), e);
        } catch (HttpClientException e) {
            throw new GatewayException.BackendUnreachable("backend call failed: " + e.getMessage(), e);
        }

        int status = response.statusCode();
        byte[] body = response.body() == null ? new byte[0] : response.body();
        String responseType = response.header(Protocol.H_CONTENT_TYPE).orElse(null);
        if (status < 400) {
            return CallOutcome.ok(status, body, responseType);
        }
        return errorOutcome(status, body, responseType);
    }

    private CallOutcome errorOutcome(int status, byte[] body, String contentType) {
        String code = "http_" + status;
        String message = new String(body, StandardCharsets.UTF_8).trim();
        if (Headers.isJson(contentType) || looksLikeObject(body)) {
            try {
                Map<String, Object> obj = json.readObject(body);
                Object m = firstPresent(obj, Protocol.F_ERROR, Protocol.F_MESSAGE, "detail");
                if (m != null) message = String.valueOf(m);
                Object c = obj.get(Protocol.F_CODE);
                if (c != null) code = String.valueOf(c);
            } catch (JsonException e) {
                log.debug("Backend error body is not a JSON object (HTTP {})", status, e);
            }
        }
        if (message.isEmpty()) message = "backend answered HTTP " + status;
        return CallOutcome.error(status, code, message);
    }

    private static Object firstPresent(Map<String, Object> obj, String... keys) {
        for (String k : keys) {
            Object v = obj.get(k);
            if (v != null) return v;
        }
        return null;
    }

    private static boolean looksLikeObject(byte[] body) {
        for (byte b : body) {
            if (!Character.isWhitespace(b)) return b == '{';
        }
        return false;
    }

    private static final class HttpBackendStream implements BackendStream {
        private final URI uri;
        private final HttpClientResponse response;
        private final SseParser parser;
        private final AtomicBoolean closed = new AtomicBoolean(false);

        private HttpBackendStream(URI uri, HttpClientResponse response, SseParser parser) {
            this.uri = uri;
            this.response = response;
            this.parser = parser;
        }

        @Override
        public byte[] nextFrame() throws IOException {
            if (closed.get()) throw new IOException("backend stream closed: " + uri);
            SseParser.Event event = parser.next();
            if (event == null) return null;
            return event.data().getBytes(StandardCharsets.UTF_8);
        }

        @Override
        public void close() {
            if (!closed.compareAndSet(false, true)) return;
            response.close();
            log.debug("Closed backend stream {}", uri);
        }
    }
}
