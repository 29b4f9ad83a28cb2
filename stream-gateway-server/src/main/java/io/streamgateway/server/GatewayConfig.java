package io.streamgateway.server;

import com.typesafe.config.Config;
import com.typesafe.config.ConfigValue;

import java.net.URI;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Settings of the runnable gateway.
 *
 * <p>Example HOCON configuration:</p>
 * <pre>
 * gateway {
 *   host = "0.0.0.0"
 *   port = 8000
 *   session {
 *     buffer-capacity = 100
 *     heartbeat-interval = 15s
 *     backend-idle-timeout = 30s
 *   }
 *   backend {
 *     http-client = "jdk"
 *     connect-timeout = 5s
 *     request-timeout = 30s
 *     stream-path = "/stream"
 *     stream-query { n = "50" }
 *     call-path-template = "/math/{method}"
 *   }
 *   servers = [
 *     { name = "math1", base-url = "http://127.0.0.1:9001" }
 *   ]
 * }
 * </pre>
 */
public final class GatewayConfig {

    /** HTTP client used for backend connections. */
    public enum HttpClientKind {
        JDK,
        OKHTTP
    }

    /** A backend registered at startup. */
    public record StaticServer(String name, URI baseUrl) {}

    private final String host;
    private final int port;
    private final int bufferCapacity;
    private final Duration heartbeatInterval;
    private final Duration backendIdleTimeout;
    private final HttpClientKind httpClient;
    private final Duration connectTimeout;
    private final Duration requestTimeout;
    private final String streamPath;
    private final Map<String, String> streamQuery;
    private final String callPathTemplate;
    private final List<StaticServer> servers;

    private GatewayConfig(Builder builder) {
        this.host = builder.host;
        this.port = builder.port;
        this.bufferCapacity = builder.bufferCapacity;
        this.heartbeatInterval = builder.heartbeatInterval;
        this.backendIdleTimeout = builder.backendIdleTimeout;
        this.httpClient = builder.httpClient;
        this.connectTimeout = builder.connectTimeout;
        this.requestTimeout = builder.requestTimeout;
        this.streamPath = builder.streamPath;
        this.streamQuery = Collections.unmodifiableMap(new LinkedHashMap<>(builder.streamQuery));
        this.callPathTemplate = builder.callPathTemplate;
        this.servers = List.copyOf(builder.servers);
    }

    /**
     * Load configuration from HOCON config. Missing keys keep their builder defaults.
     */
    public static GatewayConfig fromConfig(Config config) {
        Builder builder = builder();

        if (config.hasPath("gateway.host")) {
            builder.host(config.getString("gateway.host"));
        }
        if (config.hasPath("gateway.port")) {
            builder.port(config.getInt("gateway.port"));
        }
        if (config.hasPath("gateway.session.buffer-capacity")) {
            builder.bufferCapacity(config.getInt("gateway.session.buffer-capacity"));
        }
        if (config.hasPath("gateway.session.heartbeat-interval")) {
            builder.heartbeatInterval(config.getDuration("gateway.session.heartbeat-interval"));
        }
        if (config.hasPath("gateway.session.backend-idle-timeout")) {
            builder.backendIdleTimeout(config.getDuration("gateway.session.backend-idle-timeout"));
        }
        if (config.hasPath("gateway.backend.http-client")) {
            builder.httpClient(HttpClientKind.valueOf(
                    config.getString("gateway.backend.http-client").trim().toUpperCase(Locale.ROOT)));
        }
        if (config.hasPath("gateway.backend.connect-timeout")) {
            builder.connectTimeout(config.getDuration("gateway.backend.connect-timeout"));
        }
        if (config.hasPath("gateway.backend.request-timeout")) {
            builder.requestTimeout(config.getDuration("gateway.backend.request-timeout"));
        }
        if (config.hasPath("gateway.backend.stream-path")) {
            builder.streamPath(config.getString("gateway.backend.stream-path"));
        }
        if (config.hasPath("gateway.backend.stream-query")) {
            for (Map.Entry<String, ConfigValue> e : config.getConfig("gateway.backend.stream-query").entrySet()) {
                builder.streamQueryParam(e.getKey(), String.valueOf(e.getValue().unwrapped()));
            }
        }
        if (config.hasPath("gateway.backend.call-path-template")) {
            builder.callPathTemplate(config.getString("gateway.backend.call-path-template"));
        }
        if (config.hasPath("gateway.servers")) {
            for (Config server : config.getConfigList("gateway.servers")) {
                builder.server(server.getString("name"), URI.create(server.getString("base-url")));
            }
        }

        return builder.build();
    }

    public String host() {
        return host;
    }

    public int port() {
        return port;
    }

    public int bufferCapacity() {
        return bufferCapacity;
    }

    public Duration heartbeatInterval() {
        return heartbeatInterval;
    }

    public Duration backendIdleTimeout() {
        return backendIdleTimeout;
    }

    public HttpClientKind httpClient() {
        return httpClient;
    }

    public Duration connectTimeout() {
        return connectTimeout;
    }

    public Duration requestTimeout() {
        return requestTimeout;
    }

    public String streamPath() {
        return streamPath;
    }

    public Map<String, String> streamQuery() {
        return streamQuery;
    }

    public String callPathTemplate() {
        return callPathTemplate;
    }

    public List<StaticServer> servers() {
        return servers;
    }

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private String host = "0.0.0.0";
        private int port = 8000;
        private int bufferCapacity = 100;
        private Duration heartbeatInterval = Duration.ofSeconds(15);
        private Duration backendIdleTimeout = Duration.ofSeconds(30);
        private HttpClientKind httpClient = HttpClientKind.JDK;
        private Duration connectTimeout = Duration.ofSeconds(5);
        private Duration requestTimeout = Duration.ofSeconds(30);
        private String streamPath = "/stream";
        private final Map<String, String> streamQuery = new LinkedHashMap<>();
        private String callPathTemplate = "/math/{method}";
        private final List<StaticServer> servers = new ArrayList<>();

        public Builder host(String host) {
            this.host = host;
            return this;
        }

        /** Listening port; {@code 0} picks a free one. */
        public Builder port(int port) {
            this.port = port;
            return this;
        }

        public Builder bufferCapacity(int bufferCapacity) {
            this.bufferCapacity = bufferCapacity;
            return this;
        }

        public Builder heartbeatInterval(Duration heartbeatInterval) {
            this.heartbeatInterval = heartbeatInterval;
            return this;
        }

        public Builder backendIdleTimeout(Duration backendIdleTimeout) {
            this.backendIdleTimeout = backendIdleTimeout;
            return this;
        }

        public Builder httpClient(HttpClientKind httpClient) {
            this.httpClient = httpClient;
            return this;
        }

        public Builder connectTimeout(Duration connectTimeout) {
            this.connectTimeout = connectTimeout;
            return this;
        }

        public Builder requestTimeout(Duration requestTimeout) {
            this.requestTimeout = requestTimeout;
            return this;
        }

        public Builder streamPath(String streamPath) {
            this.streamPath = streamPath;
            return this;
        }

        public Builder streamQueryParam(String name, String value) {
            this.streamQuery.put(name, value);
            return this;
        }

        public Builder callPathTemplate(String callPathTemplate) {
            this.callPathTemplate = callPathTemplate;
            return this;
        }

        public Builder server(String name, URI baseUrl) {
            this.servers.add(new StaticServer(name, baseUrl));
            return this;
        }

        public GatewayConfig build() {
            return new GatewayConfig(this);
        }
    }

    @Override
    public String toString() {
        return "GatewayConfig{" +
                "host='" + host + '\'' +
                ", port=" + port +
                ", bufferCapacity=" + bufferCapacity +
                ", heartbeatInterval=" + heartbeatInterval +
                ", backendIdleTimeout=" + backendIdleTimeout +
                ", httpClient=" + httpClient +
                ", streamQuery=" + streamQuery +
                ", servers=" + servers.size() +
                '}';
    }
}
