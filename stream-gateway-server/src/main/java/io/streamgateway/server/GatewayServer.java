package io.streamgateway.server;

import com.typesafe.config.ConfigFactory;
import io.javalin.Javalin;
import io.javalin.http.Context;
import io.streamgateway.http.spi.HttpClientAdapter;
import io.streamgateway.http.spi.JdkHttpClientAdapter;
import io.streamgateway.http.spi.OkHttpClientAdapter;
import io.streamgateway.json.spi.JsonCodec;
import io.streamgateway.json.spi.JsonCodecs;
import io.streamgateway.server.core.Gateway;
import io.streamgateway.server.core.GatewayHandler;
import io.streamgateway.server.core.HttpBackendConnector;
import io.streamgateway.server.core.HttpMethod;
import io.streamgateway.server.core.ResponseBody;
import io.streamgateway.server.core.ServerRequest;
import io.streamgateway.server.core.ServerResponse;
import io.streamgateway.server.core.SseFrame;
import io.streamgateway.server.core.StreamPublisher;
import io.streamgateway.server.spi.InMemoryBackendRegistry;
import io.streamgateway.server.spi.RegisterOutcome;
import okhttp3.OkHttpClient;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.net.URI;
import java.nio.charset.StandardCharsets;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.Flow;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Runs the gateway on Javalin.
 *
 * <p>Every route is delegated to {@link GatewayHandler}; this class only adapts Javalin's
 * {@link Context} to {@link ServerRequest} and writes {@link ServerResponse}s back, streaming SSE
 * bodies frame by frame until the publisher completes or the client goes away.
 */
public final class GatewayServer implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(GatewayServer.class);

    private final InMemoryBackendRegistry registry;
    private final Gateway gateway;
    private final Javalin app;

    private GatewayServer(GatewayConfig config) {
        JsonCodec json = JsonCodecs.load();
        this.registry = new InMemoryBackendRegistry();
        for (GatewayConfig.StaticServer s : config.servers()) {
            RegisterOutcome out = registry.register(s.name(), s.baseUrl(), Map.of());
            if (out.status() == RegisterOutcome.Status.NAME_TAKEN) {
                throw new IllegalArgumentException("duplicate server in configuration: " + s.name());
            }
        }

        HttpBackendConnector.Builder connector = HttpBackendConnector.builder()
                .httpClient(httpClient(config))
                .jsonCodec(json)
                .streamPath(config.streamPath())
                .callPathTemplate(config.callPathTemplate())
                .requestTimeout(config.requestTimeout());
        config.streamQuery().forEach(connector::streamQueryParam);

        this.gateway = Gateway.builder(registry, connector.build())
                .bufferCapacity(config.bufferCapacity())
                .heartbeatInterval(config.heartbeatInterval())
                .backendIdleTimeout(config.backendIdleTimeout())
                .build();

        GatewayHandler handler = GatewayHandler.builder(gateway)
                .controlPlane(registry)
                .jsonCodec(json)
                .build();

        this.app = Javalin.create(cfg -> cfg.showJavalinBanner = false);
        app.get("/*", ctx -> handle(ctx, handler));
        app.post("/*", ctx -> handle(ctx, handler));
    }

    /**
     * Builds the gateway and starts listening.
     */
    public static GatewayServer start(GatewayConfig config) {
        GatewayServer server = new GatewayServer(config);
        server.app.start(config.host(), config.port());
        log.info("Gateway listening on http://{}:{} ({})", config.host(), server.port(), config);
        return server;
    }

    public static void main(String[] args) {
        GatewayConfig config = GatewayConfig.fromConfig(ConfigFactory.load());
        GatewayServer server = start(config);
        Runtime.getRuntime().addShutdownHook(new Thread(server::close, "gateway-shutdown"));
    }

    public int port() {
        return app.port();
    }

    public InMemoryBackendRegistry registry() {
        return registry;
    }

    public Gateway gateway() {
        return gateway;
    }

    @Override
    public void close() {
        gateway.close();
        app.stop();
    }

    private static HttpClientAdapter httpClient(GatewayConfig config) {
        if (config.httpClient() == GatewayConfig.HttpClientKind.OKHTTP) {
            return OkHttpClientAdapter.create(new OkHttpClient.Builder()
                    .connectTimeout(config.connectTimeout())
                    .readTimeout(java.time.Duration.ZERO)
                    .build());
        }
        return JdkHttpClientAdapter.create(config.connectTimeout());
    }

    private static void handle(Context ctx, GatewayHandler handler) throws IOException {
        HttpMethod method = HttpMethod.parse(ctx.method().name());
        if (method == null) {
            ctx.status(405);
            return;
        }
        ServerRequest request = new ServerRequest(
                method,
                URI.create(ctx.fullUrl()),
                toHeaders(ctx),
                bodyOrNull(ctx));

        ServerResponse response = handler.handle(request);
        ctx.status(response.status());
        for (Map.Entry<String, List<String>> e : response.headers().entrySet()) {
            for (String v : e.getValue()) {
                ctx.header(e.getKey(), v);
            }
        }

        if (response.body() instanceof ResponseBody.Bytes bytes) {
            ctx.result(bytes.bytes());
            return;
        }

        if (response.body() instanceof ResponseBody.Sse sse) {
            ctx.contentType("text/event-stream");
            writeSse(ctx, sse.publisher());
        }
    }

    private static Map<String, List<String>> toHeaders(Context ctx) {
        Map<String, List<String>> headers = new LinkedHashMap<>();
        for (Map.Entry<String, String> e : ctx.headerMap().entrySet()) {
            headers.put(e.getKey(), List.of(e.getValue()));
        }
        return headers;
    }

    private static InputStream bodyOrNull(Context ctx) {
        long len = ctx.req().getContentLengthLong();
        if (len == 0) return null;
        return ctx.bodyInputStream();
    }

    private static void writeSse(Context ctx, StreamPublisher publisher) throws IOException {
        OutputStream out;
        try {
            out = ctx.res().getOutputStream();
            // commit headers before the first frame
            out.flush();
        } catch (IOException | RuntimeException e) {
            // the attach slot is already held; release it before anyone subscribes
            publisher.abandon();
            throw e;
        }
        CountDownLatch done = new CountDownLatch(1);
        AtomicReference<Flow.Subscription> subscriptionRef = new AtomicReference<>();

        publisher.subscribe(new Flow.Subscriber<>() {
            private Flow.Subscription subscription;

            @Override
            public void onSubscribe(Flow.Subscription subscription) {
                this.subscription = subscription;
                subscriptionRef.set(subscription);
                subscription.request(Long.MAX_VALUE);
            }

            @Override
            public void onNext(SseFrame item) {
                try {
                    out.write(item.render().getBytes(StandardCharsets.UTF_8));
                    out.flush();
                } catch (IOException e) {
                    log.debug("Stream client went away: {}", e.getMessage());
                    subscription.cancel();
                    done.countDown();
                }
            }

            @Override
            public void onError(Throwable throwable) {
                log.warn("Stream failed", throwable);
                done.countDown();
            }

            @Override
            public void onComplete() {
                done.countDown();
            }
        });

        try {
            done.await();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            Flow.Subscription subscription = subscriptionRef.get();
            if (subscription != null) subscription.cancel();
        }
    }
}
