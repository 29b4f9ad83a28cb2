package io.streamgateway.server;

import io.javalin.Javalin;
import io.javalin.http.Context;
import io.streamgateway.core.Protocol;
import io.streamgateway.json.spi.JsonCodec;
import io.streamgateway.json.spi.JsonCodecs;
import io.streamgateway.json.spi.JsonException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.OutputStream;
import java.math.BigInteger;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * A small backend for trying the gateway out: arithmetic calls and a progress event stream.
 *
 * <ul>
 *   <li>{@code POST /math/{add|subtract|multiply|divide}} with {@code {"a": x, "b": y}} answers
 *   {@code {"result": r}}; division by zero answers 400 {@code {"error":"division by zero"}}.</li>
 *   <li>{@code GET /stream?n=5} emits {@code n} {@code progress} events one interval apart, then a
 *   {@code done} event, then ends.</li>
 * </ul>
 */
public final class SampleBackendServer implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(SampleBackendServer.class);

    public static final Duration DEFAULT_INTERVAL = Duration.ofMillis(800);
    private static final int DEFAULT_EVENTS = 5;

    private final Javalin app;
    private final JsonCodec json;
    private final Duration interval;
    private final AtomicInteger activeStreams = new AtomicInteger();

    private SampleBackendServer(Duration interval) {
        this.json = JsonCodecs.load();
        this.interval = interval;
        this.app = Javalin.create(cfg -> cfg.showJavalinBanner = false);
        app.post("/math/{op}", this::math);
        app.get("/stream", this::stream);
    }

    public static SampleBackendServer start(String host, int port, Duration interval) {
        SampleBackendServer server = new SampleBackendServer(interval);
        server.app.start(host, port);
        log.info("Sample backend listening on http://{}:{}", host, server.port());
        return server;
    }

    /**
     * Usage: {@code SampleBackendServer [port]}. Default port 9001.
     */
    public static void main(String[] args) {
        int port = args.length > 0 ? Integer.parseInt(args[0]) : 9001;
        SampleBackendServer server = start("0.0.0.0", port, DEFAULT_INTERVAL);
        Runtime.getRuntime().addShutdownHook(new Thread(server::close, "sample-backend-shutdown"));
    }

    public int port() {
        return app.port();
    }

    /** Number of {@code /stream} responses currently being written. */
    public int activeStreams() {
        return activeStreams.get();
    }

    @Override
    public void close() {
        app.stop();
    }

    private void math(Context ctx) throws JsonException {
        Map<String, Object> body;
        try {
            body = json.readObject(ctx.bodyAsBytes());
        } catch (JsonException e) {
            error(ctx, 400, "invalid JSON body");
            return;
        }
        if (!(body.get("a") instanceof Number a) || !(body.get("b") instanceof Number b)) {
            error(ctx, 400, "a and b must be numbers");
            return;
        }

        String op = ctx.pathParam("op");
        boolean integral = isIntegral(a) && isIntegral(b);
        Number result;
        switch (op) {
            case "add" -> result = integral ? narrow(big(a).add(big(b))) : a.doubleValue() + b.doubleValue();
            case "subtract" -> result = integral ? narrow(big(a).subtract(big(b))) : a.doubleValue() - b.doubleValue();
            case "multiply" -> result = integral ? narrow(big(a).multiply(big(b))) : a.doubleValue() * b.doubleValue();
            case "divide" -> {
                if (b.doubleValue() == 0.0) {
                    error(ctx, 400, "division by zero");
                    return;
                }
                result = a.doubleValue() / b.doubleValue();
            }
            default -> {
                error(ctx, 404, "unknown operation: " + op);
                return;
            }
        }

        ctx.contentType(Protocol.CT_JSON);
        ctx.result(json.writeBytes(Map.of("result", result)));
    }

    private void stream(Context ctx) throws IOException, JsonException {
        int n = parseCount(ctx.queryParam("n"));
        ctx.contentType(Protocol.CT_EVENT_STREAM);
        ctx.header(Protocol.H_CACHE_CONTROL, "no-cache");
        OutputStream out = ctx.res().getOutputStream();

        activeStreams.incrementAndGet();
        try {
            for (int step = 1; step <= n; step++) {
                Map<String, Object> event = new LinkedHashMap<>();
                event.put("event", "progress");
                event.put("step", step);
                event.put("total", n);
                event.put("timestamp", Instant.now().toString());
                writeEvent(out, event);
                Thread.sleep(interval.toMillis());
            }
            writeEvent(out, Map.of("event", "done"));
        } catch (IOException e) {
            log.debug("Stream reader disconnected: {}", e.getMessage());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        } finally {
            activeStreams.decrementAndGet();
        }
    }

    private void writeEvent(OutputStream out, Map<String, Object> event) throws IOException, JsonException {
        out.write(("data: " + json.writeString(event) + "\n\n").getBytes(StandardCharsets.UTF_8));
        out.flush();
    }

    private void error(Context ctx, int status, String message) throws JsonException {
        ctx.status(status);
        ctx.contentType(Protocol.CT_JSON);
        ctx.result(json.writeBytes(Map.of(Protocol.F_ERROR, message)));
    }

    private static int parseCount(String raw) {
        if (raw == null || raw.isBlank()) return DEFAULT_EVENTS;
        try {
            return Math.max(0, Integer.parseInt(raw.trim()));
        } catch (NumberFormatException e) {
            return DEFAULT_EVENTS;
        }
    }

    private static boolean isIntegral(Number n) {
        return n instanceof Integer || n instanceof Long || n instanceof Short || n instanceof Byte
                || n instanceof BigInteger;
    }

    private static BigInteger big(Number n) {
        return n instanceof BigInteger b ? b : BigInteger.valueOf(n.longValue());
    }

    /** Integer arithmetic never wraps; results outside the long range stay BigInteger. */
    private static Number narrow(BigInteger n) {
        return n.bitLength() < Long.SIZE ? (Number) n.longValue() : n;
    }
}
