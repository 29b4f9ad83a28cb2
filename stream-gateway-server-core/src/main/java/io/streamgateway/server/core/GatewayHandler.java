package io.streamgateway.server.core;

import io.streamgateway.core.GatewayException;
import io.streamgateway.core.Protocol;
import io.streamgateway.json.spi.JsonCodec;
import io.streamgateway.json.spi.JsonCodecs;
import io.streamgateway.json.spi.JsonException;
import io.streamgateway.server.spi.ControlPlaneRegistry;
import io.streamgateway.server.spi.RegisterOutcome;
import io.streamgateway.server.spi.Registration;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.net.URI;
import java.net.URISyntaxException;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;

/**
 * Framework-neutral HTTP handler for the gateway's control and data plane routes.
 *
 * <p>Errors are answered with a JSON body {@code {"code": ..., "message": ...}} and an
 * {@code X-Error} header carrying the code. Control routes are only served when a
 * {@link ControlPlaneRegistry} is configured.
 *
 * <pre>{@code
 * GatewayHandler handler = GatewayHandler.builder(gateway)
 *     .controlPlane(registry)
 *     .build();
 * }</pre>
 */
public final class GatewayHandler {

    private static final Logger log = LoggerFactory.getLogger(GatewayHandler.class);

    private final Gateway gateway;
    private final ControlPlaneRegistry controlPlane;
    private final JsonCodec json;

    public static Builder builder(Gateway gateway) {
        return new Builder(gateway);
    }

    private GatewayHandler(Builder builder) {
        this.gateway = Objects.requireNonNull(builder.gateway, "gateway");
        this.controlPlane = builder.controlPlane;
        this.json = builder.json != null ? builder.json : JsonCodecs.load();
    }

    /**
     * Builder for {@link GatewayHandler}.
     */
    public static final class Builder {
        private final Gateway gateway;
        private ControlPlaneRegistry controlPlane;
        private JsonCodec json;

        private Builder(Gateway gateway) {
            this.gateway = Objects.requireNonNull(gateway, "gateway");
        }

        /** Enables the {@code /control} routes on the given registry. Default: disabled. */
        public Builder controlPlane(ControlPlaneRegistry controlPlane) {
            this.controlPlane = controlPlane;
            return this;
        }

        /** Sets the JSON codec. Default: {@link JsonCodecs#load()}. */
        public Builder jsonCodec(JsonCodec json) {
            this.json = json;
            return this;
        }

        public GatewayHandler build() {
            return new GatewayHandler(this);
        }
    }

    public ServerResponse handle(ServerRequest req) {
        String path = req.path();
        try {
            if (path.startsWith(Protocol.CONTROL_PREFIX + "/")) {
                return handleControl(req, path);
            }
            if (path.equals(Protocol.PATH_CONNECT)) {
                expect(req, HttpMethod.POST);
                return handleConnect(req);
            }
            if (path.startsWith(Protocol.PATH_STREAM)) {
                expect(req, HttpMethod.GET);
                return handleStream(path.substring(Protocol.PATH_STREAM.length()));
            }
            if (path.startsWith(Protocol.PATH_REQUEST)) {
                expect(req, HttpMethod.POST);
                return handleCall(req, path.substring(Protocol.PATH_REQUEST.length()));
            }
            if (path.equals(Protocol.PATH_SESSIONS)) {
                expect(req, HttpMethod.GET);
                return handleSessions();
            }
            return error(404, "not_found", "no route for " + path);
        } catch (MethodNotAllowed e) {
            return error(405, "method_not_allowed", e.getMessage());
        } catch (BadRequest | IllegalArgumentException | JsonException e) {
            return error(400, "bad_request", e.getMessage());
        } catch (GatewayException.BackendCallError e) {
            return error(e.status(), e.backendCode(), e.getMessage()).replaceHeader(Protocol.H_X_ERROR, e.code());
        } catch (GatewayException e) {
            int status = statusFor(e);
            if (status >= 500) {
                log.warn("{} {} failed: {}", req.method(), path, e.getMessage());
            }
            return error(status, e.code(), e.getMessage());
        } catch (Exception e) {
            log.error("{} {} failed", req.method(), path, e);
            return error(500, "internal_error", "internal error");
        }
    }

    private ServerResponse handleControl(ServerRequest req, String path) throws Exception {
        if (controlPlane == null) return error(404, "not_found", "control plane disabled");

        switch (path) {
            case Protocol.PATH_REGISTER: {
                expect(req, HttpMethod.POST);
                Map<String, Object> body = readObject(req);
                String name = requiredString(body, Protocol.F_NAME);
                URI baseUrl = parseUrl(requiredString(body, Protocol.F_BASE_URL));
                Map<String, Object> meta = optionalObject(body, Protocol.F_META);

                RegisterOutcome out = controlPlane.register(name, baseUrl, meta);
                if (out.status() == RegisterOutcome.Status.NAME_TAKEN) {
                    return error(400, "name_taken", "server already registered: " + name);
                }
                return ok(Map.of("status", "ok", "registered", name));
            }
            case Protocol.PATH_UNREGISTER: {
                expect(req, HttpMethod.POST);
                String name = requiredString(readObject(req), Protocol.F_NAME);
                controlPlane.unregister(name).orElseThrow(() -> new GatewayException.NameNotFound(name));
                return ok(Map.of("status", "ok", "unregistered", name));
            }
            case Protocol.PATH_LIST: {
                expect(req, HttpMethod.GET);
                Map<String, Object> servers = new LinkedHashMap<>();
                for (Registration r : controlPlane.list().values()) {
                    Map<String, Object> entry = new LinkedHashMap<>();
                    entry.put("url", r.backendAddress().toString());
                    entry.put(Protocol.F_META, r.meta());
                    entry.put("registered_at", r.registeredAt().toString());
                    servers.put(r.name(), entry);
                }
                return ok(Map.of("servers", servers));
            }
            default:
                return error(404, "not_found", "no route for " + path);
        }
    }

    private ServerResponse handleConnect(ServerRequest req) throws Exception {
        String server = requiredString(readObject(req), Protocol.F_SERVER);
        Session session = gateway.connect(server);

        Map<String, Object> body = new LinkedHashMap<>();
        body.put(Protocol.F_SESSION_ID, session.id());
        body.put(Protocol.F_SERVER, server);
        return ok(body);
    }

    private ServerResponse handleStream(String sessionId) {
        if (sessionId.isEmpty() || sessionId.indexOf('/') >= 0) {
            throw new GatewayException.SessionNotFound(sessionId);
        }
        return ServerResponse.sse(gateway.attachStream(sessionId));
    }

    private ServerResponse handleCall(ServerRequest req, String rest) throws Exception {
        int slash = rest.indexOf('/');
        if (slash <= 0 || slash == rest.length() - 1 || rest.indexOf('/', slash + 1) >= 0) {
            return error(404, "not_found", "expected " + Protocol.PATH_REQUEST + "{session_id}/{method}");
        }
        String sessionId = rest.substring(0, slash);
        String method = rest.substring(slash + 1);

        byte[] payload = req.bodyBytes();
        String contentType = req.contentType().orElse(Protocol.CT_JSON);
        if (payload.length == 0) {
            payload = "{}".getBytes(StandardCharsets.UTF_8);
            contentType = Protocol.CT_JSON;
        }

        CallResult result = gateway.call(sessionId, method, payload, contentType);
        return ServerResponse.bytes(result.status(), result.body(),
                result.contentType() != null ? result.contentType() : Protocol.CT_JSON);
    }

    private ServerResponse handleSessions() throws JsonException {
        List<Map<String, Object>> out = new ArrayList<>();
        for (SessionInfo info : gateway.sessions().snapshot()) {
            Map<String, Object> entry = new LinkedHashMap<>();
            entry.put(Protocol.F_SESSION_ID, info.sessionId());
            entry.put(Protocol.F_SERVER, info.backendName());
            entry.put("state", info.state().name().toLowerCase(Locale.ROOT));
            entry.put("attached", info.attached());
            entry.put("buffered", info.buffered());
            entry.put("capacity", info.capacity());
            entry.put("dropped", info.dropped());
            out.add(entry);
        }
        return ok(Map.of("sessions", out));
    }

    private static int statusFor(GatewayException e) {
        if (e instanceof GatewayException.NameNotFound || e instanceof GatewayException.SessionNotFound) return 404;
        if (e instanceof GatewayException.SessionBusy) return 409;
        if (e instanceof GatewayException.BackendUnreachable || e instanceof GatewayException.BackendStreamError) return 502;
        return 500;
    }

    private ServerResponse ok(Object body) throws JsonException {
        return ServerResponse.json(200, json.writeBytes(body));
    }

    private ServerResponse error(int status, String code, String message) {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put(Protocol.F_CODE, code);
        body.put(Protocol.F_MESSAGE, message);
        ServerResponse resp;
        try {
            resp = ServerResponse.json(status, json.writeBytes(body));
        } catch (JsonException e) {
            log.warn("Cannot render error body for {}", code, e);
            resp = new ServerResponse(status, new ResponseBody.Empty())
                    .header(Protocol.H_CACHE_CONTROL, "no-store");
        }
        return resp.header(Protocol.H_X_ERROR, code);
    }

    private Map<String, Object> readObject(ServerRequest req) throws Exception {
        byte[] body = req.bodyBytes();
        if (body.length == 0) throw new BadRequest("request body required");
        return json.readObject(body);
    }

    private static void expect(ServerRequest req, HttpMethod method) {
        if (req.method() != method) throw new MethodNotAllowed(req.method() + " not allowed, use " + method);
    }

    private static String requiredString(Map<String, Object> body, String field) {
        Object v = body.get(field);
        if (!(v instanceof String s) || s.isBlank()) throw new BadRequest("missing field: " + field);
        return s;
    }

    @SuppressWarnings("unchecked")
    private static Map<String, Object> optionalObject(Map<String, Object> body, String field) {
        Object v = body.get(field);
        if (v == null) return Map.of();
        if (!(v instanceof Map)) throw new BadRequest("field must be an object: " + field);
        return (Map<String, Object>) v;
    }

    private static URI parseUrl(String raw) {
        try {
            URI uri = new URI(raw.trim());
            String scheme = uri.getScheme();
            if (!"http".equalsIgnoreCase(scheme) && !"https".equalsIgnoreCase(scheme)) {
                throw new BadRequest("base_url must be an http(s) URL: " + raw);
            }
            return uri;
        } catch (URISyntaxException e) {
            throw new BadRequest("invalid base_url: " + raw);
        }
    }

    private static final class BadRequest extends RuntimeException {
        BadRequest(String msg) { super(msg); }
    }

    private static final class MethodNotAllowed extends RuntimeException {
        MethodNotAllowed(String msg) { super(msg); }
    }
}
