package io.streamgateway.server.core;

import io.streamgateway.core.Headers;
import io.streamgateway.core.Protocol;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Status, headers and body produced by {@link GatewayHandler}, written out by whichever HTTP
 * server hosts the gateway.
 */
public final class ServerResponse {
    private final int status;
    private final Map<String, List<String>> headers = new LinkedHashMap<>();
    private final ResponseBody body;

    public ServerResponse(int status, ResponseBody body) {
        this.status = status;
        this.body = body;
    }

    static ServerResponse json(int status, byte[] json) {
        return bytes(status, json, Protocol.CT_JSON);
    }

    static ServerResponse bytes(int status, byte[] bytes, String contentType) {
        return new ServerResponse(status, new ResponseBody.Bytes(bytes))
                .header(Protocol.H_CONTENT_TYPE, contentType)
                .header(Protocol.H_CACHE_CONTROL, "no-store");
    }

    static ServerResponse sse(StreamPublisher publisher) {
        return new ServerResponse(200, new ResponseBody.Sse(publisher))
                .header(Protocol.H_CONTENT_TYPE, Protocol.CT_EVENT_STREAM)
                .header(Protocol.H_CACHE_CONTROL, "no-cache");
    }

    public int status() {
        return status;
    }

    public Map<String, List<String>> headers() {
        return headers;
    }

    public Optional<String> header(String name) {
        return Headers.firstValue(headers, name);
    }

    public ResponseBody body() {
        return body;
    }

    public ServerResponse header(String name, String value) {
        headers.computeIfAbsent(name, k -> new ArrayList<>()).add(value);
        return this;
    }

    /** Replaces every value of {@code name}. */
    ServerResponse replaceHeader(String name, String value) {
        headers.remove(name);
        return header(name, value);
    }
}
