package io.streamgateway.server.core;

/**
 * HTTP methods understood by {@link GatewayHandler}.
 */
public enum HttpMethod {
    GET,
    POST,
    PUT,
    DELETE,
    HEAD;

    /**
     * @return the matching method, or {@code null} if the gateway does not handle it
     */
    public static HttpMethod parse(String name) {
        if (name == null) return null;
        for (HttpMethod m : values()) {
            if (m.name().equalsIgnoreCase(name)) return m;
        }
        return null;
    }
}
