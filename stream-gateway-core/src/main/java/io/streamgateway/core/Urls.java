package io.streamgateway.core;

import java.net.URI;
import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;
import java.util.Map;
import java.util.Objects;
import java.util.TreeMap;

/**
 * Utility to build backend URLs from a registered base address.
 */
public final class Urls {
    private Urls() {}

    /**
     * Appends query parameters with lexicographically sorted keys.
     */
    public static URI withQuery(URI base, Map<String, String> params) {
        Objects.requireNonNull(base, "base");
        if (params == null || params.isEmpty()) return base;

        TreeMap<String, String> sorted = new TreeMap<>(params);
        StringBuilder sb = new StringBuilder(base.toString());
        sb.append(base.getQuery() == null ? "?" : "&");

        boolean first = true;
        for (Map.Entry<String, String> e : sorted.entrySet()) {
            if (e.getKey() == null || e.getValue() == null) continue;
            if (!first) sb.append("&");
            first = false;
            sb.append(encode(e.getKey())).append("=").append(encode(e.getValue()));
        }
        return URI.create(sb.toString());
    }

    /**
     * Resolves {@code path} against {@code base}, keeping any path prefix of the base address.
     *
     * <p>{@code resolve("http://h:1/api/", "/stream")} gives {@code http://h:1/api/stream}.
     */
    public static URI resolve(URI base, String path) {
        Objects.requireNonNull(base, "base");
        Objects.requireNonNull(path, "path");
        String b = stripTrailingSlash(base.toString());
        String p = path.startsWith("/") ? path : "/" + path;
        return URI.create(b + p);
    }

    /**
     * Drops trailing slashes, as registrations store {@code base_url.rstrip("/")}.
     */
    public static String stripTrailingSlash(String url) {
        int len = url.length();
        while (len > 0 && url.charAt(len - 1) == '/') len--;
        return url.substring(0, len);
    }

    private static String encode(String s) {
        return URLEncoder.encode(s, StandardCharsets.UTF_8);
    }
}
