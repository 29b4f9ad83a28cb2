package io.streamgateway.core;

import java.util.Locale;
import java.util.Map;
import java.util.Optional;

/**
 * Header lookups that ignore the case of header names, and content type checks.
 */
public final class Headers {
    private Headers() {}

    /**
     * First non-null value of {@code name} in a multi-valued header map, whatever case the map
     * uses for its keys.
     */
    public static Optional<String> firstValue(Map<String, ? extends Iterable<String>> headers, String name) {
        if (headers == null || name == null) return Optional.empty();
        for (Map.Entry<String, ? extends Iterable<String>> e : headers.entrySet()) {
            if (!name.equalsIgnoreCase(e.getKey()) || e.getValue() == null) continue;
            for (String v : e.getValue()) {
                if (v != null) return Optional.of(v);
            }
        }
        return Optional.empty();
    }

    /**
     * Strips parameters and normalizes case, so {@code "Application/JSON; charset=utf-8"} becomes
     * {@code "application/json"}.
     */
    public static String normalizeContentType(String contentType) {
        if (contentType == null) return "";
        int semi = contentType.indexOf(';');
        String base = semi >= 0 ? contentType.substring(0, semi) : contentType;
        return base.trim().toLowerCase(Locale.ROOT);
    }

    public static boolean isJson(String contentType) {
        String base = normalizeContentType(contentType);
        return base.equals(Protocol.CT_JSON) || base.endsWith("+json");
    }

    public static boolean isEventStream(String contentType) {
        return normalizeContentType(contentType).equals(Protocol.CT_EVENT_STREAM);
    }
}
