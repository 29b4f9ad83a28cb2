package io.streamgateway.core;

/**
 * Gateway protocol constants (route segments, body fields, header names, and SSE vocabulary).
 *
 * <p>Shared by the server core, the runnable server, and backend connectors. Contains no HTTP
 * bindings.
 */
public final class Protocol {
    private Protocol() {}

    // Route prefixes
    public static final String CONTROL_PREFIX = "/control";
    public static final String DATA_PREFIX = "/data";

    // Control plane routes
    public static final String PATH_REGISTER = CONTROL_PREFIX + "/register";
    public static final String PATH_UNREGISTER = CONTROL_PREFIX + "/unregister";
    public static final String PATH_LIST = CONTROL_PREFIX + "/list";

    // Data plane routes
    public static final String PATH_CONNECT = DATA_PREFIX + "/connect";
    public static final String PATH_STREAM = DATA_PREFIX + "/stream/";
    public static final String PATH_REQUEST = DATA_PREFIX + "/request/";
    public static final String PATH_SESSIONS = DATA_PREFIX + "/sessions";

    // Request/response body fields
    public static final String F_NAME = "name";
    public static final String F_BASE_URL = "base_url";
    public static final String F_META = "meta";
    public static final String F_SERVER = "server";
    public static final String F_SESSION_ID = "session_id";
    public static final String F_REASON = "reason";
    public static final String F_CODE = "code";
    public static final String F_MESSAGE = "message";
    public static final String F_ERROR = "error";

    // HTTP headers
    public static final String H_CONTENT_TYPE = "Content-Type";
    public static final String H_ACCEPT = "Accept";
    public static final String H_CACHE_CONTROL = "Cache-Control";
    public static final String H_X_ERROR = "X-Error";

    // Content types
    public static final String CT_EVENT_STREAM = "text/event-stream";
    public static final String CT_JSON = "application/json";

    // SSE vocabulary
    public static final String EVENT_END = "end";

    /** Placeholder replaced by the method name in backend call path templates. */
    public static final String METHOD_PLACEHOLDER = "{method}";
}
