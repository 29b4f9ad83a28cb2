package io.streamgateway.http.spi;

/**
 * An exchange with a backend failed before any response arrived: connection refused, reset,
 * DNS failure, or an interrupted wait.
 *
 * <p>{@link #target()} names the request, e.g. {@code GET http://127.0.0.1:9001/stream}.
 */
public class HttpClientException extends Exception {

    private final String target;

    public HttpClientException(HttpClientRequest request, Throwable cause) {
        this(request, describe(cause), cause);
    }

    public HttpClientException(HttpClientRequest request, String detail, Throwable cause) {
        super(request.target() + ": " + detail, cause);
        this.target = request.target();
    }

    public String target() {
        return target;
    }

    private static String describe(Throwable cause) {
        String msg = cause.getMessage();
        return msg == null || msg.isBlank() ? cause.getClass().getSimpleName() : msg;
    }
}
