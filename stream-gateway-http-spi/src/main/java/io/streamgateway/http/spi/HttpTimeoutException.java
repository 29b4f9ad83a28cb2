package io.streamgateway.http.spi;

import java.time.Duration;

/**
 * The backend did not answer within the request timeout.
 */
public class HttpTimeoutException extends HttpClientException {

    private final Duration timeout;

    public HttpTimeoutException(HttpClientRequest request, Throwable cause) {
        super(request, "no response within " + describe(request.timeout()), cause);
        this.timeout = request.timeout();
    }

    /** The timeout that elapsed, or {@code null} when the client's own limit fired. */
    public Duration timeout() {
        return timeout;
    }

    private static String describe(Duration timeout) {
        return timeout == null ? "the client timeout" : timeout.toMillis() + " ms";
    }
}
