package io.streamgateway.server.core;

/**
 * Successful result of a forwarded call, passed back to the client as-is.
 *
 * @param status backend HTTP status
 * @param body backend response body
 * @param contentType backend content type, or {@code null} if it sent none
 */
public record CallResult(int status, byte[] body, String contentType) {
}
