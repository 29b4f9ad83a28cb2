package io.streamgateway.server.spi;

import java.util.Objects;

/**
 * Result of a request/response call to a backend method.
 *
 * <p>Either {@link Status#OK} with the backend's result body, or {@link Status#ERROR} with the
 * backend's structured error.
 */
public final class CallOutcome {
    public enum Status {
        OK,
        ERROR
    }

    private final Status status;
    private final int httpStatus;
    private final byte[] body;
    private final String contentType;
    private final String errorCode;
    private final String errorMessage;

    private CallOutcome(Status status, int httpStatus, byte[] body, String contentType, String errorCode, String errorMessage) {
        this.status = Objects.requireNonNull(status, "status");
        this.httpStatus = httpStatus;
        this.body = body == null ? new byte[0] : body;
        this.contentType = contentType;
        this.errorCode = errorCode;
        this.errorMessage = errorMessage;
    }

    public static CallOutcome ok(int httpStatus, byte[] body, String contentType) {
        return new CallOutcome(Status.OK, httpStatus, body, contentType, null, null);
    }

    public static CallOutcome error(int httpStatus, String errorCode, String errorMessage) {
        return new CallOutcome(Status.ERROR, httpStatus, null, null,
                Objects.requireNonNull(errorCode, "errorCode"), errorMessage);
    }

    public Status status() {
        return status;
    }

    public int httpStatus() {
        return httpStatus;
    }

    public byte[] body() {
        return body;
    }

    public String contentType() {
        return contentType;
    }

    public String errorCode() {
        return errorCode;
    }

    public String errorMessage() {
        return errorMessage;
    }
}
