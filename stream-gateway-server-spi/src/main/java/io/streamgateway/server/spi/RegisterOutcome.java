package io.streamgateway.server.spi;

import java.util.Objects;

/**
 * Result of a register operation.
 */
public final class RegisterOutcome {
    public enum Status {
        REGISTERED,
        NAME_TAKEN
    }

    private final Status status;
    private final Registration registration;

    public RegisterOutcome(Status status, Registration registration) {
        this.status = Objects.requireNonNull(status, "status");
        this.registration = Objects.requireNonNull(registration, "registration");
    }

    public Status status() {
        return status;
    }

    /**
     * The new registration, or the existing one when the name was taken.
     */
    public Registration registration() {
        return registration;
    }
}
