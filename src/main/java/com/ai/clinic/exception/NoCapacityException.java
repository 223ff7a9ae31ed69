package com.ai.clinic.exception;

/**
 * Recoverable: the caller may retry once a slot is freed or the queue drains.
 */
public class NoCapacityException extends ClinicException {

    public enum Reason { NO_FREE_SLOT, QUEUE_FULL }

    private final Reason reason;

    public NoCapacityException(Reason reason, String message) {
        super(reason.name(), message);
        this.reason = reason;
    }

    public Reason getReason() { return reason; }
}
