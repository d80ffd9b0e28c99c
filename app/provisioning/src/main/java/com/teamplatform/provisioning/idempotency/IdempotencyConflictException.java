package com.teamplatform.provisioning.idempotency;

public class IdempotencyConflictException extends RuntimeException {

    public enum Reason {
        KEY_MISMATCH,
        IN_PROGRESS
    }

    private final Reason reason;

    public IdempotencyConflictException(Reason reason, String message) {
        super(message);
        this.reason = reason;
    }

    public Reason reason() {
        return reason;
    }
}
