package com.teamplatform.provisioning.idempotency;

public enum IdempotencyStatus {
    PENDING,
    FINALIZED
}
