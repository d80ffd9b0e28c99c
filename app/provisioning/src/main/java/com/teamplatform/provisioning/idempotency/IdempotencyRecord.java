/*
 * どこで: Provisioning 冪等性台帳
 * 何を: Idempotency-Key ごとの予約/確定済みレスポンスを表す
 * なぜ: 同一キーの再送に保存済みレスポンスを返すため
 */
package com.teamplatform.provisioning.idempotency;

import com.fasterxml.jackson.annotation.JsonIgnore;
import java.time.Instant;

public record IdempotencyRecord(
        String key,
        String requestHash,
        IdempotencyStatus status,
        Integer responseStatus,
        String responseBody,
        Instant createdAt,
        Instant expiresAt) {

    @JsonIgnore
    public boolean isFinalized() {
        return status == IdempotencyStatus.FINALIZED;
    }
}
