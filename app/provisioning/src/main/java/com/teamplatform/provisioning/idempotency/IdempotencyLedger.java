/*
 * どこで: Provisioning 冪等性台帳
 * 何を: Idempotency-Key の予約・確定・解放と、保存済みレスポンスの再生を行う
 * なぜ: クライアントの再送や二度押しで副作用が重複しないようにするため
 */
package com.teamplatform.provisioning.idempotency;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.teamplatform.common.store.KeyValueStore;
import com.teamplatform.provisioning.config.IdempotencyProperties;
import com.teamplatform.provisioning.service.ProvisioningMetrics;
import java.time.Clock;
import java.time.Instant;
import java.util.Optional;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

@Component
@RequiredArgsConstructor
public class IdempotencyLedger {

    private static final Logger logger = LoggerFactory.getLogger(IdempotencyLedger.class);
    private static final String KEY_PREFIX = "idem:";

    private final KeyValueStore store;
    private final ObjectMapper objectMapper;
    private final IdempotencyProperties properties;
    private final ProvisioningMetrics metrics;
    private final Clock clock;

    /**
     * 役割: キーに対する処理を開始してよいか判定し、開始する場合は PENDING 予約を置く。
     *
     * <p>期待動作: キーが空なら毎回新規扱い。確定済みで同じハッシュなら保存済みレスポンスを返す。ハッシュが異なる場合や、
     * 別リクエストが処理中の場合は {@link IdempotencyConflictException} を送出する。
     */
    public IdempotencyDecision begin(String key, String requestHash) {
        if (isBlank(key)) {
            return IdempotencyDecision.proceed();
        }
        Optional<IdempotencyRecord> existing = read(key);
        if (existing.isPresent()) {
            return decide(existing.get(), requestHash);
        }
        Instant now = clock.instant();
        IdempotencyRecord reservation = new IdempotencyRecord(
                key,
                requestHash,
                IdempotencyStatus.PENDING,
                null,
                null,
                now,
                now.plus(properties.reservationTtl()));
        if (store.putIfAbsent(storeKey(key), serialize(reservation), properties.reservationTtl())) {
            metrics.recordIdempotency("reserved");
            return IdempotencyDecision.proceed();
        }
        // 予約の取り合いに負けた場合は、勝った側の記録で判定し直す
        IdempotencyRecord winner = read(key).orElseThrow(() -> new IdempotencyConflictException(
                IdempotencyConflictException.Reason.IN_PROGRESS, "Idempotency-Key request in progress"));
        return decide(winner, requestHash);
    }

    /** 処理結果を確定し、TTL の間は同じキーで再生できるようにする。 */
    public void commit(String key, String requestHash, int responseStatus, String responseBody) {
        if (isBlank(key)) {
            return;
        }
        Instant now = clock.instant();
        IdempotencyRecord finalized = new IdempotencyRecord(
                key,
                requestHash,
                IdempotencyStatus.FINALIZED,
                responseStatus,
                responseBody,
                now,
                now.plus(properties.ttl()));
        store.put(storeKey(key), serialize(finalized), properties.ttl());
    }

    /** 処理が失敗した場合に予約だけを外す。確定済みの記録は残す。 */
    public void release(String key) {
        if (isBlank(key)) {
            return;
        }
        Optional<IdempotencyRecord> existing = read(key);
        if (existing.isPresent() && !existing.get().isFinalized()) {
            store.delete(storeKey(key));
        }
    }

    private IdempotencyDecision decide(IdempotencyRecord record, String requestHash) {
        if (!record.requestHash().equals(requestHash)) {
            metrics.recordIdempotency("conflict");
            throw new IdempotencyConflictException(
                    IdempotencyConflictException.Reason.KEY_MISMATCH, "Idempotency-Key conflict");
        }
        if (!record.isFinalized()) {
            metrics.recordIdempotency("in_progress");
            throw new IdempotencyConflictException(
                    IdempotencyConflictException.Reason.IN_PROGRESS, "Idempotency-Key request in progress");
        }
        metrics.recordIdempotency("hit");
        return IdempotencyDecision.replay(record);
    }

    private Optional<IdempotencyRecord> read(String key) {
        return store.get(storeKey(key)).map(json -> deserialize(key, json));
    }

    private String storeKey(String key) {
        return KEY_PREFIX + key;
    }

    private String serialize(IdempotencyRecord record) {
        try {
            return objectMapper.writeValueAsString(record);
        } catch (JsonProcessingException ex) {
            throw new IllegalStateException("failed to serialize idempotency record", ex);
        }
    }

    private IdempotencyRecord deserialize(String key, String json) {
        try {
            return objectMapper.readValue(json, IdempotencyRecord.class);
        } catch (JsonProcessingException ex) {
            logger.error("idempotency record is unreadable key={}", key, ex);
            throw new IllegalStateException("idempotency record is unreadable", ex);
        }
    }

    private boolean isBlank(String value) {
        return value == null || value.isBlank();
    }
}
