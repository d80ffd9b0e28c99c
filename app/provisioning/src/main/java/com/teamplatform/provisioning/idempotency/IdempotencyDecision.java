package com.teamplatform.provisioning.idempotency;

/** begin の結果。hit が true の場合は record のレスポンスをそのまま返す。 */
public record IdempotencyDecision(boolean hit, IdempotencyRecord record) {

    private static final IdempotencyDecision PROCEED = new IdempotencyDecision(false, null);

    public static IdempotencyDecision proceed() {
        return PROCEED;
    }

    public static IdempotencyDecision replay(IdempotencyRecord record) {
        return new IdempotencyDecision(true, record);
    }
}
