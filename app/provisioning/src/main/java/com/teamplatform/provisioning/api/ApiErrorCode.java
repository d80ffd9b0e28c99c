/*
 * どこで: Provisioning API
 * 何を: エラー応答のコードを定義する
 * なぜ: 同じ HTTP ステータスでも原因を区別できるようにするため
 */
package com.teamplatform.provisioning.api;

public enum ApiErrorCode {
  INVALID_REQUEST,
  SLUG_TAKEN,
  EMAIL_EXISTS,
  MISSING_TENANT_ID,
  UNAUTHORIZED,
  FORBIDDEN,
  TENANT_NOT_FOUND,
  IDEMPOTENCY_KEY_CONFLICT,
  IDEMPOTENCY_REQUEST_IN_PROGRESS,
  PROVISIONING_CONFLICT,
  PROVISIONING_FAILED,
  STORE_UNAVAILABLE
}
