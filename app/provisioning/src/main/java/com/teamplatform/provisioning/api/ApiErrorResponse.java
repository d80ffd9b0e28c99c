/*
 * どこで: Provisioning API
 * 何を: エラーレスポンスの共通フォーマットを定義する
 * なぜ: クライアントが success フラグとコードでエラー原因を識別できるようにするため
 */
package com.teamplatform.provisioning.api;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;

@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record ApiErrorResponse(boolean success, ApiError error) {

  public static ApiErrorResponse of(ApiErrorCode code, String message) {
    return new ApiErrorResponse(false, new ApiError(code, message, null));
  }

  public static ApiErrorResponse withAttempts(ApiErrorCode code, String message, int attempts) {
    return new ApiErrorResponse(false, new ApiError(code, message, attempts));
  }

  @JsonInclude(JsonInclude.Include.NON_NULL)
  public record ApiError(ApiErrorCode code, String message, Integer attempts) {}
}
