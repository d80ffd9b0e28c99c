/*
 * どこで: Provisioning API
 * 何を: 例外を共通のエラーレスポンスと HTTP ステータスへ変換する
 * なぜ: 認可の詳細な拒否理由はログとメトリクスにだけ残し、応答には汎用コードを返すため
 */
package com.teamplatform.provisioning.api;

import com.teamplatform.common.store.StoreUnavailableException;
import com.teamplatform.provisioning.actor.ProvisioningConflictException;
import com.teamplatform.provisioning.credential.CredentialRejectedException;
import com.teamplatform.provisioning.credential.TenantAccessDeniedException;
import com.teamplatform.provisioning.idempotency.IdempotencyConflictException;
import com.teamplatform.provisioning.service.ProvisioningFailedException;
import com.teamplatform.provisioning.service.SignupRejectedException;
import com.teamplatform.provisioning.tenant.TenantNotFoundException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.validation.FieldError;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

@RestControllerAdvice
public class ApiExceptionHandler {

  private static final Logger logger = LoggerFactory.getLogger(ApiExceptionHandler.class);

  @ExceptionHandler(MethodArgumentNotValidException.class)
  public ResponseEntity<ApiErrorResponse> handleValidation(MethodArgumentNotValidException ex) {
    final FieldError fieldError = ex.getBindingResult().getFieldError();
    final String message =
        fieldError == null || fieldError.getDefaultMessage() == null
            ? "Validation failed"
            : fieldError.getDefaultMessage();
    return error(HttpStatus.BAD_REQUEST, ApiErrorCode.INVALID_REQUEST, message);
  }

  @ExceptionHandler(HttpMessageNotReadableException.class)
  public ResponseEntity<ApiErrorResponse> handleUnreadable(HttpMessageNotReadableException ex) {
    return error(HttpStatus.BAD_REQUEST, ApiErrorCode.INVALID_REQUEST, "request body is invalid");
  }

  @ExceptionHandler(IllegalArgumentException.class)
  public ResponseEntity<ApiErrorResponse> handleIllegalArgument(IllegalArgumentException ex) {
    return error(HttpStatus.BAD_REQUEST, ApiErrorCode.INVALID_REQUEST, ex.getMessage());
  }

  @ExceptionHandler(MissingTenantIdException.class)
  public ResponseEntity<ApiErrorResponse> handleMissingTenantId(MissingTenantIdException ex) {
    return error(HttpStatus.BAD_REQUEST, ApiErrorCode.MISSING_TENANT_ID, ex.getMessage());
  }

  @ExceptionHandler(SignupRejectedException.class)
  public ResponseEntity<ApiErrorResponse> handleSignupRejected(SignupRejectedException ex) {
    return error(HttpStatus.BAD_REQUEST, ex.code(), ex.getMessage());
  }

  @ExceptionHandler(CredentialRejectedException.class)
  public ResponseEntity<ApiErrorResponse> handleCredentialRejected(CredentialRejectedException ex) {
    return error(HttpStatus.UNAUTHORIZED, ApiErrorCode.UNAUTHORIZED, "authentication required");
  }

  @ExceptionHandler(TenantAccessDeniedException.class)
  public ResponseEntity<ApiErrorResponse> handleAccessDenied(TenantAccessDeniedException ex) {
    return error(HttpStatus.FORBIDDEN, ApiErrorCode.FORBIDDEN, "access denied");
  }

  @ExceptionHandler(TenantNotFoundException.class)
  public ResponseEntity<ApiErrorResponse> handleTenantNotFound(TenantNotFoundException ex) {
    return error(HttpStatus.NOT_FOUND, ApiErrorCode.TENANT_NOT_FOUND, ex.getMessage());
  }

  @ExceptionHandler(IdempotencyConflictException.class)
  public ResponseEntity<ApiErrorResponse> handleIdempotencyConflict(
      IdempotencyConflictException ex) {
    final ApiErrorCode code =
        switch (ex.reason()) {
          case KEY_MISMATCH -> ApiErrorCode.IDEMPOTENCY_KEY_CONFLICT;
          case IN_PROGRESS -> ApiErrorCode.IDEMPOTENCY_REQUEST_IN_PROGRESS;
        };
    return error(HttpStatus.CONFLICT, code, ex.getMessage());
  }

  @ExceptionHandler(ProvisioningConflictException.class)
  public ResponseEntity<ApiErrorResponse> handleProvisioningConflict(
      ProvisioningConflictException ex) {
    return error(HttpStatus.CONFLICT, ApiErrorCode.PROVISIONING_CONFLICT, ex.getMessage());
  }

  @ExceptionHandler(ProvisioningFailedException.class)
  public ResponseEntity<ApiErrorResponse> handleProvisioningFailed(ProvisioningFailedException ex) {
    return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR)
        .body(
            ApiErrorResponse.withAttempts(
                ApiErrorCode.PROVISIONING_FAILED, ex.getMessage(), ex.attempts()));
  }

  @ExceptionHandler(StoreUnavailableException.class)
  public ResponseEntity<ApiErrorResponse> handleStoreUnavailable(StoreUnavailableException ex) {
    logger.error("key-value store unavailable", ex);
    return error(
        HttpStatus.SERVICE_UNAVAILABLE, ApiErrorCode.STORE_UNAVAILABLE, "store unavailable");
  }

  private ResponseEntity<ApiErrorResponse> error(
      HttpStatus status, ApiErrorCode code, String message) {
    return ResponseEntity.status(status).body(ApiErrorResponse.of(code, message));
  }
}
