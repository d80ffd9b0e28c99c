/*
 * どこで: Provisioning セキュリティ設定
 * 何を: 401/403 を共通エラーフォーマットの JSON で書き出す
 * なぜ: 失敗理由の詳細をレスポンスに出さず、ログ側だけに残すため
 */
package com.teamplatform.provisioning.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.teamplatform.provisioning.api.ApiErrorCode;
import com.teamplatform.provisioning.api.ApiErrorResponse;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import java.io.IOException;
import org.springframework.http.MediaType;
import org.springframework.security.access.AccessDeniedException;
import org.springframework.security.core.AuthenticationException;
import org.springframework.security.web.AuthenticationEntryPoint;
import org.springframework.security.web.access.AccessDeniedHandler;

public class JsonSecurityErrorHandler implements AuthenticationEntryPoint, AccessDeniedHandler {

  private final ObjectMapper objectMapper;

  public JsonSecurityErrorHandler(ObjectMapper objectMapper) {
    this.objectMapper = objectMapper;
  }

  @Override
  public void commence(
      HttpServletRequest request,
      HttpServletResponse response,
      AuthenticationException authException)
      throws IOException {
    write(
        response,
        HttpServletResponse.SC_UNAUTHORIZED,
        ApiErrorResponse.of(ApiErrorCode.UNAUTHORIZED, "authentication required"));
  }

  @Override
  public void handle(
      HttpServletRequest request,
      HttpServletResponse response,
      AccessDeniedException accessDeniedException)
      throws IOException {
    write(
        response,
        HttpServletResponse.SC_FORBIDDEN,
        ApiErrorResponse.of(ApiErrorCode.FORBIDDEN, "access denied"));
  }

  private void write(HttpServletResponse response, int status, ApiErrorResponse body)
      throws IOException {
    response.setStatus(status);
    response.setContentType(MediaType.APPLICATION_JSON_VALUE);
    objectMapper.writeValue(response.getOutputStream(), body);
  }
}
