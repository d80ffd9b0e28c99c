package com.teamplatform.provisioning.config;

import com.teamplatform.provisioning.credential.AuthorizationGate;
import com.teamplatform.provisioning.credential.CredentialRejectedException;
import com.teamplatform.provisioning.credential.TenantAccessDeniedException;
import com.teamplatform.provisioning.credential.VerifiedCredential;
import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.Cookie;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import java.io.IOException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;
import org.springframework.http.HttpHeaders;
import org.springframework.security.access.AccessDeniedException;
import org.springframework.security.authentication.BadCredentialsException;
import org.springframework.security.core.context.SecurityContextHolder;
import org.springframework.security.web.AuthenticationEntryPoint;
import org.springframework.security.web.access.AccessDeniedHandler;
import org.springframework.web.filter.OncePerRequestFilter;

/**
 * Bearer ヘッダまたはセッション cookie の資格情報を AuthorizationGate で検証し、SecurityContext に載せる。
 * /admin/ 配下は管理者資格情報 (requireAdmin) を要求する。
 * 資格情報が無いリクエストはそのまま通し、経路ごとの認可判定に任せる。
 */
public class CredentialAuthenticationFilter extends OncePerRequestFilter {

  private static final Logger logger = LoggerFactory.getLogger(CredentialAuthenticationFilter.class);

  private final AuthorizationGate authorizationGate;
  private final AuthenticationEntryPoint authenticationEntryPoint;
  private final AccessDeniedHandler accessDeniedHandler;
  private final String sessionCookieName;

  public CredentialAuthenticationFilter(
      AuthorizationGate authorizationGate,
      AuthenticationEntryPoint authenticationEntryPoint,
      AccessDeniedHandler accessDeniedHandler,
      String sessionCookieName) {
    this.authorizationGate = authorizationGate;
    this.authenticationEntryPoint = authenticationEntryPoint;
    this.accessDeniedHandler = accessDeniedHandler;
    this.sessionCookieName = sessionCookieName;
  }

  @Override
  protected boolean shouldNotFilter(HttpServletRequest request) {
    final String uri = request.getRequestURI();
    return uri != null && (uri.startsWith("/public/") || uri.startsWith("/actuator/"));
  }

  @Override
  protected void doFilterInternal(
      HttpServletRequest request, HttpServletResponse response, FilterChain filterChain)
      throws ServletException, IOException {
    final String authorizationHeader = request.getHeader(HttpHeaders.AUTHORIZATION);
    final String sessionCookie = resolveSessionCookie(request);
    if (isBlank(authorizationHeader) && isBlank(sessionCookie)) {
      filterChain.doFilter(request, response);
      return;
    }
    final VerifiedCredential credential;
    try {
      credential =
          isAdminPath(request)
              ? authorizationGate.requireAdmin(authorizationHeader, sessionCookie)
              : authorizationGate.requireAuthenticated(authorizationHeader, sessionCookie);
    } catch (CredentialRejectedException ex) {
      SecurityContextHolder.clearContext();
      logger.debug(
          "credential rejected path={} reason={}", request.getRequestURI(), ex.reason().code());
      authenticationEntryPoint.commence(
          request, response, new BadCredentialsException(ex.reason().code(), ex));
      return;
    } catch (TenantAccessDeniedException ex) {
      SecurityContextHolder.clearContext();
      logger.debug(
          "admin access denied path={} reason={}", request.getRequestURI(), ex.reason().code());
      accessDeniedHandler.handle(request, response, new AccessDeniedException(ex.getMessage(), ex));
      return;
    }
    SecurityContextHolder.getContext().setAuthentication(new CredentialAuthenticationToken(credential));
    if (credential.tenantId() != null) {
      MDC.put("tenant_id", credential.tenantId());
    }
    try {
      filterChain.doFilter(request, response);
    } finally {
      MDC.remove("tenant_id");
    }
  }

  private boolean isAdminPath(HttpServletRequest request) {
    final String uri = request.getRequestURI();
    return uri != null && uri.startsWith("/admin/");
  }

  private String resolveSessionCookie(HttpServletRequest request) {
    final Cookie[] cookies = request.getCookies();
    if (cookies == null) {
      return null;
    }
    for (Cookie cookie : cookies) {
      if (sessionCookieName.equals(cookie.getName())) {
        return cookie.getValue();
      }
    }
    return null;
  }

  private boolean isBlank(String value) {
    return value == null || value.isBlank();
  }
}
