/*
 * どこで: Provisioning 認可
 * 何を: 資格情報の検証と失効判定を合成し、管理者・テナント範囲の認可判定を提供する
 * なぜ: テナントを変更する処理の前に、同期的かつ副作用無しで権限を確定させるため
 */
package com.teamplatform.provisioning.credential;

import com.teamplatform.provisioning.revocation.RevocationLedger;
import com.teamplatform.provisioning.service.ProvisioningMetrics;
import java.util.List;
import java.util.Optional;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

@Component
@RequiredArgsConstructor
public class AuthorizationGate {

  private static final Logger logger = LoggerFactory.getLogger(AuthorizationGate.class);

  private static final List<String> TENANT_ADMIN_ROLES = List.of("admin", "tenant_admin", "owner");
  private static final List<String> PLATFORM_ADMIN_ROLES = List.of("admin", "platform_admin");

  private final CredentialVerifier verifier;
  private final RevocationLedger revocationLedger;
  private final ProvisioningMetrics metrics;

  /** 署名・期限・audience の検証に失効判定を重ねる。expectedAudience が null なら任意の audience を受け付ける。 */
  public VerifiedCredential verify(String token, CredentialAudience expectedAudience) {
    final VerifiedCredential credential;
    try {
      credential = verifier.verify(token, expectedAudience);
    } catch (CredentialRejectedException ex) {
      deny(ex.reason().code(), null, null);
      throw ex;
    }
    if (revocationLedger.isRevoked(credential)) {
      deny(CredentialRejectedException.Reason.REVOKED.code(), credential, null);
      throw new CredentialRejectedException(
          CredentialRejectedException.Reason.REVOKED, "credential has been revoked");
    }
    return credential;
  }

  /** 任意の audience の有効な資格情報を要求する。Bearer ヘッダを優先し、無ければセッション cookie のトークンを使う。 */
  public VerifiedCredential requireAuthenticated(String authorizationHeader, String sessionCookie) {
    return verify(resolveToken(authorizationHeader, sessionCookie), null);
  }

  /** tenant-admin audience と admin ロールを要求する。トークンの取り出し順は requireAuthenticated と同じ。 */
  public VerifiedCredential requireAdmin(String authorizationHeader, String sessionCookie) {
    final VerifiedCredential credential =
        verify(resolveToken(authorizationHeader, sessionCookie), CredentialAudience.TENANT_ADMIN);
    return requireAdmin(credential);
  }

  private VerifiedCredential requireAdmin(VerifiedCredential credential) {
    if (credential.audience() != CredentialAudience.TENANT_ADMIN) {
      deny(CredentialRejectedException.Reason.WRONG_AUDIENCE.code(), credential, null);
      throw new CredentialRejectedException(
          CredentialRejectedException.Reason.WRONG_AUDIENCE, "admin audience required");
    }
    if (!credential.hasRole("admin")) {
      deny(TenantAccessDeniedException.Reason.ROLE_MISMATCH.code(), credential, null);
      throw new TenantAccessDeniedException(
          TenantAccessDeniedException.Reason.ROLE_MISMATCH, "admin role required");
    }
    return credential;
  }

  /**
   * 役割: テナント範囲の操作を許可してよいか判定する。
   *
   * <p>期待動作: プラットフォーム管理者は無条件に通す。テナント管理者は埋め込まれた tenant が一致し、admin / tenant_admin /
   * owner のいずれかを持つ場合のみ通す。どちらで通ったかを返す。
   */
  public AuthorizationScope requireTenantOrPlatform(VerifiedCredential credential, String tenantId) {
    if (credential.audience() != CredentialAudience.TENANT_ADMIN) {
      deny(TenantAccessDeniedException.Reason.WRONG_AUDIENCE.code(), credential, tenantId);
      throw new TenantAccessDeniedException(
          TenantAccessDeniedException.Reason.WRONG_AUDIENCE, "admin audience required");
    }
    if (credential.isPlatformScoped()) {
      if (!credential.hasAnyRole(PLATFORM_ADMIN_ROLES)) {
        deny(TenantAccessDeniedException.Reason.ROLE_MISMATCH.code(), credential, tenantId);
        throw new TenantAccessDeniedException(
            TenantAccessDeniedException.Reason.ROLE_MISMATCH, "platform admin role required");
      }
      grant(AuthorizationScope.PLATFORM_ADMIN, credential, tenantId);
      return AuthorizationScope.PLATFORM_ADMIN;
    }
    if (tenantId == null || !tenantId.equals(credential.tenantId())) {
      deny(TenantAccessDeniedException.Reason.TENANT_MISMATCH.code(), credential, tenantId);
      throw new TenantAccessDeniedException(
          TenantAccessDeniedException.Reason.TENANT_MISMATCH, "tenant mismatch");
    }
    if (!credential.hasAnyRole(TENANT_ADMIN_ROLES)) {
      deny(TenantAccessDeniedException.Reason.ROLE_MISMATCH.code(), credential, tenantId);
      throw new TenantAccessDeniedException(
          TenantAccessDeniedException.Reason.ROLE_MISMATCH, "tenant admin role required");
    }
    grant(AuthorizationScope.TENANT_ADMIN, credential, tenantId);
    return AuthorizationScope.TENANT_ADMIN;
  }

  private String resolveToken(String authorizationHeader, String sessionCookie) {
    final Optional<String> bearer = BearerTokens.extract(authorizationHeader);
    if (bearer.isPresent()) {
      return bearer.get();
    }
    return sessionCookie == null || sessionCookie.isBlank() ? null : sessionCookie;
  }

  private void grant(AuthorizationScope scope, VerifiedCredential credential, String tenantId) {
    metrics.recordAuthorization("grant", scope.code());
    logger.info(
        "authz_grant scope={} subject={} credentialTenantId={} targetTenantId={}",
        scope.code(),
        credential.subject(),
        credential.tenantId(),
        tenantId);
  }

  private void deny(String reason, VerifiedCredential credential, String tenantId) {
    metrics.recordAuthorization("deny", reason);
    logger.warn(
        "authz_deny reason={} subject={} credentialTenantId={} targetTenantId={}",
        reason,
        credential == null ? null : credential.subject(),
        credential == null ? null : credential.tenantId(),
        tenantId);
  }
}
