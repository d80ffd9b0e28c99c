/*
 * どこで: Provisioning サービス層
 * 何を: 管理者による失効 (トークン / プリンシパル / テナント) の登録と一覧を行う
 * なぜ: 漏えいや退会に対して、発行済みの資格情報を即座に無効化できるようにするため
 */
package com.teamplatform.provisioning.service;

import com.teamplatform.provisioning.api.request.RevocationRequest;
import com.teamplatform.provisioning.credential.CredentialRejectedException;
import com.teamplatform.provisioning.credential.CredentialVerifier;
import com.teamplatform.provisioning.credential.TenantAccessDeniedException;
import com.teamplatform.provisioning.credential.VerifiedCredential;
import com.teamplatform.provisioning.revocation.RevocationEntry;
import com.teamplatform.provisioning.revocation.RevocationLedger;
import com.teamplatform.provisioning.revocation.RevocationLevel;
import java.time.Duration;
import java.util.List;
import java.util.Locale;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

@Service
@RequiredArgsConstructor
public class RevocationAdminService {

  private static final Logger logger = LoggerFactory.getLogger(RevocationAdminService.class);

  private final RevocationLedger revocationLedger;
  private final CredentialVerifier credentialVerifier;

  /**
   * 役割: 管理者の要求で失効エントリを登録する。
   *
   * <p>前提: 呼び出し元は tenantId に対するテナント管理者またはプラットフォーム管理者として認可済み。テナント全体の失効と jti だけを指定したトークン失効はプラットフォーム管理者のみ。
   */
  public RevocationEntry revoke(
      String tenantId, RevocationRequest request, VerifiedCredential requester) {
    final Duration ttl =
        request.ttlSeconds() == null ? null : Duration.ofSeconds(request.ttlSeconds());
    final RevocationEntry entry =
        switch (request.level().toLowerCase(Locale.ROOT)) {
          case "token" -> revokeToken(tenantId, request, requester, ttl);
          case "principal" -> {
            requireValue(request.subject(), "subject is required for principal revocation");
            yield revocationLedger.revokePrincipal(tenantId, request.subject(), request.reason(), ttl);
          }
          case "tenant" -> {
            if (!requester.isPlatformScoped()) {
              throw new TenantAccessDeniedException(
                  TenantAccessDeniedException.Reason.ROLE_MISMATCH,
                  "tenant revocation requires platform admin");
            }
            yield revocationLedger.revokeTenant(tenantId, request.reason(), ttl);
          }
          default -> throw new IllegalArgumentException("level must be token, principal or tenant");
        };
    logger.info(
        "revocation requested by subject={} tenantId={} level={}",
        requester.subject(),
        tenantId,
        entry.level());
    return entry;
  }

  /**
   * token があれば検証して jti と所属テナントを確かめる。jti だけの指定は所属を確かめられないため、プラットフォーム管理者に限る。
   */
  private RevocationEntry revokeToken(
      String tenantId, RevocationRequest request, VerifiedCredential requester, Duration ttl) {
    if (request.token() != null && !request.token().isBlank()) {
      final VerifiedCredential target = verifyTarget(request.token());
      if (!tenantId.equals(target.tenantId())) {
        throw new TenantAccessDeniedException(
            TenantAccessDeniedException.Reason.TENANT_MISMATCH, "token belongs to another tenant");
      }
      if (request.jti() != null && !request.jti().isBlank() && !request.jti().equals(target.jti())) {
        throw new IllegalArgumentException("jti does not match token");
      }
      return revocationLedger.revokeToken(
          target.jti(), tenantId, target.subject(), target.expiresAt(), request.reason());
    }
    requireValue(request.jti(), "token or jti is required for token revocation");
    if (!requester.isPlatformScoped()) {
      throw new TenantAccessDeniedException(
          TenantAccessDeniedException.Reason.ROLE_MISMATCH,
          "revoking by jti alone requires platform admin");
    }
    // 対象トークンの期限が分からないため、ttl 省略時は最大有効期限まで保持する
    return revocationLedger.revoke(
        RevocationLevel.TOKEN, request.jti(), tenantId, request.subject(), request.reason(), ttl);
  }

  private VerifiedCredential verifyTarget(String token) {
    try {
      return credentialVerifier.verify(token, null);
    } catch (CredentialRejectedException ex) {
      throw new IllegalArgumentException("token is invalid or expired: " + ex.reason().code(), ex);
    }
  }

  public List<RevocationEntry> list(String tenantId, Integer limit) {
    return revocationLedger.list(tenantId, limit == null ? 0 : limit);
  }

  private void requireValue(String value, String message) {
    if (value == null || value.isBlank()) {
      throw new IllegalArgumentException(message);
    }
  }
}
