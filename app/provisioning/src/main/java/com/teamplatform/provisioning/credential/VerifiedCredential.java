/*
 * どこで: Provisioning 資格情報モデル
 * 何を: 署名・期限・audience を検証済みのクレームを保持する
 * なぜ: 認可判定と失効判定をトークン文字列ではなく正規化済みの値で行うため
 */
package com.teamplatform.provisioning.credential;

import java.time.Instant;
import java.util.List;

public record VerifiedCredential(
    String subject,
    String tenantId,
    CredentialAudience audience,
    List<String> roles,
    String jti,
    Instant issuedAt,
    Instant expiresAt,
    String email) {

  public static final String PLATFORM_TENANT = "system";

  public VerifiedCredential {
    roles = roles == null ? List.of() : List.copyOf(roles);
  }

  /** tenant を持たない、または system テナントの資格情報はプラットフォーム全体に効く。 */
  public boolean isPlatformScoped() {
    return tenantId == null || tenantId.isBlank() || PLATFORM_TENANT.equals(tenantId);
  }

  public boolean hasRole(String role) {
    return roles.contains(role);
  }

  public boolean hasAnyRole(List<String> candidates) {
    return candidates.stream().anyMatch(roles::contains);
  }
}
