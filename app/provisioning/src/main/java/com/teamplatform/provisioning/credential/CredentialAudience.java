/*
 * どこで: Provisioning 資格情報モデル
 * 何を: 資格情報の audience 種別と JWT aud 値の対応を定義する
 * なぜ: ある audience 向けに発行したトークンを別 audience の検査で通さないため
 */
package com.teamplatform.provisioning.credential;

import com.teamplatform.provisioning.config.AuthProperties;
import java.util.Collection;
import java.util.Optional;

public enum CredentialAudience {
  TENANT_ADMIN,
  TENANT_MEMBER,
  INTERNAL_SERVICE;

  public String claimValue(AuthProperties properties) {
    return switch (this) {
      case TENANT_ADMIN -> properties.tenantAdminAudience();
      case TENANT_MEMBER -> properties.tenantMemberAudience();
      case INTERNAL_SERVICE -> properties.internalServiceAudience();
    };
  }

  /** aud クレームに含まれる既知の audience を宣言順で 1 件返す。 */
  public static Optional<CredentialAudience> fromClaims(
      Collection<String> audiences, AuthProperties properties) {
    if (audiences == null) {
      return Optional.empty();
    }
    for (CredentialAudience candidate : values()) {
      if (audiences.contains(candidate.claimValue(properties))) {
        return Optional.of(candidate);
      }
    }
    return Optional.empty();
  }
}
