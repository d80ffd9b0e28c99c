/*
 * どこで: Provisioning アプリの設定バインド
 * 何を: 資格情報の署名鍵・audience・有効期限を保持する
 * なぜ: audience の分離と有効期限の上限を運用で調整できるようにするため
 */
package com.teamplatform.provisioning.config;

import java.nio.charset.StandardCharsets;
import java.time.Duration;
import org.springframework.boot.context.properties.ConfigurationProperties;

@ConfigurationProperties(prefix = "auth")
public record AuthProperties(
    String issuer,
    String secret,
    String tenantAdminAudience,
    String tenantMemberAudience,
    String internalServiceAudience,
    String sessionCookieName,
    Duration clockSkew,
    Duration maxCredentialLifetime,
    Duration ownerCredentialTtl,
    Duration memberCredentialTtl,
    Duration internalServiceTtl,
    Duration magicLinkTtl) {

  private static final int MIN_SECRET_BYTES = 32;

  public AuthProperties {
    issuer = isBlank(issuer) ? "team-platform" : issuer;
    secret = secret == null ? "" : secret;
    tenantAdminAudience = isBlank(tenantAdminAudience) ? "tenant-admin" : tenantAdminAudience;
    tenantMemberAudience = isBlank(tenantMemberAudience) ? "tenant-member" : tenantMemberAudience;
    internalServiceAudience =
        isBlank(internalServiceAudience) ? "internal-service" : internalServiceAudience;
    sessionCookieName = isBlank(sessionCookieName) ? "owner_session" : sessionCookieName;
    clockSkew = clockSkew == null ? Duration.ofSeconds(10) : clockSkew;
    maxCredentialLifetime =
        maxCredentialLifetime == null ? Duration.ofDays(30) : maxCredentialLifetime;
    ownerCredentialTtl = ownerCredentialTtl == null ? Duration.ofDays(30) : ownerCredentialTtl;
    memberCredentialTtl = memberCredentialTtl == null ? Duration.ofDays(7) : memberCredentialTtl;
    internalServiceTtl = internalServiceTtl == null ? Duration.ofSeconds(30) : internalServiceTtl;
    magicLinkTtl = magicLinkTtl == null ? Duration.ofHours(24) : magicLinkTtl;
  }

  /** HS256 は 256bit 以上の鍵を要求する。 */
  public byte[] secretBytes() {
    final byte[] bytes = secret.getBytes(StandardCharsets.UTF_8);
    if (bytes.length < MIN_SECRET_BYTES) {
      throw new IllegalStateException("auth.secret must be at least 32 bytes");
    }
    return bytes;
  }

  private static boolean isBlank(String value) {
    return value == null || value.isBlank();
  }
}
