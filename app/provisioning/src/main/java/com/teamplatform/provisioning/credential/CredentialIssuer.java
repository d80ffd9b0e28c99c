/*
 * どこで: Provisioning 資格情報
 * 何を: audience ごとに署名付き JWT を発行する
 * なぜ: テナント管理者・メンバー・内部サービスの資格情報を同じ鍵と期限ルールで発行するため
 */
package com.teamplatform.provisioning.credential;

import com.teamplatform.provisioning.config.AuthProperties;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.UUID;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.security.oauth2.jose.jws.MacAlgorithm;
import org.springframework.security.oauth2.jwt.JwsHeader;
import org.springframework.security.oauth2.jwt.JwtClaimsSet;
import org.springframework.security.oauth2.jwt.JwtEncoder;
import org.springframework.security.oauth2.jwt.JwtEncoderParameters;
import org.springframework.stereotype.Component;

@Component
@RequiredArgsConstructor
public class CredentialIssuer {

  private static final Logger logger = LoggerFactory.getLogger(CredentialIssuer.class);

  static final String CLAIM_TENANT_ID = "tenant_id";
  static final String CLAIM_ROLES = "roles";
  static final String CLAIM_EMAIL = "email";

  private static final List<String> TENANT_ADMIN_ROLES = List.of("admin", "tenant_admin");
  private static final List<String> PLATFORM_ADMIN_ROLES = List.of("admin", "platform_admin");
  private static final List<String> MAGIC_LINK_ROLES = List.of("owner", "admin");
  private static final List<String> DEFAULT_MEMBER_ROLES = List.of("tenant_member");
  private static final List<String> SERVICE_ROLES = List.of("service");

  private final JwtEncoder jwtEncoder;
  private final AuthProperties properties;
  private final Clock clock;

  /**
   * 役割: 指定 audience の資格情報を発行する。
   *
   * <p>期待動作: ttl は最大有効期限で頭打ちにする。jti は毎回新しく採番する。
   */
  public IssuedCredential issue(CredentialAudience audience, CredentialClaims claims, Duration ttl) {
    if (audience == null) {
      throw new IllegalArgumentException("audience is required");
    }
    if (ttl == null || ttl.isZero() || ttl.isNegative()) {
      throw new IllegalArgumentException("ttl must be positive");
    }
    final Duration effectiveTtl =
        ttl.compareTo(properties.maxCredentialLifetime()) > 0
            ? properties.maxCredentialLifetime()
            : ttl;
    final Instant issuedAt = clock.instant();
    final Instant expiresAt = issuedAt.plus(effectiveTtl);
    final String jti = UUID.randomUUID().toString();

    final JwtClaimsSet.Builder builder =
        JwtClaimsSet.builder()
            .issuer(properties.issuer())
            .subject(claims.subject())
            .audience(List.of(audience.claimValue(properties)))
            .issuedAt(issuedAt)
            .expiresAt(expiresAt)
            .id(jti)
            .claim(CLAIM_ROLES, claims.roles());
    if (claims.tenantId() != null && !claims.tenantId().isBlank()) {
      builder.claim(CLAIM_TENANT_ID, claims.tenantId());
    }
    if (claims.email() != null && !claims.email().isBlank()) {
      builder.claim(CLAIM_EMAIL, claims.email());
    }
    final JwsHeader header = JwsHeader.with(MacAlgorithm.HS256).build();
    final String token =
        jwtEncoder.encode(JwtEncoderParameters.from(header, builder.build())).getTokenValue();
    logger.debug(
        "credential issued audience={} tenantId={} jti={} expiresAt={}",
        audience,
        claims.tenantId(),
        jti,
        expiresAt);
    return new IssuedCredential(token, jti, audience, issuedAt, expiresAt);
  }

  public IssuedCredential issueTenantAdmin(String tenantId, String subject, String email) {
    requireTenant(tenantId);
    return issue(
        CredentialAudience.TENANT_ADMIN,
        new CredentialClaims(subject, tenantId, TENANT_ADMIN_ROLES, email),
        properties.ownerCredentialTtl());
  }

  public IssuedCredential issuePlatformAdmin(String subject, Duration ttl) {
    return issue(
        CredentialAudience.TENANT_ADMIN,
        new CredentialClaims(subject, null, PLATFORM_ADMIN_ROLES, null),
        ttl);
  }

  public IssuedCredential issueTenantMember(String tenantId, String subject, List<String> roles) {
    requireTenant(tenantId);
    final List<String> effectiveRoles = roles == null || roles.isEmpty() ? DEFAULT_MEMBER_ROLES : roles;
    return issue(
        CredentialAudience.TENANT_MEMBER,
        new CredentialClaims(subject, tenantId, effectiveRoles, null),
        properties.memberCredentialTtl());
  }

  /** 内部サービス間の呼び出し用。既定で数十秒しか有効でない。 */
  public IssuedCredential issueInternalService(String serviceName) {
    return issue(
        CredentialAudience.INTERNAL_SERVICE,
        new CredentialClaims(serviceName, null, SERVICE_ROLES, null),
        properties.internalServiceTtl());
  }

  /** オーナー向けオンボーディングリンクに載せる管理者資格情報。 */
  public IssuedCredential issueMagicLink(String tenantId, String email) {
    requireTenant(tenantId);
    return issue(
        CredentialAudience.TENANT_ADMIN,
        new CredentialClaims(email, tenantId, MAGIC_LINK_ROLES, email),
        properties.magicLinkTtl());
  }

  private void requireTenant(String tenantId) {
    if (tenantId == null || tenantId.isBlank()) {
      throw new IllegalArgumentException("tenantId is required");
    }
  }
}
