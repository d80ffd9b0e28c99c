/*
 * どこで: Provisioning 資格情報
 * 何を: JWT の署名・有効期限・audience を検証し、クレームを正規化する
 * なぜ: 失敗理由を区別してログ/メトリクスに残しつつ、応答では汎用 401 に畳むため
 */
package com.teamplatform.provisioning.credential;

import com.nimbusds.jose.JWSAlgorithm;
import com.nimbusds.jwt.SignedJWT;
import com.teamplatform.provisioning.config.AuthProperties;
import java.text.ParseException;
import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Optional;
import lombok.RequiredArgsConstructor;
import org.springframework.security.oauth2.jwt.BadJwtException;
import org.springframework.security.oauth2.jwt.Jwt;
import org.springframework.security.oauth2.jwt.JwtDecoder;
import org.springframework.security.oauth2.jwt.JwtException;
import org.springframework.stereotype.Component;

@Component
@RequiredArgsConstructor
public class CredentialVerifier {

  private final JwtDecoder jwtDecoder;
  private final AuthProperties properties;
  private final Clock clock;

  /**
   * 役割: トークンを検証し、正規化済みクレームを返す。
   *
   * <p>期待動作: expectedAudience が null の場合は既知の audience のいずれかを要求する。失効判定はここでは行わない。
   */
  public VerifiedCredential verify(String token, CredentialAudience expectedAudience) {
    if (token == null || token.isBlank()) {
      throw new CredentialRejectedException(
          CredentialRejectedException.Reason.MISSING_CREDENTIAL, "credential is missing");
    }
    requireHmacSignedStructure(token);
    final Jwt jwt = decode(token);

    final Instant now = clock.instant();
    final Instant expiresAt = jwt.getExpiresAt();
    final Instant issuedAt = jwt.getIssuedAt();
    if (expiresAt == null) {
      throw rejected(CredentialRejectedException.Reason.MALFORMED, "exp claim is missing");
    }
    if (now.isAfter(expiresAt.plus(properties.clockSkew()))) {
      throw rejected(CredentialRejectedException.Reason.EXPIRED, "credential expired");
    }
    if (issuedAt != null && issuedAt.isAfter(now.plus(properties.clockSkew()))) {
      throw rejected(CredentialRejectedException.Reason.MALFORMED, "credential issued in the future");
    }

    final List<String> audiences = jwt.getAudience();
    final CredentialAudience audience = resolveAudience(audiences, expectedAudience);

    final String subject = jwt.getSubject();
    if (subject == null || subject.isBlank()) {
      throw rejected(CredentialRejectedException.Reason.MALFORMED, "sub claim is missing");
    }
    final String jti = jwt.getId();
    if (jti == null || jti.isBlank()) {
      throw rejected(CredentialRejectedException.Reason.MALFORMED, "jti claim is missing");
    }
    return new VerifiedCredential(
        subject,
        resolveTenantId(jwt),
        audience,
        resolveRoles(jwt),
        jti,
        issuedAt,
        expiresAt,
        jwt.getClaimAsString(CredentialIssuer.CLAIM_EMAIL));
  }

  private void requireHmacSignedStructure(String token) {
    final SignedJWT parsed;
    try {
      parsed = SignedJWT.parse(token);
    } catch (ParseException ex) {
      throw new CredentialRejectedException(
          CredentialRejectedException.Reason.MALFORMED, "credential is not a signed JWT", ex);
    }
    if (!JWSAlgorithm.HS256.equals(parsed.getHeader().getAlgorithm())) {
      throw rejected(
          CredentialRejectedException.Reason.INVALID_SIGNATURE, "unexpected signing algorithm");
    }
  }

  private Jwt decode(String token) {
    try {
      return jwtDecoder.decode(token);
    } catch (BadJwtException ex) {
      throw new CredentialRejectedException(
          CredentialRejectedException.Reason.INVALID_SIGNATURE, "signature verification failed", ex);
    } catch (JwtException ex) {
      throw new CredentialRejectedException(
          CredentialRejectedException.Reason.MALFORMED, "credential could not be decoded", ex);
    }
  }

  private CredentialAudience resolveAudience(
      List<String> audiences, CredentialAudience expectedAudience) {
    if (expectedAudience != null) {
      if (audiences == null || !audiences.contains(expectedAudience.claimValue(properties))) {
        throw rejected(CredentialRejectedException.Reason.WRONG_AUDIENCE, "audience mismatch");
      }
      return expectedAudience;
    }
    return CredentialAudience.fromClaims(audiences, properties)
        .orElseThrow(
            () -> rejected(CredentialRejectedException.Reason.WRONG_AUDIENCE, "unknown audience"));
  }

  // tenant_id / tenantId / tenant のどれで来ても同じ値として扱う
  private String resolveTenantId(Jwt jwt) {
    return Optional.ofNullable(jwt.getClaimAsString(CredentialIssuer.CLAIM_TENANT_ID))
        .or(() -> Optional.ofNullable(jwt.getClaimAsString("tenantId")))
        .or(() -> Optional.ofNullable(jwt.getClaimAsString("tenant")))
        .filter(value -> !value.isBlank())
        .orElse(null);
  }

  private List<String> resolveRoles(Jwt jwt) {
    final Object rawRoles = jwt.getClaim(CredentialIssuer.CLAIM_ROLES);
    final List<String> roles = new ArrayList<>();
    if (rawRoles instanceof Collection<?> values) {
      for (Object value : values) {
        if (value != null && !value.toString().isBlank()) {
          roles.add(value.toString());
        }
      }
      return roles;
    }
    final String singleRole = jwt.getClaimAsString("role");
    if (singleRole != null && !singleRole.isBlank()) {
      roles.add(singleRole);
    }
    return roles;
  }

  private CredentialRejectedException rejected(
      CredentialRejectedException.Reason reason, String message) {
    return new CredentialRejectedException(reason, message);
  }
}
