/*
 * どこで: Provisioning 失効台帳
 * 何を: トークン/主体/テナント単位の失効エントリを TTL 付きで保存し、資格情報の失効を判定する
 * なぜ: 発行済み資格情報をリクエスト間の調整無しに即時無効化するため
 */
package com.teamplatform.provisioning.revocation;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.teamplatform.common.store.KeyValueStore;
import com.teamplatform.common.store.StoreUnavailableException;
import com.teamplatform.provisioning.config.AuthProperties;
import com.teamplatform.provisioning.config.RevocationProperties;
import com.teamplatform.provisioning.credential.VerifiedCredential;
import com.teamplatform.provisioning.service.ProvisioningMetrics;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

@Component
@RequiredArgsConstructor
public class RevocationLedger {

  private static final Logger logger = LoggerFactory.getLogger(RevocationLedger.class);
  private static final String PLATFORM_SCOPE = "platform";
  private static final String INDEX_PREFIX = "jwt:revoked:index:";
  private static final int SCAN_LIMIT = 10_000;

  private final KeyValueStore store;
  private final ObjectMapper objectMapper;
  private final AuthProperties authProperties;
  private final RevocationProperties properties;
  private final ProvisioningMetrics metrics;
  private final Clock clock;

  /**
   * 役割: 失効エントリを書き込む。
   *
   * <p>期待動作: ttl が null の場合は資格情報の最大有効期限を使う。どの ttl も最大有効期限で頭打ちにするため、台帳は自然に縮む。
   */
  public RevocationEntry revoke(
      RevocationLevel level,
      String scopeKey,
      String tenantId,
      String subject,
      String reason,
      Duration ttl) {
    if (level == null) {
      throw new IllegalArgumentException("level is required");
    }
    if (scopeKey == null || scopeKey.isBlank()) {
      throw new IllegalArgumentException("scopeKey is required");
    }
    final Duration effectiveTtl = clampTtl(ttl);
    final Instant now = clock.instant();
    final RevocationEntry entry =
        new RevocationEntry(
            level,
            scopeKey,
            tenantId,
            subject,
            reason == null || reason.isBlank() ? "unspecified" : reason,
            now,
            now.plus(effectiveTtl));
    final String json = serialize(entry);
    store.put(level.storeKey(scopeKey), json, effectiveTtl);
    // 一覧用の索引。判定には使わない
    store.put(indexKey(tenantId, level, scopeKey), json, effectiveTtl);
    logger.info(
        "credential scope revoked level={} tenantId={} subject={} reason={} ttlSeconds={}",
        level,
        tenantId,
        subject,
        entry.reason(),
        effectiveTtl.toSeconds());
    return entry;
  }

  /** 単一トークンの失効。TTL は残存期間 (最低 minTokenTtl) に合わせる。 */
  public RevocationEntry revokeToken(
      String jti, String tenantId, String subject, Instant credentialExpiresAt, String reason) {
    Duration remaining = properties.minTokenTtl();
    if (credentialExpiresAt != null) {
      final Duration untilExpiry = Duration.between(clock.instant(), credentialExpiresAt);
      if (untilExpiry.compareTo(remaining) > 0) {
        remaining = untilExpiry;
      }
    }
    return revoke(RevocationLevel.TOKEN, jti, tenantId, subject, reason, remaining);
  }

  public RevocationEntry revokePrincipal(
      String tenantId, String subject, String reason, Duration ttl) {
    if (subject == null || subject.isBlank()) {
      throw new IllegalArgumentException("subject is required");
    }
    return revoke(
        RevocationLevel.PRINCIPAL, principalScopeKey(tenantId, subject), tenantId, subject, reason, ttl);
  }

  public RevocationEntry revokeTenant(String tenantId, String reason, Duration ttl) {
    if (tenantId == null || tenantId.isBlank()) {
      throw new IllegalArgumentException("tenantId is required");
    }
    return revoke(RevocationLevel.TENANT, tenantId, tenantId, null, reason, ttl);
  }

  /**
   * 役割: 資格情報がいずれかの粒度で失効しているかを返す。
   *
   * <p>前提: ストアに到達できない場合は失効していないものとして扱う (fail-open)。発生はエラーログとメトリクスに残す。
   */
  public boolean isRevoked(VerifiedCredential credential) {
    try {
      if (exists(RevocationLevel.TOKEN.storeKey(credential.jti()))) {
        return true;
      }
      final String principalKey = principalScopeKey(credential.tenantId(), credential.subject());
      if (exists(RevocationLevel.PRINCIPAL.storeKey(principalKey))) {
        return true;
      }
      return !credential.isPlatformScoped()
          && exists(RevocationLevel.TENANT.storeKey(credential.tenantId()));
    } catch (StoreUnavailableException ex) {
      metrics.recordRevocationFailOpen();
      logger.error(
          "revocation check failed open jti={} tenantId={}",
          credential.jti(),
          credential.tenantId(),
          ex);
      return false;
    }
  }

  /** テナントに属する失効エントリを新しい順に返す。 */
  public List<RevocationEntry> list(String tenantId, int limit) {
    final int effectiveLimit =
        limit <= 0 ? properties.defaultListLimit() : Math.min(limit, properties.maxListLimit());
    final Map<String, String> raw = store.listByPrefix(indexPrefix(tenantId), SCAN_LIMIT);
    final List<RevocationEntry> entries = new ArrayList<>();
    for (Map.Entry<String, String> candidate : raw.entrySet()) {
      final RevocationEntry entry = deserialize(candidate.getKey(), candidate.getValue());
      if (entry != null && tenantId.equals(entry.tenantId())) {
        entries.add(entry);
      }
    }
    entries.sort(Comparator.comparing(RevocationEntry::revokedAt).reversed());
    return entries.size() > effectiveLimit ? entries.subList(0, effectiveLimit) : entries;
  }

  static String principalScopeKey(String tenantId, String subject) {
    return tenantScope(tenantId) + ":" + subject;
  }

  static String indexPrefix(String tenantId) {
    return INDEX_PREFIX + tenantScope(tenantId) + ":";
  }

  private static String indexKey(String tenantId, RevocationLevel level, String scopeKey) {
    return indexPrefix(tenantId) + level.name().toLowerCase(Locale.ROOT) + ":" + scopeKey;
  }

  private static String tenantScope(String tenantId) {
    return tenantId == null || tenantId.isBlank() || VerifiedCredential.PLATFORM_TENANT.equals(tenantId)
        ? PLATFORM_SCOPE
        : tenantId;
  }

  private boolean exists(String key) {
    return store.get(key).isPresent();
  }

  private Duration clampTtl(Duration ttl) {
    final Duration max = authProperties.maxCredentialLifetime();
    if (ttl == null || ttl.compareTo(max) > 0) {
      return max;
    }
    if (ttl.isZero() || ttl.isNegative()) {
      return properties.minTokenTtl();
    }
    return ttl;
  }

  private String serialize(RevocationEntry entry) {
    try {
      return objectMapper.writeValueAsString(entry);
    } catch (JsonProcessingException ex) {
      throw new IllegalStateException("failed to serialize revocation entry", ex);
    }
  }

  private RevocationEntry deserialize(String key, String json) {
    try {
      return objectMapper.readValue(json, RevocationEntry.class);
    } catch (JsonProcessingException ex) {
      // 一覧表示用のため、壊れたエントリは読み飛ばす。失効判定は存在だけを見るので影響しない
      logger.warn("unreadable revocation entry key={}", key, ex);
      return null;
    }
  }
}
