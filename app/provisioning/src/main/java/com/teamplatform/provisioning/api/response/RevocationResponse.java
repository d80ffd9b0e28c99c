package com.teamplatform.provisioning.api.response;

import com.teamplatform.provisioning.revocation.RevocationEntry;
import java.time.Instant;
import java.util.Locale;

public record RevocationResponse(
    String level,
    String scopeKey,
    String tenantId,
    String subject,
    String reason,
    Instant revokedAt,
    Instant expiresAt) {

  public static RevocationResponse from(RevocationEntry entry) {
    return new RevocationResponse(
        entry.level().name().toLowerCase(Locale.ROOT),
        entry.scopeKey(),
        entry.tenantId(),
        entry.subject(),
        entry.reason(),
        entry.revokedAt(),
        entry.expiresAt());
  }
}
