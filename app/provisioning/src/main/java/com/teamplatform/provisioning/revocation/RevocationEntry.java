package com.teamplatform.provisioning.revocation;

import java.time.Instant;

/**
 * scopeKey は level ごとに jti / {@code tenantId:subject} / tenantId を表す。
 */
public record RevocationEntry(
    RevocationLevel level,
    String scopeKey,
    String tenantId,
    String subject,
    String reason,
    Instant revokedAt,
    Instant expiresAt) {}
