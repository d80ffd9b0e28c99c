package com.teamplatform.provisioning.tenant;

import java.time.Instant;

/** tenants テーブルの 1 行。provision* 列はプロビジョニング Actor だけが書き込む。 */
public record Tenant(
    String id,
    String slug,
    String name,
    String email,
    TenantPlan plan,
    String status,
    Instant trialEndsAt,
    boolean routeReady,
    Instant ownerEmailSentAt,
    Instant provisionedAt,
    String provisionState,
    String provisionReason,
    Instant provisionUpdatedAt,
    Instant createdAt,
    Instant updatedAt) {

  public static final String STATUS_TRIAL = "trial";
  public static final String STATUS_ACTIVE = "active";
}
