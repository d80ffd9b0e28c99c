package com.teamplatform.provisioning.api.response;

import java.time.Instant;

/** jwt はオーナーの管理者資格情報。冪等性台帳に保存され、同じキーの再送にはそのまま返す。 */
public record SignupResponse(boolean success, SignupTenant tenant, String jwt) {

  public record SignupTenant(
      String id,
      String slug,
      String name,
      String email,
      String plan,
      String status,
      Instant trialEndsAt) {}
}
