package com.teamplatform.provisioning.api.response;

import java.util.List;

/** 時刻は ISO-8601 文字列。トークン本体は含めない。 */
public record WhoAmIResponse(
    String subject,
    String tenantId,
    boolean platformScoped,
    String audience,
    List<String> roles,
    String email,
    String jti,
    String issuedAt,
    String expiresAt) {

  public WhoAmIResponse {
    roles = roles == null ? List.of() : List.copyOf(roles);
  }
}
