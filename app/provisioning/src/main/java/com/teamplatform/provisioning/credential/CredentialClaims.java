package com.teamplatform.provisioning.credential;

import java.util.List;

/** 発行時に埋め込む主体情報。tenantId が null の場合はプラットフォーム全体を対象にする。 */
public record CredentialClaims(String subject, String tenantId, List<String> roles, String email) {

  public CredentialClaims {
    if (subject == null || subject.isBlank()) {
      throw new IllegalArgumentException("subject is required");
    }
    roles = roles == null ? List.of() : List.copyOf(roles);
  }
}
