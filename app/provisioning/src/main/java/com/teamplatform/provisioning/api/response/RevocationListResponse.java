package com.teamplatform.provisioning.api.response;

import java.util.List;

public record RevocationListResponse(String tenantId, List<RevocationResponse> revocations) {

  public RevocationListResponse {
    revocations = revocations == null ? List.of() : List.copyOf(revocations);
  }
}
