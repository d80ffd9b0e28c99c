package com.teamplatform.provisioning.api.response;

import com.teamplatform.provisioning.actor.ProvisioningSnapshot;
import java.time.Instant;

public record ProvisionStatusResponse(String status, String step, String reason, Instant updatedAt) {

  public static ProvisionStatusResponse from(ProvisioningSnapshot snapshot) {
    return new ProvisionStatusResponse(
        snapshot.status().value(), snapshot.step(), snapshot.reason(), snapshot.updatedAt());
  }
}
