package com.teamplatform.provisioning.actor;

import java.time.Instant;

/** Actor の状態変化をテナントレコード側へ反映する出口。 */
public interface ProvisioningSideChannel {

  void publish(String tenantId, ProvisioningStatus status, String reason, Instant updatedAt);
}
