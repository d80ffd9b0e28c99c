package com.teamplatform.provisioning.service;

import com.teamplatform.provisioning.actor.ProvisioningSnapshot;

/** inFlight が true の場合、待機期限までに実行が終わらず、実行自体は継続している。 */
public record ProvisioningOutcome(boolean inFlight, ProvisioningSnapshot snapshot) {

  public static ProvisioningOutcome finished(ProvisioningSnapshot snapshot) {
    return new ProvisioningOutcome(false, snapshot);
  }

  public static ProvisioningOutcome inFlight(ProvisioningSnapshot snapshot) {
    return new ProvisioningOutcome(true, snapshot);
  }
}
