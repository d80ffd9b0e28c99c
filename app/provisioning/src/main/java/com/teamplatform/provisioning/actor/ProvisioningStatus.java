package com.teamplatform.provisioning.actor;

import java.util.Locale;

/** PENDING → RUNNING → {COMPLETED, FAILED}。FAILED → RUNNING は明示的な retry でのみ遷移する。 */
public enum ProvisioningStatus {
  PENDING,
  RUNNING,
  COMPLETED,
  FAILED;

  public String value() {
    return name().toLowerCase(Locale.ROOT);
  }
}
