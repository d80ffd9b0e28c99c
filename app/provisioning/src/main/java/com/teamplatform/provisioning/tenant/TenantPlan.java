package com.teamplatform.provisioning.tenant;

import java.util.Locale;

public enum TenantPlan {
  STARTER,
  PRO;

  public String value() {
    return name().toLowerCase(Locale.ROOT);
  }

  public static TenantPlan fromValue(String value) {
    if (value == null || value.isBlank()) {
      throw new IllegalArgumentException("plan is required");
    }
    for (TenantPlan plan : values()) {
      if (plan.value().equals(value.trim().toLowerCase(Locale.ROOT))) {
        return plan;
      }
    }
    throw new IllegalArgumentException("plan must be starter or pro");
  }
}
