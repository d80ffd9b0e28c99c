package com.teamplatform.provisioning.tenant;

public class TenantNotFoundException extends RuntimeException {

  public TenantNotFoundException(String tenantId) {
    super("tenant not found: " + tenantId);
  }
}
