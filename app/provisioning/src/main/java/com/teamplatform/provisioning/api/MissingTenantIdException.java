package com.teamplatform.provisioning.api;

public class MissingTenantIdException extends RuntimeException {

  public MissingTenantIdException() {
    super("tenantId is required");
  }
}
