package com.teamplatform.provisioning.credential;

public enum AuthorizationScope {
  PLATFORM_ADMIN("platform_admin"),
  TENANT_ADMIN("tenant_admin");

  private final String code;

  AuthorizationScope(String code) {
    this.code = code;
  }

  public String code() {
    return code;
  }
}
