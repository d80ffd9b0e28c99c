package com.teamplatform.provisioning.revocation;

/** 失効の粒度。判定は TOKEN → PRINCIPAL → TENANT の順に行う。 */
public enum RevocationLevel {
  TOKEN("jwt:revoked:token:"),
  PRINCIPAL("jwt:revoked:principal:"),
  TENANT("jwt:revoked:tenant:");

  private final String keyPrefix;

  RevocationLevel(String keyPrefix) {
    this.keyPrefix = keyPrefix;
  }

  public String storeKey(String scopeKey) {
    return keyPrefix + scopeKey;
  }
}
