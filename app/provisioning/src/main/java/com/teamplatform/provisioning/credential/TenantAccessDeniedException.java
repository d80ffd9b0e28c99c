package com.teamplatform.provisioning.credential;

/** 有効な資格情報だが対象テナントへの権限が無い場合に送出する。HTTP では 403 に対応する。 */
public class TenantAccessDeniedException extends RuntimeException {

  public enum Reason {
    TENANT_MISMATCH("tenant_mismatch"),
    ROLE_MISMATCH("role_mismatch"),
    WRONG_AUDIENCE("wrong_audience");

    private final String code;

    Reason(String code) {
      this.code = code;
    }

    public String code() {
      return code;
    }
  }

  private final Reason reason;

  public TenantAccessDeniedException(Reason reason, String message) {
    super(message);
    this.reason = reason;
  }

  public Reason reason() {
    return reason;
  }
}
