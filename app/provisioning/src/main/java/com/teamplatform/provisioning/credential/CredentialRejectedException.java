package com.teamplatform.provisioning.credential;

/** 資格情報が無い、または honor できない場合に送出する。HTTP では 401 に対応する。 */
public class CredentialRejectedException extends RuntimeException {

  public enum Reason {
    MISSING_CREDENTIAL("missing_credential"),
    EXPIRED("expired"),
    INVALID_SIGNATURE("invalid_signature"),
    WRONG_AUDIENCE("wrong_audience"),
    REVOKED("revoked"),
    MALFORMED("malformed");

    private final String code;

    Reason(String code) {
      this.code = code;
    }

    public String code() {
      return code;
    }
  }

  private final Reason reason;

  public CredentialRejectedException(Reason reason, String message) {
    super(message);
    this.reason = reason;
  }

  public CredentialRejectedException(Reason reason, String message, Throwable cause) {
    super(message, cause);
    this.reason = reason;
  }

  public Reason reason() {
    return reason;
  }
}
