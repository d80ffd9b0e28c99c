package com.teamplatform.provisioning.service;

/** 呼び出し元の再試行を使い切ってもプロビジョニングが完了しなかった。 */
public class ProvisioningFailedException extends RuntimeException {

  private final int attempts;

  public ProvisioningFailedException(String message, int attempts, Throwable cause) {
    super(message, cause);
    this.attempts = attempts;
  }

  public int attempts() {
    return attempts;
  }
}
