package com.teamplatform.provisioning.actor;

/** 実行が FAILED で終わったことを呼び出し元へ伝える。state に最後の失敗内容が入る。 */
public class ProvisioningRunException extends RuntimeException {

  private final transient ProvisioningState state;

  public ProvisioningRunException(ProvisioningState state) {
    super(state.lastError() == null ? "provisioning failed" : state.lastError());
    this.state = state;
  }

  public ProvisioningState state() {
    return state;
  }

  public boolean isTransient() {
    return state.failureKind() == FailureKind.TRANSIENT;
  }
}
