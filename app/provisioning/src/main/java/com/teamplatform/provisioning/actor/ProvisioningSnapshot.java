package com.teamplatform.provisioning.actor;

import java.time.Instant;

/** status() が返す読み取り専用の要約。reason は失敗時のエラー、それ以外は実行中のステップ名。 */
public record ProvisioningSnapshot(
    ProvisioningStatus status, String step, String reason, Instant updatedAt) {

  public static ProvisioningSnapshot of(ProvisioningState state) {
    final String reason =
        state.status() == ProvisioningStatus.FAILED ? state.lastError() : state.currentStep();
    return new ProvisioningSnapshot(state.status(), state.currentStep(), reason, state.updatedAt());
  }
}
