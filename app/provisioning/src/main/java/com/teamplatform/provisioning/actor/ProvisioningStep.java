package com.teamplatform.provisioning.actor;

/**
 * 役割: プロビジョニングの 1 ステップ。
 *
 * <p>期待動作: 一時的な失敗は {@link TransientProvisioningException}、再試行しても直らない失敗は {@link
 * PermanentProvisioningException} で通知する。同じテナントで再実行されても結果が重複しないこと。
 */
public interface ProvisioningStep {

  ProvisioningStepName stepName();

  void execute(ProvisioningContext context);
}
