package com.teamplatform.provisioning.integration;

/**
 * 役割: プロビジョニング対象の外部連携システムへの不透明なアダプタ。
 *
 * <p>期待動作: 一時的な障害は TransientProvisioningException、入力や契約の問題は PermanentProvisioningException
 * で通知する。同じテナントに対する再呼び出しは冪等であること。
 */
public interface ExternalIntegrationClient {

  /** テナント用の自動化ジョブを登録する。 */
  void deployAutomations(String tenantId, String storageNamespace, String cronSchedule);

  /** スクリプトをデプロイし、外部側のジョブ ID を返す。 */
  String deployAppsScript(String tenantId);
}
