package com.teamplatform.provisioning.integration;

import java.util.UUID;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/** 外部連携を呼ばずに成功を返す。ローカル起動とテスト用。 */
public class LocalExternalIntegrationClient implements ExternalIntegrationClient {

  private static final Logger logger = LoggerFactory.getLogger(LocalExternalIntegrationClient.class);

  @Override
  public void deployAutomations(String tenantId, String storageNamespace, String cronSchedule) {
    logger.info(
        "local integration: automations registered tenantId={} namespace={} cron={}",
        tenantId,
        storageNamespace,
        cronSchedule);
  }

  @Override
  public String deployAppsScript(String tenantId) {
    final String jobId = "local-" + UUID.randomUUID();
    logger.info("local integration: apps script deployed tenantId={} jobId={}", tenantId, jobId);
    return jobId;
  }
}
