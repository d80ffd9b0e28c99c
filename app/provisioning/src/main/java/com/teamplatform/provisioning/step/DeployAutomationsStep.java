/*
 * どこで: Provisioning ステップ (Pro プラン)
 * 何を: 外部連携側に自動化ジョブを登録し、名前空間とスケジュールを保存する
 * なぜ: テナントごとのデータ同期を定期実行させるため
 */
package com.teamplatform.provisioning.step;

import com.teamplatform.provisioning.actor.ProvisioningContext;
import com.teamplatform.provisioning.actor.ProvisioningStep;
import com.teamplatform.provisioning.actor.ProvisioningStepName;
import com.teamplatform.provisioning.config.ProvisioningProperties;
import com.teamplatform.provisioning.integration.ExternalIntegrationClient;
import com.teamplatform.provisioning.tenant.TenantRepository;
import java.time.Clock;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

@Component
@RequiredArgsConstructor
public class DeployAutomationsStep implements ProvisioningStep {

  private final ExternalIntegrationClient integrationClient;
  private final TenantRepository tenantRepository;
  private final ProvisioningProperties properties;
  private final Clock clock;

  static String storageNamespace(String tenantId) {
    return "tenant_" + tenantId;
  }

  @Override
  public ProvisioningStepName stepName() {
    return ProvisioningStepName.DEPLOY_AUTOMATIONS;
  }

  @Override
  public void execute(ProvisioningContext context) {
    final String namespace = storageNamespace(context.tenantId());
    final String cron = properties.automationCronSchedule();
    integrationClient.deployAutomations(context.tenantId(), namespace, cron);
    tenantRepository.upsertAutomation(context.tenantId(), namespace, cron, clock.instant());
  }
}
