package com.teamplatform.provisioning.step;

import com.teamplatform.provisioning.actor.ProvisioningContext;
import com.teamplatform.provisioning.actor.ProvisioningStep;
import com.teamplatform.provisioning.actor.ProvisioningStepName;
import com.teamplatform.provisioning.config.ProvisioningProperties;
import com.teamplatform.provisioning.integration.ExternalIntegrationClient;
import com.teamplatform.provisioning.tenant.TenantRepository;
import java.time.Clock;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/** 自動デプロイが無効なら manual として記録し、運用者の手作業に回す。 */
@Component
@RequiredArgsConstructor
public class DeployAppsScriptStep implements ProvisioningStep {

  private static final Logger logger = LoggerFactory.getLogger(DeployAppsScriptStep.class);

  static final String STATUS_DEPLOYED = "deployed";
  static final String STATUS_MANUAL = "manual";

  private final ExternalIntegrationClient integrationClient;
  private final TenantRepository tenantRepository;
  private final ProvisioningProperties properties;
  private final Clock clock;

  @Override
  public ProvisioningStepName stepName() {
    return ProvisioningStepName.DEPLOY_APPS_SCRIPT;
  }

  @Override
  public void execute(ProvisioningContext context) {
    if (!properties.appsScriptAutoDeploy()) {
      logger.info("apps script auto deploy disabled tenantId={}", context.tenantId());
      tenantRepository.recordAutomationDeploy(
          context.tenantId(), null, STATUS_MANUAL, clock.instant());
      return;
    }
    final String jobId = integrationClient.deployAppsScript(context.tenantId());
    tenantRepository.recordAutomationDeploy(
        context.tenantId(), jobId, STATUS_DEPLOYED, clock.instant());
    logger.info("apps script deployed tenantId={} jobId={}", context.tenantId(), jobId);
  }
}
