package com.teamplatform.provisioning.step;

import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.teamplatform.provisioning.actor.PermanentProvisioningException;
import com.teamplatform.provisioning.actor.ProvisioningContext;
import com.teamplatform.provisioning.config.ProvisioningProperties;
import com.teamplatform.provisioning.integration.ExternalIntegrationClient;
import com.teamplatform.provisioning.support.MutableClock;
import com.teamplatform.provisioning.tenant.TenantPlan;
import com.teamplatform.provisioning.tenant.TenantRepository;
import java.time.Instant;
import org.junit.jupiter.api.Test;

class DeployStepsTest {

  private static final String TENANT_ID = "tenant_1";
  private static final ProvisioningContext CONTEXT =
      new ProvisioningContext(TENANT_ID, TenantPlan.PRO, 1);

  private final ExternalIntegrationClient integrationClient = mock(ExternalIntegrationClient.class);
  private final TenantRepository tenantRepository = mock(TenantRepository.class);
  private final MutableClock clock = new MutableClock(Instant.parse("2026-03-01T09:00:00Z"));

  @Test
  void deployAutomationsUsesTenantNamespaceAndConfiguredSchedule() {
    final DeployAutomationsStep step =
        new DeployAutomationsStep(
            integrationClient, tenantRepository, properties(false, "15 3 * * *"), clock);

    step.execute(CONTEXT);

    verify(integrationClient).deployAutomations(TENANT_ID, "tenant_tenant_1", "15 3 * * *");
    verify(tenantRepository)
        .upsertAutomation(TENANT_ID, "tenant_tenant_1", "15 3 * * *", clock.instant());
  }

  @Test
  void failedAutomationDeployIsNotRecorded() {
    final DeployAutomationsStep step =
        new DeployAutomationsStep(integrationClient, tenantRepository, properties(false, null), clock);
    doThrow(new PermanentProvisioningException("rejected"))
        .when(integrationClient)
        .deployAutomations(anyString(), anyString(), anyString());

    assertThatThrownBy(() -> step.execute(CONTEXT))
        .isInstanceOf(PermanentProvisioningException.class);
    verify(tenantRepository, never()).upsertAutomation(anyString(), anyString(), anyString(), any());
  }

  @Test
  void appsScriptIsDeployedWhenAutoDeployEnabled() {
    when(integrationClient.deployAppsScript(TENANT_ID)).thenReturn("job-7");
    final DeployAppsScriptStep step =
        new DeployAppsScriptStep(integrationClient, tenantRepository, properties(true, null), clock);

    step.execute(CONTEXT);

    verify(tenantRepository)
        .recordAutomationDeploy(
            TENANT_ID, "job-7", DeployAppsScriptStep.STATUS_DEPLOYED, clock.instant());
  }

  @Test
  void appsScriptIsLeftForManualDeployWhenAutoDeployDisabled() {
    final DeployAppsScriptStep step =
        new DeployAppsScriptStep(integrationClient, tenantRepository, properties(false, null), clock);

    step.execute(CONTEXT);

    verify(integrationClient, never()).deployAppsScript(anyString());
    verify(tenantRepository)
        .recordAutomationDeploy(TENANT_ID, null, DeployAppsScriptStep.STATUS_MANUAL, clock.instant());
  }

  private ProvisioningProperties properties(boolean autoDeploy, String cron) {
    return new ProvisioningProperties(null, null, null, 0, autoDeploy, cron, null);
  }
}
