package com.teamplatform.provisioning.step;

import com.teamplatform.provisioning.actor.PermanentProvisioningException;
import com.teamplatform.provisioning.actor.ProvisioningContext;
import com.teamplatform.provisioning.actor.ProvisioningStep;
import com.teamplatform.provisioning.actor.ProvisioningStepName;
import com.teamplatform.provisioning.integration.WebhookProbeClient;
import com.teamplatform.provisioning.tenant.TenantRepository;
import com.teamplatform.provisioning.tenant.TenantWebhook;
import java.time.Clock;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/** Starter プランのみ。検証済みの webhook は再実行時に呼び直さない。 */
@Component
public class ValidateWebhookStep implements ProvisioningStep {

  private static final Logger logger = LoggerFactory.getLogger(ValidateWebhookStep.class);

  private final TenantRepository tenantRepository;
  private final WebhookProbeClient probeClient;
  private final Clock clock;

  public ValidateWebhookStep(
      TenantRepository tenantRepository, WebhookProbeClient probeClient, Clock clock) {
    this.tenantRepository = tenantRepository;
    this.probeClient = probeClient;
    this.clock = clock;
  }

  @Override
  public ProvisioningStepName stepName() {
    return ProvisioningStepName.VALIDATE_WEBHOOK;
  }

  @Override
  public void execute(ProvisioningContext context) {
    final TenantWebhook webhook =
        tenantRepository
            .findWebhook(context.tenantId())
            .orElseThrow(() -> new PermanentProvisioningException("webhook is not configured"));
    if (webhook.validatedAt() != null) {
      logger.debug("webhook already validated tenantId={}", context.tenantId());
      return;
    }
    probeClient.probe(webhook.webhookUrl(), webhook.webhookSecret());
    tenantRepository.markWebhookValidated(context.tenantId(), clock.instant());
    logger.info("webhook validated tenantId={}", context.tenantId());
  }
}
