package com.teamplatform.provisioning.step;

import com.teamplatform.provisioning.actor.ProvisioningContext;
import com.teamplatform.provisioning.actor.ProvisioningStep;
import com.teamplatform.provisioning.actor.ProvisioningStepName;
import com.teamplatform.provisioning.tenant.TenantRepository;
import java.time.Clock;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

@Component
@RequiredArgsConstructor
public class MarkReadyStep implements ProvisioningStep {

  private final TenantRepository tenantRepository;
  private final Clock clock;

  @Override
  public ProvisioningStepName stepName() {
    return ProvisioningStepName.MARK_READY;
  }

  @Override
  public void execute(ProvisioningContext context) {
    tenantRepository.markActive(context.tenantId(), clock.instant());
  }
}
