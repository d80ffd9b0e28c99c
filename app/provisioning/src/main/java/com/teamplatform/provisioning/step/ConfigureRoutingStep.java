package com.teamplatform.provisioning.step;

import com.teamplatform.provisioning.actor.ProvisioningContext;
import com.teamplatform.provisioning.actor.ProvisioningStep;
import com.teamplatform.provisioning.actor.ProvisioningStepName;
import com.teamplatform.provisioning.tenant.TenantRepository;
import java.time.Clock;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

/** サブドメインのルーティングが有効になったことを記録する。 */
@Component
@RequiredArgsConstructor
public class ConfigureRoutingStep implements ProvisioningStep {

  private final TenantRepository tenantRepository;
  private final Clock clock;

  @Override
  public ProvisioningStepName stepName() {
    return ProvisioningStepName.CONFIGURE_ROUTING;
  }

  @Override
  public void execute(ProvisioningContext context) {
    tenantRepository.markRouteReady(context.tenantId(), clock.instant());
  }
}
