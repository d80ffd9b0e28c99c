package com.teamplatform.provisioning.actor;

import com.teamplatform.provisioning.tenant.TenantPlan;
import java.util.List;

public enum ProvisioningStepName {
  SEED_DEFAULT_CONTENT("seedDefaultContent"),
  CONFIGURE_ROUTING("configureRouting"),
  VALIDATE_WEBHOOK("validateWebhook"),
  DEPLOY_AUTOMATIONS("deployAutomations"),
  DEPLOY_APPS_SCRIPT("deployAppsScript"),
  SEND_OWNER_EMAILS("sendOwnerEmails"),
  MARK_READY("markReady");

  private static final List<ProvisioningStepName> STARTER_ORDER =
      List.of(
          SEED_DEFAULT_CONTENT, CONFIGURE_ROUTING, VALIDATE_WEBHOOK, SEND_OWNER_EMAILS, MARK_READY);
  private static final List<ProvisioningStepName> PRO_ORDER =
      List.of(
          SEED_DEFAULT_CONTENT,
          CONFIGURE_ROUTING,
          DEPLOY_AUTOMATIONS,
          DEPLOY_APPS_SCRIPT,
          SEND_OWNER_EMAILS,
          MARK_READY);

  private final String stepName;

  ProvisioningStepName(String stepName) {
    this.stepName = stepName;
  }

  public String stepName() {
    return stepName;
  }

  public static List<ProvisioningStepName> orderFor(TenantPlan plan) {
    return plan == TenantPlan.PRO ? PRO_ORDER : STARTER_ORDER;
  }
}
