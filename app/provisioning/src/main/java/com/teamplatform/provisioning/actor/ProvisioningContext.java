package com.teamplatform.provisioning.actor;

import com.teamplatform.provisioning.tenant.TenantPlan;

public record ProvisioningContext(String tenantId, TenantPlan plan, int attempt) {}
