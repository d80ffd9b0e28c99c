package com.teamplatform.provisioning.tenant;

import java.time.Instant;

public record TenantWebhook(
    String tenantId, String webhookUrl, String webhookSecret, Instant validatedAt) {}
