package com.teamplatform.provisioning.api.request;

/** queue / retry の入力。tenantId の欠落は MISSING_TENANT_ID として扱う。 */
public record TenantIdRequest(String tenantId) {}
