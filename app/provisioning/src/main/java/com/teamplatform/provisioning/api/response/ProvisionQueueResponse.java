package com.teamplatform.provisioning.api.response;

public record ProvisionQueueResponse(
    boolean success, String message, ProvisionStatusResponse state) {}
