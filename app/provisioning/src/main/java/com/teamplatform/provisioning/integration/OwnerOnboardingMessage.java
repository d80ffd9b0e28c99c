package com.teamplatform.provisioning.integration;

import java.time.Instant;

public record OwnerOnboardingMessage(
    String tenantId, String recipient, String clubName, String onboardingLink, Instant linkExpiresAt) {

  /** onboardingLink は資格情報を含むため、ログには出さない。 */
  @Override
  public String toString() {
    return "OwnerOnboardingMessage[tenantId=" + tenantId + ", recipient=" + recipient + "]";
  }
}
