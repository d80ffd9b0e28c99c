package com.teamplatform.provisioning.integration;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

public class LoggingOwnerNotifier implements OwnerNotifier {

  private static final Logger logger = LoggerFactory.getLogger(LoggingOwnerNotifier.class);

  @Override
  public void sendOnboarding(OwnerOnboardingMessage message) {
    logger.info(
        "owner onboarding prepared tenantId={} recipient={} linkExpiresAt={}",
        message.tenantId(),
        maskEmail(message.recipient()),
        message.linkExpiresAt());
  }

  static String maskEmail(String email) {
    if (email == null) {
      return null;
    }
    final int at = email.indexOf('@');
    if (at <= 1) {
      return "***" + (at < 0 ? "" : email.substring(at));
    }
    return email.charAt(0) + "***" + email.substring(at);
  }
}
