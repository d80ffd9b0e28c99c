package com.teamplatform.provisioning.integration;

/** オーナー向けの案内を配送する。配送手段そのものはこのサービスの外側にある。 */
public interface OwnerNotifier {

  void sendOnboarding(OwnerOnboardingMessage message);
}
