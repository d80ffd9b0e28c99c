/*
 * どこで: Provisioning ステップ
 * 何を: オーナー向けのログインリンクを発行し、案内を送る
 * なぜ: パスワードを持たないオーナーが初回ログインできるようにするため
 */
package com.teamplatform.provisioning.step;

import com.teamplatform.provisioning.actor.PermanentProvisioningException;
import com.teamplatform.provisioning.actor.ProvisioningContext;
import com.teamplatform.provisioning.actor.ProvisioningStep;
import com.teamplatform.provisioning.actor.ProvisioningStepName;
import com.teamplatform.provisioning.config.ProvisioningProperties;
import com.teamplatform.provisioning.credential.CredentialIssuer;
import com.teamplatform.provisioning.credential.IssuedCredential;
import com.teamplatform.provisioning.integration.OwnerNotifier;
import com.teamplatform.provisioning.integration.OwnerOnboardingMessage;
import com.teamplatform.provisioning.tenant.Tenant;
import com.teamplatform.provisioning.tenant.TenantRepository;
import java.time.Clock;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;
import org.springframework.web.util.UriComponentsBuilder;

/**
 * 役割: オーナーへの案内送信。
 *
 * <p>期待動作: 送信済みなら何もしない。配送の失敗は警告ログに留め、プロビジョニング自体は進める。
 */
@Component
@RequiredArgsConstructor
public class SendOwnerEmailsStep implements ProvisioningStep {

  private static final Logger logger = LoggerFactory.getLogger(SendOwnerEmailsStep.class);

  private final TenantRepository tenantRepository;
  private final CredentialIssuer credentialIssuer;
  private final OwnerNotifier ownerNotifier;
  private final ProvisioningProperties properties;
  private final Clock clock;

  @Override
  public ProvisioningStepName stepName() {
    return ProvisioningStepName.SEND_OWNER_EMAILS;
  }

  @Override
  public void execute(ProvisioningContext context) {
    final Tenant tenant =
        tenantRepository
            .findById(context.tenantId())
            .orElseThrow(
                () -> new PermanentProvisioningException("tenant not found " + context.tenantId()));
    if (tenant.ownerEmailSentAt() != null) {
      return;
    }
    final IssuedCredential magicLink = credentialIssuer.issueMagicLink(tenant.id(), tenant.email());
    final String link =
        UriComponentsBuilder.fromUriString(properties.adminConsoleUrl())
            .queryParam("token", magicLink.token())
            .build()
            .toUriString();
    try {
      ownerNotifier.sendOnboarding(
          new OwnerOnboardingMessage(
              tenant.id(), tenant.email(), tenant.name(), link, magicLink.expiresAt()));
    } catch (RuntimeException ex) {
      logger.warn("owner onboarding delivery failed tenantId={}", tenant.id(), ex);
    }
    tenantRepository.markOwnerEmailSent(tenant.id(), clock.instant());
  }
}
