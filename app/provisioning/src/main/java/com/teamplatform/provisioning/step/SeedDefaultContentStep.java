/*
 * どこで: Provisioning ステップ
 * 何を: ウェルカム投稿とサンプルの試合予定を作成する
 * なぜ: 新しいテナントの管理画面が空の状態で始まらないようにするため
 */
package com.teamplatform.provisioning.step;

import com.teamplatform.provisioning.actor.PermanentProvisioningException;
import com.teamplatform.provisioning.actor.ProvisioningContext;
import com.teamplatform.provisioning.actor.ProvisioningStep;
import com.teamplatform.provisioning.actor.ProvisioningStepName;
import com.teamplatform.provisioning.tenant.Tenant;
import com.teamplatform.provisioning.tenant.TenantRepository;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

@Component
@RequiredArgsConstructor
public class SeedDefaultContentStep implements ProvisioningStep {

  static final String WELCOME_POST = "welcome_post";
  static final String EXAMPLE_FIXTURE = "example_fixture";
  private static final Duration FIXTURE_OFFSET = Duration.ofDays(7);

  private final TenantRepository tenantRepository;
  private final Clock clock;

  @Override
  public ProvisioningStepName stepName() {
    return ProvisioningStepName.SEED_DEFAULT_CONTENT;
  }

  @Override
  public void execute(ProvisioningContext context) {
    final Tenant tenant =
        tenantRepository
            .findById(context.tenantId())
            .orElseThrow(
                () -> new PermanentProvisioningException("tenant not found " + context.tenantId()));
    final Instant now = clock.instant();
    tenantRepository.insertContentIfAbsent(
        tenant.id(),
        WELCOME_POST,
        "Welcome to " + tenant.name(),
        "Your club site is ready. Edit this post from the admin console.",
        null,
        now);
    tenantRepository.insertContentIfAbsent(
        tenant.id(),
        EXAMPLE_FIXTURE,
        tenant.name() + " vs Example FC",
        "Sample fixture. Replace it with your first real match.",
        now.plus(FIXTURE_OFFSET),
        now);
  }
}
