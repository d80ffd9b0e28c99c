/*
 * どこで: Provisioning Actor のテスト
 * 何を: ステップ順序、チェックポイントからの再実行、失敗種別、直列化、plan 変更の競合、登録簿からの退避を検証する
 * なぜ: 外部連携を二重に実行せずにテナントを最後まで立ち上げられることを保証するため
 */
package com.teamplatform.provisioning.actor;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.teamplatform.common.retry.RetryExecutor;
import com.teamplatform.common.retry.RetryPolicy;
import com.teamplatform.provisioning.support.CredentialFixture;
import com.teamplatform.provisioning.tenant.TenantPlan;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Consumer;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

class TenantProvisioningActorTest {

  private static final String TENANT_ID = "tenant_1700000000000_abc1234";
  private static final long WAIT_SECONDS = 5;

  private final CredentialFixture fixture = new CredentialFixture();
  private final ProvisioningStateRepository stateRepository =
      new ProvisioningStateRepository(fixture.store, fixture.objectMapper);
  private final ScheduledExecutorService scheduler = Executors.newSingleThreadScheduledExecutor();
  private final ExecutorService executor = Executors.newFixedThreadPool(4);
  private final RetryPolicy stepPolicy =
      new RetryPolicy(3, Duration.ZERO, Duration.ZERO, 2.0, 0.0, null, null);
  private final List<String> published = new CopyOnWriteArrayList<>();
  private final ProvisioningSideChannel sideChannel =
      (tenantId, status, reason, updatedAt) -> published.add(status.name());
  private final List<String> executed = new CopyOnWriteArrayList<>();
  private final List<RecordingStep> steps = new ArrayList<>();

  @AfterEach
  void tearDown() {
    executor.shutdownNow();
    scheduler.shutdownNow();
  }

  @Test
  void starterPlanRunsStepsInOrderAndCompletes() throws Exception {
    final TenantProvisioningActor actor = registry().actorFor(TENANT_ID);

    await(actor.queue(TenantPlan.STARTER));
    final ProvisioningState state = await(actor.run());

    assertThat(state.status()).isEqualTo(ProvisioningStatus.COMPLETED);
    assertThat(state.attempt()).isEqualTo(1);
    assertThat(executed)
        .containsExactly(
            "seedDefaultContent",
            "configureRouting",
            "validateWebhook",
            "sendOwnerEmails",
            "markReady");
    assertThat(published).first().isEqualTo("PENDING");
    assertThat(published).last().isEqualTo("COMPLETED");
    assertThat(actor.status().orElseThrow().status()).isEqualTo(ProvisioningStatus.COMPLETED);
  }

  @Test
  void proPlanDeploysAutomationsInsteadOfValidatingWebhook() throws Exception {
    final TenantProvisioningActor actor = registry().actorFor(TENANT_ID);

    await(actor.queue(TenantPlan.PRO));
    await(actor.run());

    assertThat(executed)
        .containsExactly(
            "seedDefaultContent",
            "configureRouting",
            "deployAutomations",
            "deployAppsScript",
            "sendOwnerEmails",
            "markReady");
  }

  @Test
  void runningCompletedProvisioningAgainDoesNothing() throws Exception {
    final TenantProvisioningActor actor = registry().actorFor(TENANT_ID);
    await(actor.queue(TenantPlan.STARTER));
    await(actor.run());
    executed.clear();

    final ProvisioningState again = await(actor.run());
    final ProvisioningState retried = await(actor.retry());

    assertThat(again.status()).isEqualTo(ProvisioningStatus.COMPLETED);
    assertThat(retried.attempt()).isEqualTo(1);
    assertThat(executed).isEmpty();
  }

  @Test
  void permanentFailureStopsRunAndRetryResumesFromCheckpoint() throws Exception {
    final AtomicInteger failuresLeft = new AtomicInteger(1);
    onStep(
        ProvisioningStepName.CONFIGURE_ROUTING,
        context -> {
          if (failuresLeft.getAndDecrement() > 0) {
            throw new PermanentProvisioningException("route table rejected slug");
          }
        });
    final TenantProvisioningActor actor = registry().actorFor(TENANT_ID);
    await(actor.queue(TenantPlan.STARTER));

    final ProvisioningState failed = await(actor.run());

    assertThat(failed.status()).isEqualTo(ProvisioningStatus.FAILED);
    assertThat(failed.failureKind()).isEqualTo(FailureKind.PERMANENT);
    assertThat(failed.currentStep()).isEqualTo("configureRouting");
    assertThat(failed.lastError()).isEqualTo("configureRouting: route table rejected slug");
    assertThat(failed.checkpoints().get("configureRouting").attempts()).isEqualTo(1);
    assertThat(executed).containsExactly("seedDefaultContent", "configureRouting");

    final ProvisioningState stillFailed = await(actor.run());
    assertThat(stillFailed.status()).isEqualTo(ProvisioningStatus.FAILED);
    assertThat(executed).hasSize(2);

    final ProvisioningState completed = await(actor.retry());

    assertThat(completed.status()).isEqualTo(ProvisioningStatus.COMPLETED);
    assertThat(completed.attempt()).isEqualTo(2);
    assertThat(completed.lastError()).isNull();
    assertThat(executed.stream().filter("seedDefaultContent"::equals)).hasSize(1);
    assertThat(executed.stream().filter("configureRouting"::equals)).hasSize(2);
  }

  @Test
  void transientFailureIsRetriedWithinStep() throws Exception {
    final AtomicInteger failuresLeft = new AtomicInteger(2);
    onStep(
        ProvisioningStepName.VALIDATE_WEBHOOK,
        context -> {
          if (failuresLeft.getAndDecrement() > 0) {
            throw new TransientProvisioningException("webhook returned 503");
          }
        });
    final TenantProvisioningActor actor = registry().actorFor(TENANT_ID);
    await(actor.queue(TenantPlan.STARTER));

    final ProvisioningState state = await(actor.run());

    assertThat(state.status()).isEqualTo(ProvisioningStatus.COMPLETED);
    assertThat(state.checkpoints().get("validateWebhook").attempts()).isEqualTo(3);
  }

  @Test
  void exhaustedTransientFailureIsRecordedAsTransient() throws Exception {
    onStep(
        ProvisioningStepName.VALIDATE_WEBHOOK,
        context -> {
          throw new TransientProvisioningException("webhook timed out");
        });
    final TenantProvisioningActor actor = registry().actorFor(TENANT_ID);
    await(actor.queue(TenantPlan.STARTER));

    final ProvisioningState state = await(actor.run());

    assertThat(state.status()).isEqualTo(ProvisioningStatus.FAILED);
    assertThat(state.failureKind()).isEqualTo(FailureKind.TRANSIENT);
    assertThat(state.checkpoints().get("validateWebhook").attempts()).isEqualTo(3);
    assertThat(
            fixture
                .meterRegistry
                .get("provisioning.run.total")
                .tag("result", "failed")
                .counter()
                .count())
        .isEqualTo(1.0d);
  }

  @Test
  void concurrentRunsForSameTenantAreSerialized() throws Exception {
    final AtomicInteger inFlight = new AtomicInteger();
    final AtomicInteger maxInFlight = new AtomicInteger();
    for (ProvisioningStepName name : ProvisioningStepName.values()) {
      onStep(
          name,
          context -> {
            maxInFlight.accumulateAndGet(inFlight.incrementAndGet(), Math::max);
            sleep(5);
            inFlight.decrementAndGet();
          });
    }
    final ProvisioningActorRegistry registry = registry();
    await(registry.actorFor(TENANT_ID).queue(TenantPlan.STARTER));

    final List<CompletableFuture<ProvisioningState>> runs = new ArrayList<>();
    for (int i = 0; i < 5; i++) {
      runs.add(registry.actorFor(TENANT_ID).run());
    }
    CompletableFuture.allOf(runs.toArray(CompletableFuture[]::new))
        .get(WAIT_SECONDS, TimeUnit.SECONDS);

    assertThat(maxInFlight).hasValue(1);
    assertThat(executed).hasSize(5);
    assertThat(runs)
        .allSatisfy(run -> assertThat(run.join().status()).isEqualTo(ProvisioningStatus.COMPLETED));
  }

  @Test
  void planCanChangeBeforeStartButNotAfter() throws Exception {
    final TenantProvisioningActor actor = registry().actorFor(TENANT_ID);

    await(actor.queue(TenantPlan.STARTER));
    assertThat(await(actor.queue(TenantPlan.PRO)).plan()).isEqualTo(TenantPlan.PRO);

    await(actor.run());

    final CompletableFuture<ProvisioningState> conflicting = actor.queue(TenantPlan.STARTER);
    assertThatThrownBy(() -> conflicting.get(WAIT_SECONDS, TimeUnit.SECONDS))
        .isInstanceOf(ExecutionException.class)
        .hasCauseInstanceOf(ProvisioningConflictException.class);
    assertThat(await(actor.queue(TenantPlan.PRO)).status()).isEqualTo(ProvisioningStatus.COMPLETED);
  }

  @Test
  void stateIsPersistedAndResumedByFreshActor() throws Exception {
    final AtomicInteger failuresLeft = new AtomicInteger(1);
    onStep(
        ProvisioningStepName.SEND_OWNER_EMAILS,
        context -> {
          if (failuresLeft.getAndDecrement() > 0) {
            throw new PermanentProvisioningException("mail relay rejected sender");
          }
        });
    final TenantProvisioningActor first = registry().actorFor(TENANT_ID);
    await(first.queue(TenantPlan.STARTER));
    await(first.run());

    assertThat(fixture.store.get("provision:state:" + TENANT_ID)).isPresent();

    executed.clear();
    final ProvisioningState resumed = await(registry().actorFor(TENANT_ID).retry());

    assertThat(resumed.status()).isEqualTo(ProvisioningStatus.COMPLETED);
    assertThat(executed).containsExactly("sendOwnerEmails", "markReady");
  }

  @Test
  void missingStepHandlerFailsPermanently() throws Exception {
    final ProvisioningActorRegistry registry =
        new ProvisioningActorRegistry(
            stateRepository,
            sideChannel,
            List.of(new RecordingStep(ProvisioningStepName.SEED_DEFAULT_CONTENT)),
            new RetryExecutor(scheduler),
            stepPolicy,
            executor,
            fixture.metrics,
            fixture.clock);
    final TenantProvisioningActor actor = registry.actorFor(TENANT_ID);
    await(actor.queue(TenantPlan.STARTER));

    final ProvisioningState state = await(actor.run());

    assertThat(state.status()).isEqualTo(ProvisioningStatus.FAILED);
    assertThat(state.failureKind()).isEqualTo(FailureKind.PERMANENT);
    assertThat(state.currentStep()).isEqualTo("configureRouting");
  }

  @Test
  void runWithoutQueueFails() {
    final CompletableFuture<ProvisioningState> run = registry().actorFor("tenant_unknown").run();

    assertThatThrownBy(() -> run.get(WAIT_SECONDS, TimeUnit.SECONDS))
        .hasCauseInstanceOf(IllegalStateException.class);
  }

  @Test
  void registryReturnsSameActorPerTenant() {
    final ProvisioningActorRegistry registry = registry();

    assertThat(registry.actorFor(TENANT_ID)).isSameAs(registry.actorFor(TENANT_ID));
    assertThat(registry.actorFor(TENANT_ID)).isNotSameAs(registry.actorFor("tenant_other"));
    assertThatThrownBy(() -> registry.actorFor(" ")).isInstanceOf(IllegalArgumentException.class);
  }

  @Test
  void actorLeavesRegistryOnceTerminalAndSuccessorReadsPersistedState() throws Exception {
    final ProvisioningActorRegistry registry = registry();
    final TenantProvisioningActor first = registry.actorFor(TENANT_ID);
    await(first.queue(TenantPlan.STARTER));
    assertThat(registry.activeActors()).isEqualTo(1);

    await(first.run());

    assertThat(registry.activeActors()).isZero();
    final TenantProvisioningActor successor = registry.actorFor(TENANT_ID);
    assertThat(successor).isNotSameAs(first);
    assertThat(successor.status().orElseThrow().status()).isEqualTo(ProvisioningStatus.COMPLETED);
  }

  @Test
  void evictedActorForwardsLaterOperationsToCurrentActor() throws Exception {
    final ProvisioningActorRegistry registry = registry();
    final TenantProvisioningActor stale = registry.actorFor(TENANT_ID);
    await(stale.queue(TenantPlan.STARTER));
    await(stale.run());
    final TenantProvisioningActor current = registry.actorFor(TENANT_ID);
    executed.clear();

    final CompletableFuture<ProvisioningState> fromStale = stale.run();
    final CompletableFuture<ProvisioningState> fromCurrent = current.run();

    assertThat(await(fromStale).status()).isEqualTo(ProvisioningStatus.COMPLETED);
    assertThat(await(fromCurrent).status()).isEqualTo(ProvisioningStatus.COMPLETED);
    assertThat(executed).isEmpty();
  }

  @Test
  void failedActorIsEvictedAndRetryResumesThroughRegistry() throws Exception {
    final AtomicInteger failuresLeft = new AtomicInteger(1);
    onStep(
        ProvisioningStepName.VALIDATE_WEBHOOK,
        context -> {
          if (failuresLeft.getAndDecrement() > 0) {
            throw new PermanentProvisioningException("webhook returned 410");
          }
        });
    final ProvisioningActorRegistry registry = registry();
    await(registry.actorFor(TENANT_ID).queue(TenantPlan.STARTER));
    assertThat(await(registry.actorFor(TENANT_ID).run()).status())
        .isEqualTo(ProvisioningStatus.FAILED);
    assertThat(registry.activeActors()).isZero();

    final ProvisioningState retried = await(registry.actorFor(TENANT_ID).retry());

    assertThat(retried.status()).isEqualTo(ProvisioningStatus.COMPLETED);
    assertThat(retried.attempt()).isEqualTo(2);
  }

  private ProvisioningActorRegistry registry() {
    if (steps.isEmpty()) {
      Arrays.stream(ProvisioningStepName.values()).map(RecordingStep::new).forEach(steps::add);
    }
    return new ProvisioningActorRegistry(
        stateRepository,
        sideChannel,
        List.copyOf(steps),
        new RetryExecutor(scheduler),
        stepPolicy,
        executor,
        fixture.metrics,
        fixture.clock);
  }

  private void onStep(ProvisioningStepName name, Consumer<ProvisioningContext> behavior) {
    if (steps.isEmpty()) {
      Arrays.stream(ProvisioningStepName.values()).map(RecordingStep::new).forEach(steps::add);
    }
    steps.stream().filter(step -> step.stepName() == name).forEach(step -> step.behavior = behavior);
  }

  private ProvisioningState await(CompletableFuture<ProvisioningState> future) throws Exception {
    return future.get(WAIT_SECONDS, TimeUnit.SECONDS);
  }

  private static void sleep(long millis) {
    try {
      Thread.sleep(millis);
    } catch (InterruptedException ex) {
      Thread.currentThread().interrupt();
      throw new IllegalStateException(ex);
    }
  }

  private final class RecordingStep implements ProvisioningStep {

    private final ProvisioningStepName name;
    private volatile Consumer<ProvisioningContext> behavior = context -> {};

    private RecordingStep(ProvisioningStepName name) {
      this.name = name;
    }

    @Override
    public ProvisioningStepName stepName() {
      return name;
    }

    @Override
    public void execute(ProvisioningContext context) {
      executed.add(name.stepName());
      behavior.accept(context);
    }
  }
}
