/*
 * どこで: Provisioning Actor の管理
 * 何を: tenantId ごとに TenantProvisioningActor を 1 つだけ生成して返し、終端状態で手が空いたものは外す
 * なぜ: 同じテナントの状態遷移を必ず同じメールボックスへ集めるため
 */
package com.teamplatform.provisioning.actor;

import com.google.common.annotations.VisibleForTesting;
import com.teamplatform.common.retry.RetryExecutor;
import com.teamplatform.common.retry.RetryPolicy;
import com.teamplatform.provisioning.service.ProvisioningMetrics;
import java.time.Clock;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.Executor;

public class ProvisioningActorRegistry {

  private final ConcurrentMap<String, TenantProvisioningActor> actors = new ConcurrentHashMap<>();
  private final ProvisioningStateRepository stateRepository;
  private final ProvisioningSideChannel sideChannel;
  private final Map<ProvisioningStepName, ProvisioningStep> steps;
  private final RetryExecutor retryExecutor;
  private final RetryPolicy stepPolicy;
  private final Executor executor;
  private final ProvisioningMetrics metrics;
  private final Clock clock;

  public ProvisioningActorRegistry(
      ProvisioningStateRepository stateRepository,
      ProvisioningSideChannel sideChannel,
      List<ProvisioningStep> stepHandlers,
      RetryExecutor retryExecutor,
      RetryPolicy stepPolicy,
      Executor executor,
      ProvisioningMetrics metrics,
      Clock clock) {
    this.stateRepository = stateRepository;
    this.sideChannel = sideChannel;
    final Map<ProvisioningStepName, ProvisioningStep> byName =
        new EnumMap<>(ProvisioningStepName.class);
    for (ProvisioningStep handler : stepHandlers) {
      if (byName.put(handler.stepName(), handler) != null) {
        throw new IllegalStateException("duplicate step handler " + handler.stepName());
      }
    }
    this.steps = byName;
    this.retryExecutor = retryExecutor;
    this.stepPolicy = stepPolicy;
    this.executor = executor;
    this.metrics = metrics;
    this.clock = clock;
  }

  public TenantProvisioningActor actorFor(String tenantId) {
    if (tenantId == null || tenantId.isBlank()) {
      throw new IllegalArgumentException("tenantId is required");
    }
    return actors.computeIfAbsent(
        tenantId,
        id ->
            new TenantProvisioningActor(
                this,
                id,
                stateRepository,
                sideChannel,
                steps,
                retryExecutor,
                stepPolicy,
                executor,
                metrics,
                clock));
  }

  void evict(TenantProvisioningActor actor) {
    actors.remove(actor.tenantId(), actor);
  }

  @VisibleForTesting
  int activeActors() {
    return actors.size();
  }
}
