/*
 * どこで: Provisioning Actor の状態
 * 何を: テナント 1 件分の状態遷移とステップのチェックポイントを保持する
 * なぜ: 再実行時に完了済みステップを飛ばし、外部連携を二重に実行しないため
 */
package com.teamplatform.provisioning.actor;

import com.teamplatform.provisioning.tenant.TenantPlan;
import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/** 不変。遷移はすべて新しいインスタンスを返す。 */
public record ProvisioningState(
    String tenantId,
    TenantPlan plan,
    ProvisioningStatus status,
    String currentStep,
    Map<String, StepCheckpoint> checkpoints,
    int attempt,
    String lastError,
    FailureKind failureKind,
    Instant createdAt,
    Instant updatedAt) {

  public ProvisioningState {
    checkpoints =
        checkpoints == null
            ? Map.of()
            : Collections.unmodifiableMap(new LinkedHashMap<>(checkpoints));
  }

  public static ProvisioningState pending(String tenantId, TenantPlan plan, Instant now) {
    return new ProvisioningState(
        tenantId, plan, ProvisioningStatus.PENDING, null, Map.of(), 0, null, null, now, now);
  }

  public boolean isCompleted(ProvisioningStepName step) {
    final StepCheckpoint checkpoint = checkpoints.get(step.stepName());
    return checkpoint != null && checkpoint.isCompleted();
  }

  ProvisioningState withPlan(TenantPlan newPlan, Instant now) {
    return new ProvisioningState(
        tenantId, newPlan, status, currentStep, checkpoints, attempt, lastError, failureKind,
        createdAt, now);
  }

  ProvisioningState started(Instant now) {
    return new ProvisioningState(
        tenantId, plan, ProvisioningStatus.RUNNING, currentStep, checkpoints,
        Math.max(attempt, 1), null, null, createdAt, now);
  }

  ProvisioningState restarted(Instant now) {
    return new ProvisioningState(
        tenantId, plan, ProvisioningStatus.RUNNING, currentStep, checkpoints, attempt + 1, null,
        null, createdAt, now);
  }

  ProvisioningState stepStarted(ProvisioningStepName step, Instant now) {
    final Map<String, StepCheckpoint> next = new LinkedHashMap<>(checkpoints);
    next.put(step.stepName(), new StepCheckpoint(StepCheckpoint.Status.RUNNING, now, null, null, 0));
    return new ProvisioningState(
        tenantId, plan, status, step.stepName(), next, attempt, lastError, failureKind, createdAt,
        now);
  }

  ProvisioningState stepCompleted(ProvisioningStepName step, int attempts, Instant now) {
    final Map<String, StepCheckpoint> next = new LinkedHashMap<>(checkpoints);
    final StepCheckpoint current = checkpoints.get(step.stepName());
    final Instant startedAt = current == null ? now : current.startedAt();
    next.put(
        step.stepName(),
        new StepCheckpoint(StepCheckpoint.Status.COMPLETED, startedAt, now, null, attempts));
    return new ProvisioningState(
        tenantId, plan, status, step.stepName(), next, attempt, lastError, failureKind, createdAt,
        now);
  }

  ProvisioningState stepFailed(
      ProvisioningStepName step, String error, int attempts, FailureKind kind, Instant now) {
    final Map<String, StepCheckpoint> next = new LinkedHashMap<>(checkpoints);
    final StepCheckpoint current = checkpoints.get(step.stepName());
    final Instant startedAt = current == null ? now : current.startedAt();
    next.put(
        step.stepName(),
        new StepCheckpoint(StepCheckpoint.Status.FAILED, startedAt, now, error, attempts));
    return new ProvisioningState(
        tenantId, plan, ProvisioningStatus.FAILED, step.stepName(), next, attempt, error, kind,
        createdAt, now);
  }

  ProvisioningState completed(Instant now) {
    return new ProvisioningState(
        tenantId, plan, ProvisioningStatus.COMPLETED, null, checkpoints, attempt, null, null,
        createdAt, now);
  }
}
