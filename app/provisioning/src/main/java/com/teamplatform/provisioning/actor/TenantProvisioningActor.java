/*
 * どこで: Provisioning Actor
 * 何を: テナント 1 件のプロビジョニング状態を単一の実行列で遷移させる
 * なぜ: 同じテナントへの queue / run / retry が並行しても状態遷移を直列化するため
 */
package com.teamplatform.provisioning.actor;

import com.teamplatform.common.retry.RetryExecutor;
import com.teamplatform.common.retry.RetryPolicy;
import com.teamplatform.common.retry.RetryResult;
import com.teamplatform.provisioning.service.ProvisioningMetrics;
import com.teamplatform.provisioning.tenant.TenantPlan;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;
import java.util.function.Supplier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * 役割: 1 テナントの ProvisioningState の唯一の書き手。
 *
 * <p>期待動作: 操作はすべてメールボックス (future の連鎖) に積まれ、前の操作が終わってから次が始まる。別テナントの Actor とは独立に進む。
 * 終端状態で手が空いた Actor は登録簿から外れ、状態は ProvisioningStateRepository から次の Actor が引き継ぐ。
 */
public class TenantProvisioningActor {

  private static final Logger logger = LoggerFactory.getLogger(TenantProvisioningActor.class);
  private static final int MAX_ERROR_LENGTH = 500;

  private final String tenantId;
  private final ProvisioningStateRepository stateRepository;
  private final ProvisioningSideChannel sideChannel;
  private final Map<ProvisioningStepName, ProvisioningStep> steps;
  private final RetryExecutor retryExecutor;
  private final RetryPolicy stepPolicy;
  private final Executor executor;
  private final ProvisioningMetrics metrics;
  private final Clock clock;

  private final ProvisioningActorRegistry registry;

  private final Object mailboxLock = new Object();
  private CompletableFuture<?> tail = CompletableFuture.completedFuture(null);
  // mailboxLock で保護する
  private int pending;
  private boolean retired;

  TenantProvisioningActor(
      ProvisioningActorRegistry registry,
      String tenantId,
      ProvisioningStateRepository stateRepository,
      ProvisioningSideChannel sideChannel,
      Map<ProvisioningStepName, ProvisioningStep> steps,
      RetryExecutor retryExecutor,
      RetryPolicy stepPolicy,
      Executor executor,
      ProvisioningMetrics metrics,
      Clock clock) {
    this.registry = registry;
    this.tenantId = tenantId;
    this.stateRepository = stateRepository;
    this.sideChannel = sideChannel;
    this.steps = Map.copyOf(steps);
    this.retryExecutor = retryExecutor;
    this.stepPolicy = stepPolicy;
    this.executor = executor;
    this.metrics = metrics;
    this.clock = clock;
  }

  public String tenantId() {
    return tenantId;
  }

  /** 状態が無ければ PENDING で作る。開始前なら plan を差し替え、開始後の plan 変更は競合とする。 */
  public CompletableFuture<ProvisioningState> queue(TenantPlan plan) {
    return enqueue(() -> CompletableFuture.completedFuture(doQueue(plan)));
  }

  /** 未完了のステップを順に実行する。COMPLETED と FAILED では何もせず現在の状態を返す。 */
  public CompletableFuture<ProvisioningState> run() {
    return enqueue(() -> doRun(false));
  }

  /** FAILED (または未開始) の状態をチェックポイントから再実行し、attempt を進める。 */
  public CompletableFuture<ProvisioningState> retry() {
    return enqueue(() -> doRun(true));
  }

  /** メールボックスを経由しない読み取り専用の参照。 */
  public Optional<ProvisioningSnapshot> status() {
    return stateRepository.find(tenantId).map(ProvisioningSnapshot::of);
  }

  private <T> CompletableFuture<T> enqueue(Supplier<CompletableFuture<T>> task) {
    synchronized (mailboxLock) {
      if (!retired) {
        pending++;
        // 前の操作の成否に関わらず次へ進める
        final CompletableFuture<T> next =
            tail.handle((ignored, error) -> null)
                .thenComposeAsync(ignored -> task.get(), executor)
                .whenComplete((ignored, error) -> settle());
        tail = next;
        return next;
      }
    }
    // 登録簿から外れた Actor への操作は現役の Actor のメールボックスへ回す
    return registry.actorFor(tenantId).enqueue(task);
  }

  /** メールボックスが空になり、状態が終端 (COMPLETED / FAILED) なら登録簿から外れる。 */
  private void settle() {
    synchronized (mailboxLock) {
      pending--;
      if (pending > 0 || !isTerminal()) {
        return;
      }
      retired = true;
      registry.evict(this);
    }
    logger.debug("provisioning actor evicted tenantId={}", tenantId);
  }

  private boolean isTerminal() {
    try {
      return stateRepository
          .find(tenantId)
          .map(state -> state.status() == ProvisioningStatus.COMPLETED
              || state.status() == ProvisioningStatus.FAILED)
          .orElse(false);
    } catch (RuntimeException ex) {
      // 判定できない間は登録簿に残す。次の操作の完了時に再判定する
      logger.warn("provisioning state unreadable, actor kept tenantId={}", tenantId, ex);
      return false;
    }
  }

  private ProvisioningState doQueue(TenantPlan plan) {
    final Instant now = clock.instant();
    final Optional<ProvisioningState> existing = stateRepository.find(tenantId);
    if (existing.isEmpty()) {
      final ProvisioningState created = ProvisioningState.pending(tenantId, plan, now);
      stateRepository.save(created);
      sideChannel.publish(tenantId, ProvisioningStatus.PENDING, null, now);
      logger.info("provisioning queued tenantId={} plan={}", tenantId, plan.value());
      return created;
    }
    final ProvisioningState state = existing.get();
    if (state.plan() == plan) {
      return state;
    }
    if (state.status() == ProvisioningStatus.PENDING) {
      final ProvisioningState updated = state.withPlan(plan, now);
      stateRepository.save(updated);
      logger.info(
          "provisioning plan updated before run tenantId={} from={} to={}",
          tenantId,
          state.plan().value(),
          plan.value());
      return updated;
    }
    throw new ProvisioningConflictException(
        "plan cannot change after provisioning started tenantId=" + tenantId);
  }

  private CompletableFuture<ProvisioningState> doRun(boolean explicitRetry) {
    final ProvisioningState state =
        stateRepository
            .find(tenantId)
            .orElseThrow(
                () -> new IllegalStateException("provisioning is not queued tenantId=" + tenantId));
    if (state.status() == ProvisioningStatus.COMPLETED) {
      return CompletableFuture.completedFuture(state);
    }
    if (state.status() == ProvisioningStatus.FAILED && !explicitRetry) {
      return CompletableFuture.completedFuture(state);
    }
    final Instant now = clock.instant();
    final ProvisioningState running =
        explicitRetry && state.status() == ProvisioningStatus.FAILED
            ? state.restarted(now)
            : state.started(now);
    stateRepository.save(running);
    sideChannel.publish(tenantId, ProvisioningStatus.RUNNING, running.currentStep(), now);
    logger.info(
        "provisioning run started tenantId={} plan={} attempt={}",
        tenantId,
        running.plan().value(),
        running.attempt());
    return executeRemaining(running, now);
  }

  private CompletableFuture<ProvisioningState> executeRemaining(
      ProvisioningState state, Instant runStartedAt) {
    final Optional<ProvisioningStepName> nextStep =
        ProvisioningStepName.orderFor(state.plan()).stream()
            .filter(step -> !state.isCompleted(step))
            .findFirst();
    if (nextStep.isEmpty()) {
      return CompletableFuture.completedFuture(finishCompleted(state, runStartedAt));
    }
    final ProvisioningStepName stepName = nextStep.get();
    final ProvisioningState stepState = state.stepStarted(stepName, clock.instant());
    stateRepository.save(stepState);
    sideChannel.publish(
        tenantId, ProvisioningStatus.RUNNING, stepName.stepName(), stepState.updatedAt());

    final ProvisioningContext context =
        new ProvisioningContext(tenantId, stepState.plan(), stepState.attempt());
    final ProvisioningStep handler = steps.get(stepName);
    final CompletableFuture<RetryResult<Boolean>> outcome =
        handler == null
            ? CompletableFuture.completedFuture(
                RetryResult.failed(
                    new PermanentProvisioningException("no handler for step " + stepName.stepName()),
                    1,
                    Duration.ZERO))
            : retryExecutor.executeBlocking(
                stepPolicy,
                () -> {
                  handler.execute(context);
                  return Boolean.TRUE;
                },
                executor);

    return outcome.thenCompose(
        result -> {
          if (result.success()) {
            metrics.recordStep(stepName.stepName(), "completed");
            final ProvisioningState advanced =
                stepState.stepCompleted(stepName, result.attempts(), clock.instant());
            stateRepository.save(advanced);
            return executeRemaining(advanced, runStartedAt);
          }
          return CompletableFuture.completedFuture(
              finishFailed(stepState, stepName, result, runStartedAt));
        });
  }

  private ProvisioningState finishCompleted(ProvisioningState state, Instant runStartedAt) {
    final Instant now = clock.instant();
    final ProvisioningState completed = state.completed(now);
    stateRepository.save(completed);
    sideChannel.publish(tenantId, ProvisioningStatus.COMPLETED, null, now);
    metrics.recordRun("completed", Duration.between(runStartedAt, now));
    logger.info("provisioning completed tenantId={} attempt={}", tenantId, completed.attempt());
    return completed;
  }

  private ProvisioningState finishFailed(
      ProvisioningState state,
      ProvisioningStepName stepName,
      RetryResult<Boolean> result,
      Instant runStartedAt) {
    final Instant now = clock.instant();
    final Throwable error = result.error();
    final FailureKind kind =
        error instanceof PermanentProvisioningException ? FailureKind.PERMANENT : FailureKind.TRANSIENT;
    final String message = truncate(stepName.stepName() + ": " + describe(error));
    final ProvisioningState failed =
        state.stepFailed(stepName, message, result.attempts(), kind, now);
    stateRepository.save(failed);
    sideChannel.publish(tenantId, ProvisioningStatus.FAILED, message, now);
    metrics.recordStep(stepName.stepName(), kind == FailureKind.PERMANENT ? "permanent" : "transient");
    metrics.recordRun("failed", Duration.between(runStartedAt, now));
    logger.warn(
        "provisioning failed tenantId={} step={} kind={} attempts={}",
        tenantId,
        stepName.stepName(),
        kind,
        result.attempts(),
        error);
    return failed;
  }

  private String describe(Throwable error) {
    if (error == null) {
      return "unknown error";
    }
    return error.getMessage() == null ? error.getClass().getSimpleName() : error.getMessage();
  }

  private String truncate(String message) {
    return message.length() <= MAX_ERROR_LENGTH ? message : message.substring(0, MAX_ERROR_LENGTH);
  }
}
