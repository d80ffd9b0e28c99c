/*
 * どこで: Provisioning サービス層
 * 何を: queue / retry / status の各 API を Actor へ仲介し、呼び出し元の再試行と待機期限を管理する
 * なぜ: 一時的な失敗は内部で吸収し、長引く実行は呼び出し元を待たせずに継続させるため
 */
package com.teamplatform.provisioning.service;

import com.teamplatform.common.retry.RetryExecutor;
import com.teamplatform.common.retry.RetryPolicy;
import com.teamplatform.common.retry.RetryResult;
import com.teamplatform.provisioning.actor.ProvisioningActorRegistry;
import com.teamplatform.provisioning.actor.ProvisioningConflictException;
import com.teamplatform.provisioning.actor.ProvisioningRunException;
import com.teamplatform.provisioning.actor.ProvisioningSnapshot;
import com.teamplatform.provisioning.actor.ProvisioningState;
import com.teamplatform.provisioning.actor.ProvisioningStatus;
import com.teamplatform.provisioning.actor.TenantProvisioningActor;
import com.teamplatform.provisioning.config.ProvisioningProperties;
import com.teamplatform.provisioning.tenant.Tenant;
import com.teamplatform.provisioning.tenant.TenantNotFoundException;
import com.teamplatform.provisioning.tenant.TenantRepository;
import java.time.Duration;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

@Service
public class ProvisioningService {

  private static final Logger logger = LoggerFactory.getLogger(ProvisioningService.class);

  private final TenantRepository tenantRepository;
  private final ProvisioningActorRegistry actorRegistry;
  private final RetryExecutor retryExecutor;
  private final ProvisioningProperties properties;
  private final RetryPolicy queuePolicy;

  public ProvisioningService(
      TenantRepository tenantRepository,
      ProvisioningActorRegistry actorRegistry,
      RetryExecutor retryExecutor,
      ProvisioningProperties properties) {
    this.tenantRepository = tenantRepository;
    this.actorRegistry = actorRegistry;
    this.retryExecutor = retryExecutor;
    this.properties = properties;
    this.queuePolicy = properties.queueRetry().toPolicy(ProvisioningService::isRetryableRun);
  }

  /**
   * 役割: テナントをキューに入れて実行し、一時的な失敗なら retry で再実行する。
   *
   * <p>期待動作: 完了すれば finished、待機期限を過ぎれば inFlight を返す。恒久的な失敗と再試行上限到達は {@link
   * ProvisioningFailedException}。
   */
  public ProvisioningOutcome queueAndRun(String tenantId) {
    final Tenant tenant = requireTenant(tenantId);
    final TenantProvisioningActor actor = actorRegistry.actorFor(tenant.id());
    final CompletableFuture<RetryResult<ProvisioningState>> result =
        retryExecutor.execute(
            queuePolicy,
            () ->
                actor
                    .queue(tenant.plan())
                    .thenCompose(
                        state ->
                            state.status() == ProvisioningStatus.FAILED ? actor.retry() : actor.run())
                    .thenApply(ProvisioningService::requireNotFailed));
    return await(actor, result);
  }

  /** FAILED のテナントをチェックポイントから 1 回だけ再実行する。 */
  public ProvisioningOutcome retry(String tenantId) {
    final Tenant tenant = requireTenant(tenantId);
    final TenantProvisioningActor actor = actorRegistry.actorFor(tenant.id());
    final CompletableFuture<RetryResult<ProvisioningState>> result =
        actor
            .queue(tenant.plan())
            .thenCompose(ignored -> actor.retry())
            .thenApply(ProvisioningService::requireNotFailed)
            .<RetryResult<ProvisioningState>>handle(
                (state, error) ->
                    error == null
                        ? RetryResult.succeeded(state, 1, Duration.ZERO)
                        : RetryResult.failed(unwrap(error), 1, Duration.ZERO));
    return await(actor, result);
  }

  /** 状態がまだ無いテナントは PENDING として返す。 */
  public ProvisioningSnapshot status(String tenantId) {
    final Tenant tenant = requireTenant(tenantId);
    return actorRegistry
        .actorFor(tenant.id())
        .status()
        .orElseGet(
            () ->
                new ProvisioningSnapshot(ProvisioningStatus.PENDING, null, null, tenant.createdAt()));
  }

  private ProvisioningOutcome await(
      TenantProvisioningActor actor, CompletableFuture<RetryResult<ProvisioningState>> future) {
    final RetryResult<ProvisioningState> result;
    try {
      result = future.get(properties.callerTimeout().toMillis(), TimeUnit.MILLISECONDS);
    } catch (TimeoutException ex) {
      // 実行は継続させ、呼び出し元には途中の状態を返す
      logger.info("provisioning still running at caller deadline tenantId={}", actor.tenantId());
      return ProvisioningOutcome.inFlight(
          actor
              .status()
              .orElseGet(
                  () -> new ProvisioningSnapshot(ProvisioningStatus.PENDING, null, null, null)));
    } catch (InterruptedException ex) {
      Thread.currentThread().interrupt();
      throw new IllegalStateException("interrupted while waiting for provisioning", ex);
    } catch (ExecutionException ex) {
      throw new ProvisioningFailedException("provisioning failed", 1, ex.getCause());
    }
    if (result.success()) {
      return ProvisioningOutcome.finished(ProvisioningSnapshot.of(result.data()));
    }
    final Throwable error = result.error();
    if (error instanceof ProvisioningConflictException) {
      throw (ProvisioningConflictException) error;
    }
    logger.warn(
        "provisioning failed for caller tenantId={} attempts={}",
        actor.tenantId(),
        result.attempts(),
        error);
    throw new ProvisioningFailedException(describe(error), result.attempts(), error);
  }

  private Tenant requireTenant(String tenantId) {
    if (tenantId == null || tenantId.isBlank()) {
      throw new IllegalArgumentException("tenantId is required");
    }
    return tenantRepository
        .findById(tenantId)
        .orElseThrow(() -> new TenantNotFoundException(tenantId));
  }

  private static ProvisioningState requireNotFailed(ProvisioningState state) {
    if (state.status() == ProvisioningStatus.FAILED) {
      throw new ProvisioningRunException(state);
    }
    return state;
  }

  static boolean isRetryableRun(Throwable error) {
    if (error instanceof ProvisioningRunException) {
      return ((ProvisioningRunException) error).isTransient();
    }
    return RetryPolicy.DEFAULT_RETRYABLE.test(error);
  }

  private static Throwable unwrap(Throwable error) {
    Throwable current = error;
    while (current instanceof CompletionException && current.getCause() != null) {
      current = current.getCause();
    }
    return current;
  }

  private static String describe(Throwable error) {
    if (error == null || error.getMessage() == null) {
      return "provisioning failed";
    }
    return error.getMessage();
  }
}
