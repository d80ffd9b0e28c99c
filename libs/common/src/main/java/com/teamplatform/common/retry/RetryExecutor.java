/*
 * どこで: Common 再試行
 * 何を: 非同期処理を RetryPolicy に従って再試行し、結果を RetryResult にまとめる
 * なぜ: バックオフ待機でスレッドを塞がず、試行ごとのタイムアウトを一箇所で扱うため
 */
package com.teamplatform.common.retry;

import com.google.common.annotations.VisibleForTesting;
import edu.umd.cs.findbugs.annotations.SuppressFBWarnings;
import java.time.Duration;
import java.util.concurrent.Callable;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Executor;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ThreadLocalRandom;
import java.util.concurrent.TimeUnit;
import java.util.function.DoubleSupplier;
import java.util.function.Supplier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

@SuppressFBWarnings(
    value = "EI_EXPOSE_REP2",
    justification = "ScheduledExecutorService は共有のスケジューラで防御的コピーが不可能なため")
public class RetryExecutor {

  private static final Logger logger = LoggerFactory.getLogger(RetryExecutor.class);

  private final ScheduledExecutorService scheduler;
  private final DoubleSupplier random;

  public RetryExecutor(ScheduledExecutorService scheduler) {
    this(scheduler, () -> ThreadLocalRandom.current().nextDouble());
  }

  @VisibleForTesting
  RetryExecutor(ScheduledExecutorService scheduler, DoubleSupplier random) {
    this.scheduler = scheduler;
    this.random = random;
  }

  /**
   * 役割: operation を最大 maxAttempts 回呼び出す。
   *
   * <p>期待動作: 再試行不可の失敗は 1 回で打ち切る。タイムアウトした試行は一時的失敗として数えるが、実行中の処理は取り消さない。
   * 返す future は例外で完了せず、常に RetryResult で完了する。
   */
  public <T> CompletableFuture<RetryResult<T>> execute(
      RetryPolicy policy, Supplier<CompletableFuture<T>> operation) {
    final CompletableFuture<RetryResult<T>> result = new CompletableFuture<>();
    attempt(policy, operation, 1, System.nanoTime(), result);
    return result;
  }

  /** ブロッキング処理を executor 上で実行しながら再試行する。 */
  public <T> CompletableFuture<RetryResult<T>> executeBlocking(
      RetryPolicy policy, Callable<T> operation, Executor executor) {
    return execute(
        policy,
        () ->
            CompletableFuture.supplyAsync(
                () -> {
                  try {
                    return operation.call();
                  } catch (RuntimeException ex) {
                    throw ex;
                  } catch (Exception ex) {
                    throw new CompletionException(ex);
                  }
                },
                executor));
  }

  private <T> void attempt(
      RetryPolicy policy,
      Supplier<CompletableFuture<T>> operation,
      int attemptNumber,
      long startedAtNanos,
      CompletableFuture<RetryResult<T>> result) {
    CompletableFuture<T> future;
    try {
      future = operation.get();
      if (future == null) {
        future = CompletableFuture.failedFuture(new IllegalStateException("operation returned null"));
      }
    } catch (RuntimeException ex) {
      future = CompletableFuture.failedFuture(ex);
    }
    // copy() に対して timeout を掛け、元の処理はそのまま走らせる
    final CompletableFuture<T> bounded =
        policy.attemptTimeout() == null
            ? future
            : future.copy().orTimeout(policy.attemptTimeout().toMillis(), TimeUnit.MILLISECONDS);

    bounded.whenComplete(
        (value, error) -> {
          if (error == null) {
            result.complete(RetryResult.succeeded(value, attemptNumber, elapsed(startedAtNanos)));
            return;
          }
          final Throwable cause = unwrap(error);
          if (attemptNumber >= policy.maxAttempts() || !policy.isRetryable(cause)) {
            logger.debug(
                "retry finished without success attempts={} retryable={}",
                attemptNumber,
                policy.isRetryable(cause),
                cause);
            result.complete(RetryResult.failed(cause, attemptNumber, elapsed(startedAtNanos)));
            return;
          }
          final Duration delay = computeDelay(policy, attemptNumber);
          logger.info(
              "retrying after failure attempt={} nextDelayMs={} error={}",
              attemptNumber,
              delay.toMillis(),
              cause.toString());
          try {
            scheduler.schedule(
                () -> attempt(policy, operation, attemptNumber + 1, startedAtNanos, result),
                delay.toMillis(),
                TimeUnit.MILLISECONDS);
          } catch (RuntimeException ex) {
            // スケジューラ停止時は直前の失敗を結果として返す
            ex.addSuppressed(cause);
            result.complete(RetryResult.failed(ex, attemptNumber, elapsed(startedAtNanos)));
          }
        });
  }

  @VisibleForTesting
  Duration computeDelay(RetryPolicy policy, int attemptNumber) {
    final double base =
        policy.initialDelay().toMillis() * Math.pow(policy.multiplier(), attemptNumber - 1);
    final double capped = Math.min(base, policy.maxDelay().toMillis());
    final double factor = 1.0 + (random.getAsDouble() * 2.0 - 1.0) * policy.jitter();
    return Duration.ofMillis(Math.max(0L, Math.round(capped * factor)));
  }

  private Duration elapsed(long startedAtNanos) {
    return Duration.ofNanos(System.nanoTime() - startedAtNanos);
  }

  private Throwable unwrap(Throwable error) {
    Throwable current = error;
    while ((current instanceof CompletionException || current instanceof ExecutionException)
        && current.getCause() != null) {
      current = current.getCause();
    }
    return current;
  }
}
