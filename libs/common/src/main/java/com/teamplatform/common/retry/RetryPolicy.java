/*
 * どこで: Common 再試行
 * 何を: 再試行回数・バックオフ・試行タイムアウト・再試行可否の判定を保持する
 * なぜ: プロビジョニングの各ステップと呼び出し元で同じポリシー表現を共有するため
 */
package com.teamplatform.common.retry;

import java.time.Duration;
import java.util.concurrent.TimeoutException;
import java.util.function.Predicate;

/**
 * 遅延は {@code initialDelay * multiplier^(attempt-1)} を {@code maxDelay} で頭打ちにし、±{@code
 * jitter} の割合で揺らす。{@code attemptTimeout} が null の場合は試行ごとの打ち切りをしない。
 */
public record RetryPolicy(
    int maxAttempts,
    Duration initialDelay,
    Duration maxDelay,
    double multiplier,
    double jitter,
    Duration attemptTimeout,
    Predicate<Throwable> retryable) {

  public static final Predicate<Throwable> DEFAULT_RETRYABLE =
      error -> error instanceof TimeoutException || !(error instanceof NonRetryableFailure);

  public RetryPolicy {
    maxAttempts = maxAttempts <= 0 ? 3 : maxAttempts;
    initialDelay = initialDelay == null || initialDelay.isNegative() ? Duration.ofSeconds(1) : initialDelay;
    maxDelay = maxDelay == null || maxDelay.isNegative() ? Duration.ofSeconds(30) : maxDelay;
    multiplier = multiplier < 1.0 ? 2.0 : multiplier;
    jitter = jitter < 0.0 || jitter >= 1.0 ? 0.2 : jitter;
    retryable = retryable == null ? DEFAULT_RETRYABLE : retryable;
  }

  public static RetryPolicy defaults() {
    return new RetryPolicy(3, Duration.ofSeconds(1), Duration.ofSeconds(30), 2.0, 0.2, null, null);
  }

  public RetryPolicy withRetryable(Predicate<Throwable> predicate) {
    return new RetryPolicy(
        maxAttempts, initialDelay, maxDelay, multiplier, jitter, attemptTimeout, predicate);
  }

  public RetryPolicy withAttemptTimeout(Duration timeout) {
    return new RetryPolicy(
        maxAttempts, initialDelay, maxDelay, multiplier, jitter, timeout, retryable);
  }

  public boolean isRetryable(Throwable error) {
    return retryable.test(error);
  }
}
