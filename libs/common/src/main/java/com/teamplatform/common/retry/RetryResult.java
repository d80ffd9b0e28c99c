package com.teamplatform.common.retry;

import java.time.Duration;

/** 再試行の最終結果。success が false の場合 error に最後の失敗原因が入る。 */
public record RetryResult<T>(
    boolean success, T data, Throwable error, int attempts, Duration totalDuration) {

  public static <T> RetryResult<T> succeeded(T data, int attempts, Duration totalDuration) {
    return new RetryResult<>(true, data, null, attempts, totalDuration);
  }

  public static <T> RetryResult<T> failed(Throwable error, int attempts, Duration totalDuration) {
    return new RetryResult<>(false, null, error, attempts, totalDuration);
  }
}
