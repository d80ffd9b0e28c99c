/*
 * どこで: Provisioning アプリの設定バインド
 * 何を: ステップ再試行・呼び出し元再試行・待機時間・自動デプロイ設定を保持する
 * なぜ: 外部連携の遅延や障害に合わせて再試行の強さを運用で調整できるようにするため
 */
package com.teamplatform.provisioning.config;

import com.teamplatform.common.retry.RetryPolicy;
import java.time.Duration;
import java.util.function.Predicate;
import org.springframework.boot.context.properties.ConfigurationProperties;

@ConfigurationProperties(prefix = "provisioning")
public record ProvisioningProperties(
    RetrySettings stepRetry,
    RetrySettings queueRetry,
    Duration callerTimeout,
    int workerThreads,
    boolean appsScriptAutoDeploy,
    String automationCronSchedule,
    String adminConsoleUrl) {

  public ProvisioningProperties {
    stepRetry =
        stepRetry == null
            ? new RetrySettings(3, Duration.ofSeconds(1), Duration.ofSeconds(30), 2.0, 0.2, Duration.ofSeconds(20))
            : stepRetry;
    queueRetry =
        queueRetry == null
            ? new RetrySettings(3, Duration.ofSeconds(2), Duration.ofSeconds(10), 2.0, 0.2, null)
            : queueRetry;
    callerTimeout = callerTimeout == null ? Duration.ofSeconds(25) : callerTimeout;
    workerThreads = workerThreads <= 0 ? 8 : workerThreads;
    automationCronSchedule =
        automationCronSchedule == null || automationCronSchedule.isBlank()
            ? "0 */6 * * *"
            : automationCronSchedule;
    adminConsoleUrl =
        adminConsoleUrl == null || adminConsoleUrl.isBlank()
            ? "http://localhost:3000/admin"
            : adminConsoleUrl;
  }

  public record RetrySettings(
      int maxAttempts,
      Duration initialDelay,
      Duration maxDelay,
      double multiplier,
      double jitter,
      Duration attemptTimeout) {

    public RetryPolicy toPolicy(Predicate<Throwable> retryable) {
      return new RetryPolicy(
          maxAttempts, initialDelay, maxDelay, multiplier, jitter, attemptTimeout, retryable);
    }
  }
}
