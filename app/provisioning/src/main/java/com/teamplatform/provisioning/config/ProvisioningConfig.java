/*
 * どこで: Provisioning 設定
 * 何を: ステップ実行用のワーカープールと Actor レジストリを組み立てる
 * なぜ: ステップの再試行方針とスレッド数を設定値から一箇所で決めるため
 */
package com.teamplatform.provisioning.config;

import com.teamplatform.common.retry.RetryExecutor;
import com.teamplatform.common.retry.RetryPolicy;
import com.teamplatform.provisioning.actor.ProvisioningActorRegistry;
import com.teamplatform.provisioning.actor.ProvisioningSideChannel;
import com.teamplatform.provisioning.actor.ProvisioningStateRepository;
import com.teamplatform.provisioning.actor.ProvisioningStep;
import com.teamplatform.provisioning.service.ProvisioningMetrics;
import java.time.Clock;
import java.util.List;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class ProvisioningConfig {

  @Bean(destroyMethod = "shutdown")
  ExecutorService provisioningExecutor(ProvisioningProperties properties) {
    final AtomicInteger counter = new AtomicInteger();
    final ThreadFactory threadFactory =
        runnable -> {
          final Thread thread = new Thread(runnable, "provisioning-" + counter.incrementAndGet());
          thread.setDaemon(true);
          return thread;
        };
    return Executors.newFixedThreadPool(properties.workerThreads(), threadFactory);
  }

  /** サインアップ後のキュー投入 (自己呼び出し) 専用。ステップ実行のワーカーを占有しない。 */
  @Bean(destroyMethod = "shutdown")
  ExecutorService queueClientExecutor() {
    final AtomicInteger counter = new AtomicInteger();
    return Executors.newFixedThreadPool(
        2,
        runnable -> {
          final Thread thread = new Thread(runnable, "provision-queue-" + counter.incrementAndGet());
          thread.setDaemon(true);
          return thread;
        });
  }

  /** PermanentProvisioningException などの NonRetryableFailure 以外は再試行する。 */
  @Bean
  RetryPolicy provisioningStepPolicy(ProvisioningProperties properties) {
    return properties.stepRetry().toPolicy(RetryPolicy.DEFAULT_RETRYABLE);
  }

  @Bean
  ProvisioningActorRegistry provisioningActorRegistry(
      ProvisioningStateRepository stateRepository,
      ProvisioningSideChannel sideChannel,
      List<ProvisioningStep> steps,
      RetryExecutor retryExecutor,
      RetryPolicy provisioningStepPolicy,
      ExecutorService provisioningExecutor,
      ProvisioningMetrics metrics,
      Clock clock) {
    return new ProvisioningActorRegistry(
        stateRepository,
        sideChannel,
        steps,
        retryExecutor,
        provisioningStepPolicy,
        provisioningExecutor,
        metrics,
        clock);
  }
}
