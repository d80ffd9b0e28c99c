/*
 * どこで: Common 共通設定
 * 何を: Clock と再試行用スケジューラ、RetryExecutor を DI 可能にする
 * なぜ: 時刻注入とバックオフ待機の仕組みをアプリ間で揃えるため
 */
package com.teamplatform.common.config;

import com.teamplatform.common.retry.RetryExecutor;
import java.time.Clock;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class CommonRuntimeConfig {

  @Bean
  public Clock clock() {
    return Clock.systemUTC();
  }

  @Bean(destroyMethod = "shutdownNow")
  public ScheduledExecutorService retryScheduler() {
    final AtomicInteger sequence = new AtomicInteger();
    final ThreadFactory threadFactory =
        runnable -> {
          final Thread thread = new Thread(runnable, "retry-scheduler-" + sequence.incrementAndGet());
          thread.setDaemon(true);
          return thread;
        };
    return Executors.newScheduledThreadPool(2, threadFactory);
  }

  @Bean
  public RetryExecutor retryExecutor(ScheduledExecutorService retryScheduler) {
    return new RetryExecutor(retryScheduler);
  }
}
