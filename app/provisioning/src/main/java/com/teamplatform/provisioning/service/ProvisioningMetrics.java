/*
 * どこで: Provisioning サービス層
 * 何を: プロビジョニング・認可・失効・冪等性のメトリクス記録を集約する
 * なぜ: 失敗率や fail-open の発生を運用で継続監視できるようにするため
 */
package com.teamplatform.provisioning.service;

import edu.umd.cs.findbugs.annotations.SuppressFBWarnings;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Tags;
import io.micrometer.core.instrument.Timer;
import java.time.Duration;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import org.springframework.stereotype.Component;

@Component
@SuppressFBWarnings(
    value = "EI_EXPOSE_REP2",
    justification = "MeterRegistry は Spring 管理の共有コンポーネントで防御的コピーが不可能なため")
public class ProvisioningMetrics {

  private static final String METRIC_RUN_TOTAL = "provisioning.run.total";
  private static final String METRIC_RUN_DURATION = "provisioning.run.duration";
  private static final String METRIC_STEP_TOTAL = "provisioning.step.total";
  private static final String METRIC_AUTHZ_TOTAL = "authz.decision.total";
  private static final String METRIC_REVOCATION_FAIL_OPEN = "revocation.check.fail_open.total";
  private static final String METRIC_IDEMPOTENCY_TOTAL = "idempotency.lookup.total";
  private static final String METRIC_SIGNUP_TOTAL = "signup.total";

  private final MeterRegistry meterRegistry;
  private final ConcurrentMap<String, Counter> counters = new ConcurrentHashMap<>();
  private final Timer runDurationTimer;
  private final Counter revocationFailOpenCounter;

  public ProvisioningMetrics(MeterRegistry meterRegistry) {
    this.meterRegistry = meterRegistry;
    this.runDurationTimer =
        Timer.builder(METRIC_RUN_DURATION)
            .description("Provisioning run duration from dispatch to terminal state")
            .register(meterRegistry);
    this.revocationFailOpenCounter =
        Counter.builder(METRIC_REVOCATION_FAIL_OPEN)
            .description("Revocation checks answered as not-revoked because the store was unavailable")
            .register(meterRegistry);
  }

  public void recordRun(String result, Duration duration) {
    increment(METRIC_RUN_TOTAL, "Provisioning runs by terminal result", Tags.of("result", result));
    if (duration != null && !duration.isNegative()) {
      runDurationTimer.record(duration);
    }
  }

  public void recordStep(String step, String result) {
    increment(
        METRIC_STEP_TOTAL, "Provisioning step outcomes", Tags.of("step", step, "result", result));
  }

  public void recordAuthorization(String decision, String reason) {
    increment(
        METRIC_AUTHZ_TOTAL,
        "Authorization decisions by reason",
        Tags.of("decision", decision, "reason", reason));
  }

  public void recordRevocationFailOpen() {
    revocationFailOpenCounter.increment();
  }

  public void recordIdempotency(String outcome) {
    increment(METRIC_IDEMPOTENCY_TOTAL, "Idempotency ledger lookups", Tags.of("outcome", outcome));
  }

  public void recordSignup(String result) {
    increment(METRIC_SIGNUP_TOTAL, "Signup submissions", Tags.of("result", result));
  }

  private void increment(String name, String description, Tags tags) {
    final String key = name + tags;
    counters
        .computeIfAbsent(
            key,
            ignored ->
                Counter.builder(name).description(description).tags(tags).register(meterRegistry))
        .increment();
  }
}
