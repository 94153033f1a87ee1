/*
 * どこで: todo-authz サービス層
 * 何を: 認可判定の経路・下流連携エラー・所有タプルの不整合をメトリクスとして記録する
 * なぜ: list フォールバックの発生率や後始末失敗の蓄積を Prometheus から観測できるようにするため
 */
package com.example.todo_authz.service;

import edu.umd.cs.findbugs.annotations.SuppressFBWarnings;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Tags;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import org.springframework.stereotype.Component;

@Component
@SuppressFBWarnings(
    value = "EI_EXPOSE_REP2",
    justification = "MeterRegistry は Spring 管理の共有コンポーネントで防御的コピーが不可能なため")
public class OwnershipMetrics {

  private static final String METRIC_CHECK_TOTAL = "todo.authz.check.total";
  private static final String METRIC_INTEGRATION_ERROR_TOTAL =
      "todo.authz.integration.error.total";
  private static final String METRIC_OWNERSHIP_DRIFT_TOTAL = "todo.authz.ownership.drift.total";

  private final MeterRegistry meterRegistry;
  private final ConcurrentMap<String, Counter> checkCounters = new ConcurrentHashMap<>();
  private final ConcurrentMap<String, Counter> integrationErrorCounters =
      new ConcurrentHashMap<>();
  private final ConcurrentMap<String, Counter> driftCounters = new ConcurrentHashMap<>();

  public OwnershipMetrics(MeterRegistry meterRegistry) {
    this.meterRegistry = meterRegistry;
  }

  /** mode は endpoint(check API が応答)か list_fallback(一覧による近似判定)。 */
  public void recordCheck(boolean allowed, String mode) {
    final String result = allowed ? "allowed" : "denied";
    final String key = result + "|" + mode;
    checkCounters
        .computeIfAbsent(
            key,
            ignored ->
                Counter.builder(METRIC_CHECK_TOTAL)
                    .description("Ownership check outcomes by resolution mode")
                    .tags(Tags.of("result", result, "mode", mode))
                    .register(meterRegistry))
        .increment();
  }

  public void recordIntegrationError(String backend, String reason) {
    final String key = backend + "|" + reason;
    integrationErrorCounters
        .computeIfAbsent(
            key,
            ignored ->
                Counter.builder(METRIC_INTEGRATION_ERROR_TOTAL)
                    .description("Downstream integration errors by backend and reason")
                    .tags(Tags.of("backend", backend, "reason", reason))
                    .register(meterRegistry))
        .increment();
  }

  public void recordOwnershipDrift(String kind) {
    driftCounters
        .computeIfAbsent(
            kind,
            ignored ->
                Counter.builder(METRIC_OWNERSHIP_DRIFT_TOTAL)
                    .description("Row/tuple inconsistencies left behind by best-effort steps")
                    .tags(Tags.of("kind", kind))
                    .register(meterRegistry))
        .increment();
  }
}
