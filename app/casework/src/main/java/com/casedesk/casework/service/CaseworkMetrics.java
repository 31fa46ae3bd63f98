/*
 * どこで: Casework サービス層
 * 何を: 運用監視向けのアプリ固有メトリクス記録を集約する
 * なぜ: 変更系の成否、ロック競合、遷移、依存先の遮断を継続監視できるようにするため
 */
package com.casedesk.casework.service;

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
public class CaseworkMetrics {

  static final String METRIC_COMMAND_TOTAL = "casework.command.total";
  static final String METRIC_LOCK_EVENTS_TOTAL = "casework.lock.events.total";
  static final String METRIC_TRANSITION_TOTAL = "casework.lifecycle.transition.total";
  static final String METRIC_AUTO_RESUMED_TOTAL = "casework.lifecycle.auto_resumed.total";
  static final String METRIC_CIRCUIT_REJECTED_TOTAL = "casework.circuit.rejected.total";

  private final MeterRegistry meterRegistry;
  private final ConcurrentMap<String, Counter> counters = new ConcurrentHashMap<>();
  private final Counter autoResumedCounter;

  public CaseworkMetrics(MeterRegistry meterRegistry) {
    this.meterRegistry = meterRegistry;
    this.autoResumedCounter =
        Counter.builder(METRIC_AUTO_RESUMED_TOTAL)
            .description("Pended cases reopened by the resume sweep")
            .register(meterRegistry);
  }

  public void recordCommand(String operation, String result) {
    increment(
        METRIC_COMMAND_TOTAL,
        "Casework mutation executions",
        Tags.of("operation", operation, "result", result));
  }

  public void recordLockEvent(String action) {
    increment(METRIC_LOCK_EVENTS_TOTAL, "Entity lock events", Tags.of("action", action));
  }

  public void recordTransition(String fromStatus, String toStatus) {
    increment(
        METRIC_TRANSITION_TOTAL,
        "Case status transitions",
        Tags.of("from", fromStatus, "to", toStatus));
  }

  public void recordAutoResumed(int count) {
    if (count > 0) {
      autoResumedCounter.increment(count);
    }
  }

  public void recordCircuitRejected(String dependency) {
    increment(
        METRIC_CIRCUIT_REJECTED_TOTAL,
        "Calls rejected by an open circuit breaker",
        Tags.of("dependency", dependency));
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
