/*
 * どこで: Casework 運用エンドポイント
 * 何を: 依存先サーキットブレーカーの状態を actuator health に載せる
 * なぜ: 遮断中の依存先を監視から一目で分かるようにするため
 */
package com.casedesk.casework.config;

import com.casedesk.casework.model.CircuitBreakerRecord;
import com.casedesk.casework.model.CircuitState;
import com.casedesk.casework.service.CircuitBreakerService;
import com.google.common.annotations.VisibleForTesting;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import lombok.RequiredArgsConstructor;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.HealthIndicator;
import org.springframework.boot.actuate.health.Status;
import org.springframework.stereotype.Component;

@Component("circuitBreakers")
@RequiredArgsConstructor
public class CircuitBreakerHealthIndicator implements HealthIndicator {

  // 依存先の遮断はアプリ自体の停止ではないため DOWN にはしない
  @VisibleForTesting
  static final Status DEGRADED = new Status("DEGRADED");

  private final CircuitBreakerService circuitBreakerService;

  @Override
  public Health health() {
    final List<CircuitBreakerRecord> breakers = circuitBreakerService.snapshot();
    final Map<String, String> states = new LinkedHashMap<>();
    breakers.forEach(breaker -> states.put(breaker.name(), breaker.state().name()));
    final boolean anyOpen =
        breakers.stream().anyMatch(breaker -> breaker.state() != CircuitState.CLOSED);
    final Health.Builder builder = anyOpen ? Health.status(DEGRADED) : Health.up();
    return builder.withDetail("breakers", states).build();
  }
}
