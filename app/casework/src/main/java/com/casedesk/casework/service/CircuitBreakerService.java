/*
 * どこで: Casework サービス層
 * 何を: 依存先ごとのサーキットブレーカー (判定/成功・失敗記録/保護付き呼び出し) を提供する
 * なぜ: 遅い・不安定な依存先への呼び出しを一定時間遮断し、障害の連鎖を防ぐため
 */
package com.casedesk.casework.service;

import com.casedesk.casework.api.DependencyUnavailableException;
import com.casedesk.casework.config.CaseworkCircuitBreakerProperties;
import com.casedesk.casework.config.CaseworkCircuitBreakerProperties.DependencySettings;
import com.casedesk.casework.model.CircuitBreakerRecord;
import com.casedesk.casework.model.CircuitState;
import com.casedesk.casework.repository.CircuitBreakerRepository;
import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.function.Supplier;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * 状態は circuit_breakers に置き、全インスタンスで共有する。状態の書き換えはすべて条件付きの単一文。
 */
@Service
@RequiredArgsConstructor
public class CircuitBreakerService {

  private static final Logger logger = LoggerFactory.getLogger(CircuitBreakerService.class);

  private final CircuitBreakerRepository repository;
  private final CaseworkCircuitBreakerProperties properties;
  private final CaseworkMetrics metrics;
  private final Clock clock;

  public boolean allow(String name) {
    requireName(name);
    final Optional<CircuitBreakerRecord> current = repository.find(name);
    if (current.isEmpty() || current.get().state() == CircuitState.CLOSED) {
      return true;
    }
    final Instant now = Instant.now(clock);
    final DependencySettings settings = properties.settingsFor(name);
    // cooldown 経過後は CAS で HALF_OPEN に進めた 1 件だけがプローブになる
    if (repository.tryStartProbe(name, now, now.minus(settings.cooldown()))) {
      logger.info("circuit half-open, probing dependency={}", name);
      return true;
    }
    metrics.recordCircuitRejected(name);
    return false;
  }

  public void recordSuccess(String name) {
    requireName(name);
    repository
        .close(name, Instant.now(clock))
        .filter(previous -> previous != CircuitState.CLOSED)
        .ifPresent(previous -> logger.info("circuit closed dependency={} from={}", name, previous));
  }

  public CircuitBreakerRecord recordFailure(String name) {
    requireName(name);
    final DependencySettings settings = properties.settingsFor(name);
    final CircuitBreakerRecord updated =
        repository.recordFailure(name, settings.failureThreshold(), Instant.now(clock));
    if (updated.state() == CircuitState.OPEN) {
      logger.warn(
          "circuit open dependency={} failures={} openedAt={}",
          name,
          updated.failureCount(),
          updated.openedAt());
    }
    return updated;
  }

  /**
   * 遮断中なら supplier を呼ばずに DependencyUnavailableException。呼び出し結果で成功/失敗を記録する。
   */
  public <T> T call(String name, Supplier<T> supplier) {
    if (!allow(name)) {
      throw new DependencyUnavailableException(name);
    }
    final T result;
    try {
      result = supplier.get();
    } catch (RuntimeException ex) {
      recordFailure(name);
      throw ex;
    }
    recordSuccess(name);
    return result;
  }

  public List<CircuitBreakerRecord> snapshot() {
    return repository.findAll();
  }

  /**
   * cooldown 中の OPEN ブレーカー名。cooldown を過ぎたものはプローブを通すために含めない。
   */
  public List<String> blockingDependencies() {
    final Instant now = Instant.now(clock);
    return repository.findAll().stream()
        .filter(breaker -> breaker.state() == CircuitState.OPEN)
        .filter(
            breaker ->
                breaker.openedAt() == null
                    || breaker
                        .openedAt()
                        .plus(properties.settingsFor(breaker.name()).cooldown())
                        .isAfter(now))
        .map(CircuitBreakerRecord::name)
        .toList();
  }

  public void reset(String name) {
    requireName(name);
    final Optional<CircuitState> previous = repository.close(name, Instant.now(clock));
    logger.info("circuit reset dependency={} from={}", name, previous.orElse(CircuitState.CLOSED));
  }

  private void requireName(String name) {
    if (name == null || name.isBlank()) {
      throw new IllegalArgumentException("dependency name is required");
    }
  }
}
