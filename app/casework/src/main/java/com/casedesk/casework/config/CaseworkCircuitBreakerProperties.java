/*
 * どこで: Casework アプリの設定バインド
 * 何を: 依存先ごとのサーキットブレーカー閾値/cooldown を保持する
 * なぜ: 依存先の特性に合わせて個別に調整し、未設定時は既定値を使うため
 */
package com.casedesk.casework.config;

import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import java.time.Duration;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

@Validated
@ConfigurationProperties(prefix = "casework.circuit-breaker")
public record CaseworkCircuitBreakerProperties(
    @Positive int failureThreshold,
    @NotNull Duration cooldown,
    Map<String, DependencySettings> dependencies) {

  public CaseworkCircuitBreakerProperties {
    // SpotBugs の EI_EXPOSE_REP 対応: 受け取ったマップを防御的コピーして不変化する
    dependencies =
        dependencies == null
            ? Collections.emptyMap()
            : Collections.unmodifiableMap(new LinkedHashMap<>(dependencies));
  }

  public DependencySettings settingsFor(String dependencyName) {
    final DependencySettings override = dependencies.get(dependencyName);
    if (override == null) {
      return new DependencySettings(failureThreshold, cooldown);
    }
    // 個別設定の欠けた項目は既定値で埋める
    return new DependencySettings(
        override.failureThreshold() == null ? failureThreshold : override.failureThreshold(),
        override.cooldown() == null ? cooldown : override.cooldown());
  }

  public record DependencySettings(Integer failureThreshold, Duration cooldown) {}
}
