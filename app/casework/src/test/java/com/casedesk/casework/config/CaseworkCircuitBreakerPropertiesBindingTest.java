/*
 * どこで: Casework 設定バインドのテスト
 * 何を: casework.circuit-breaker の既定値と依存先ごとの上書きを検証する
 * なぜ: 依存先ごとの閾値/cooldown が意図どおりに解決されることを保証するため
 */
package com.casedesk.casework.config;

import static org.assertj.core.api.Assertions.assertThat;

import com.casedesk.casework.config.CaseworkCircuitBreakerProperties.DependencySettings;
import java.time.Duration;
import org.junit.jupiter.api.Test;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.boot.context.properties.bind.validation.BindValidationException;
import org.springframework.boot.test.context.runner.ApplicationContextRunner;
import org.springframework.context.annotation.Configuration;

class CaseworkCircuitBreakerPropertiesBindingTest {

  private final ApplicationContextRunner contextRunner =
      new ApplicationContextRunner().withUserConfiguration(TestConfiguration.class);

  @Test
  void unknownDependencyUsesDefaults() {
    contextRunner
        .withPropertyValues(
            "casework.circuit-breaker.failure-threshold=3", "casework.circuit-breaker.cooldown=30s")
        .run(
            context -> {
              assertThat(context).hasNotFailed();
              final DependencySettings settings =
                  context.getBean(CaseworkCircuitBreakerProperties.class).settingsFor("mail");
              assertThat(settings.failureThreshold()).isEqualTo(3);
              assertThat(settings.cooldown()).isEqualTo(Duration.ofSeconds(30));
            });
  }

  @Test
  void dependencyOverrideFillsMissingValuesFromDefaults() {
    contextRunner
        .withPropertyValues(
            "casework.circuit-breaker.failure-threshold=3",
            "casework.circuit-breaker.cooldown=30s",
            "casework.circuit-breaker.dependencies.document-storage.cooldown=2m",
            "casework.circuit-breaker.dependencies.search-index.failure-threshold=10")
        .run(
            context -> {
              final CaseworkCircuitBreakerProperties properties =
                  context.getBean(CaseworkCircuitBreakerProperties.class);
              assertThat(properties.settingsFor("document-storage"))
                  .isEqualTo(new DependencySettings(3, Duration.ofMinutes(2)));
              assertThat(properties.settingsFor("search-index"))
                  .isEqualTo(new DependencySettings(10, Duration.ofSeconds(30)));
            });
  }

  @Test
  void contextFailsWhenThresholdIsNotPositive() {
    contextRunner
        .withPropertyValues(
            "casework.circuit-breaker.failure-threshold=0", "casework.circuit-breaker.cooldown=30s")
        .run(
            context -> {
              assertThat(context).hasFailed();
              final Throwable root =
                  org.assertj.core.util.Throwables.getRootCause(context.getStartupFailure());
              assertThat(root).isInstanceOf(BindValidationException.class);
              assertThat(root.getMessage()).contains("failureThreshold");
            });
  }

  @Configuration
  @EnableConfigurationProperties(CaseworkCircuitBreakerProperties.class)
  static class TestConfiguration {
    // ApplicationContextRunner 用の最小構成
  }
}
