/*
 * どこで: Casework アプリの設定バインド
 * 何を: 保留ケース自動再開スイープの設定を保持する
 * なぜ: 実行間隔とシステム実行者名を運用で調整できるようにするため
 */
package com.casedesk.casework.config;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import java.time.Duration;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

@Validated
@ConfigurationProperties(prefix = "casework.lifecycle")
public record CaseworkLifecycleProperties(
    boolean resumeEnabled,
    @NotNull Duration resumeInterval,
    @Positive int resumeBatchSize,
    @NotBlank String systemActor) {}
