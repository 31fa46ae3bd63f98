/*
 * どこで: Casework アプリの設定バインド
 * 何を: 冪等性レコードの保持期間と PENDING 待機設定を保持する
 * なぜ: 保持期間と同時重複時の待ち時間を運用で調整できるようにするため
 */
package com.casedesk.casework.config;

import jakarta.validation.constraints.NotNull;
import java.time.Duration;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

@Validated
@ConfigurationProperties(prefix = "casework.idempotency")
public record CaseworkIdempotencyProperties(
    @NotNull Duration retention,
    @NotNull Duration pendingLease,
    @NotNull Duration pendingWait,
    @NotNull Duration pendingPollInterval) {}
