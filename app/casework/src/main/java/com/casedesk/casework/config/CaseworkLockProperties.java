/*
 * どこで: Casework アプリの設定バインド
 * 何を: 編集ロックの無操作タイムアウトを保持する
 * なぜ: ロックが有効かどうかの唯一の判定基準を設定で持つため
 */
package com.casedesk.casework.config;

import jakarta.validation.constraints.NotNull;
import java.time.Duration;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

@Validated
@ConfigurationProperties(prefix = "casework.lock")
public record CaseworkLockProperties(@NotNull Duration inactivityTimeout) {}
