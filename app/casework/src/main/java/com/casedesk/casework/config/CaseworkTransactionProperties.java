/*
 * どこで: Casework アプリの設定バインド
 * 何を: 更新トランザクションのタイムアウトを保持する
 * なぜ: 長時間化した unit of work を中途半端に残さずロールバックさせるため
 */
package com.casedesk.casework.config;

import jakarta.validation.constraints.NotNull;
import java.time.Duration;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

@Validated
@ConfigurationProperties(prefix = "casework.transaction")
public record CaseworkTransactionProperties(@NotNull Duration timeout) {}
