/*
 * どこで: Casework アプリの設定バインド
 * 何を: retention cleanup のスケジュール設定を保持する
 * なぜ: 削除間隔と有効/無効を運用で調整できるようにするため
 */
package com.casedesk.casework.config;

import java.time.Duration;
import org.springframework.boot.context.properties.ConfigurationProperties;

@ConfigurationProperties(prefix = "casework.retention")
public record CaseworkRetentionProperties(boolean enabled, Duration cleanupInterval) {}
