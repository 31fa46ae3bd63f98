/*
 * どこで: Casework ドメインモデル
 * 何を: circuit_breakers テーブルのスナップショットを表す
 * なぜ: 依存先ごとの状態を運用 API で参照するため
 */
package com.casedesk.casework.model;

import java.time.Instant;

public record CircuitBreakerRecord(
    String name,
    CircuitState state,
    int failureCount,
    Instant openedAt,
    Instant probeStartedAt,
    Instant updatedAt) {}
