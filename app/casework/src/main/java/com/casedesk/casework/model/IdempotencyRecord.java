/*
 * どこで: Casework ドメインモデル
 * 何を: idempotency_records テーブルの読込結果を表す
 * なぜ: 冪等応答の再利用と予約状態の判定を安全に行うため
 */
package com.casedesk.casework.model;

import java.time.Instant;
import java.util.UUID;

public record IdempotencyRecord(
    String tenantId,
    String actorId,
    String idempotencyKey,
    String fingerprint,
    IdempotencyStatus status,
    UUID token,
    Integer responseCode,
    String responseBodyJson,
    Instant createdAt,
    Instant leaseUntil,
    Instant expiresAt) {

  public boolean isExpiredAt(Instant now) {
    return !expiresAt.isAfter(now);
  }

  public boolean isLeaseLapsedAt(Instant now) {
    return status == IdempotencyStatus.PENDING && !leaseUntil.isAfter(now);
  }
}
