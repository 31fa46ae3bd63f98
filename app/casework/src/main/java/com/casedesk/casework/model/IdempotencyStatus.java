/*
 * どこで: Casework ドメインモデル
 * 何を: idempotency_records.status の有効値を定義する
 * なぜ: 予約/確定/失敗の遷移をアプリ側でも型で縛るため
 */
package com.casedesk.casework.model;

// DBのCHECK制約と値を一致させる。
public enum IdempotencyStatus {
  PENDING,
  COMMITTED,
  FAILED
}
