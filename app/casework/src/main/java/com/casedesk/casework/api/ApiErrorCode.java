/*
 * どこで: Casework API
 * 何を: エラー応答のコードを定義する
 * なぜ: 同じ HTTP ステータスでも原因 (再試行可否) を区別できるようにするため
 */
package com.casedesk.casework.api;

public enum ApiErrorCode {
  BAD_REQUEST,
  CASE_NOT_FOUND,
  IDEMPOTENCY_KEY_CONFLICT,
  IDEMPOTENCY_REQUEST_IN_PROGRESS,
  INVALID_TRANSITION,
  MISSING_ANNOTATION,
  LOCK_CONFLICT,
  LOCK_NOT_HELD,
  CONCURRENT_MODIFICATION,
  DEPENDENCY_UNAVAILABLE,
  INTERNAL_ERROR
}
