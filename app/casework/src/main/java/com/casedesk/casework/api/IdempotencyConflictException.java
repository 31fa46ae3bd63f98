/*
 * どこで: Casework API
 * 何を: Idempotency-Key 競合(409)を表す例外を定義する
 * なぜ: 同一キーで異なるリクエストが来たことを再送と区別するため
 */
package com.casedesk.casework.api;

public class IdempotencyConflictException extends RuntimeException {

  public IdempotencyConflictException(String message) {
    super(message);
  }
}
