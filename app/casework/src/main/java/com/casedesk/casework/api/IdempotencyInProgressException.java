/*
 * どこで: Casework API
 * 何を: 同一キーの先行リクエストが処理中のまま待機上限に達したことを表す
 * なぜ: クライアントに時間を置いた再送を促すため
 */
package com.casedesk.casework.api;

public class IdempotencyInProgressException extends RuntimeException {

  public IdempotencyInProgressException(String message) {
    super(message);
  }
}
