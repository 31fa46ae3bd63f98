/*
 * どこで: Casework API
 * 何を: トランザクション外で更新処理が実行されたこと(500)を表す
 * なぜ: ラッパ漏れを部分書き込みではなく即時の失敗として表面化させるため
 */
package com.casedesk.casework.api;

public class NoActiveTransactionException extends IllegalStateException {

  public NoActiveTransactionException(String message) {
    super(message);
  }
}
