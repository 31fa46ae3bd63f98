/*
 * どこで: Casework API
 * 何を: ロック非保持者による解除/延長(403)を表す例外を定義する
 * なぜ: 既に失ったロックを操作しようとする競合を明示的に拒否するため
 */
package com.casedesk.casework.api;

public class LockNotHeldException extends RuntimeException {

  public LockNotHeldException(String message) {
    super(message);
  }
}
