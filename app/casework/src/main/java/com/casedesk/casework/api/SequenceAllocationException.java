/*
 * どこで: Casework API
 * 何を: 連番採番の失敗を表す例外を定義する
 * なぜ: 非アトミックな代替採番に逃げず、所属トランザクションごと中断させるため
 */
package com.casedesk.casework.api;

public class SequenceAllocationException extends RuntimeException {

  public SequenceAllocationException(String message, Throwable cause) {
    super(message, cause);
  }
}
