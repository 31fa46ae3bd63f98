/*
 * どこで: Casework API
 * 何を: 楽観ロック (version) の競合(409)を表す例外を定義する
 * なぜ: 同一ケースへの同時遷移で後着側をロールバックさせるため
 */
package com.casedesk.casework.api;

public class CaseVersionConflictException extends RuntimeException {

  public CaseVersionConflictException(String message) {
    super(message);
  }
}
