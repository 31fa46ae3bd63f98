/*
 * どこで: Casework API
 * 何を: 対象ケースが存在しないこと(404)を表す例外を定義する
 * なぜ: テナント外のケースも存在しないものとして扱うため
 */
package com.casedesk.casework.api;

public class CaseNotFoundException extends RuntimeException {

  public CaseNotFoundException(String message) {
    super(message);
  }
}
