/*
 * どこで: Casework API
 * 何を: 必須コメントや付随項目が欠けた遷移(400)を表す例外を定義する
 * なぜ: 状態を変更する前に入力不足で失敗させるため
 */
package com.casedesk.casework.api;

public class MissingAnnotationException extends RuntimeException {

  public MissingAnnotationException(String message) {
    super(message);
  }
}
