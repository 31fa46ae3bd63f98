/*
 * どこで: Casework API
 * 何を: 遷移表にない状態遷移(409)を表す例外を定義する
 * なぜ: 現在状態を添えてクライアントに返すため
 */
package com.casedesk.casework.api;

public class InvalidTransitionException extends RuntimeException {

  private final String currentStatus;
  private final String targetStatus;

  public InvalidTransitionException(String currentStatus, String targetStatus) {
    this(currentStatus, targetStatus,
        "cannot change status from " + currentStatus + " to " + targetStatus);
  }

  public InvalidTransitionException(String currentStatus, String targetStatus, String message) {
    super(message);
    this.currentStatus = currentStatus;
    this.targetStatus = targetStatus;
  }

  public String getCurrentStatus() {
    return currentStatus;
  }

  public String getTargetStatus() {
    return targetStatus;
  }
}
