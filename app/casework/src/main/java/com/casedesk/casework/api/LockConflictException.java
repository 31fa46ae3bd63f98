/*
 * どこで: Casework API
 * 何を: 他者が有効な編集ロックを保持していること(409)を表す
 * なぜ: 保持者とロック時刻を返し、待つか諦めるかをクライアントに委ねるため
 */
package com.casedesk.casework.api;

import java.time.Instant;

public class LockConflictException extends RuntimeException {

  private final String holderId;
  private final Instant acquiredAt;
  private final Instant lastActivityAt;

  public LockConflictException(String holderId, Instant acquiredAt, Instant lastActivityAt) {
    super("entity is locked by " + holderId);
    this.holderId = holderId;
    this.acquiredAt = acquiredAt;
    this.lastActivityAt = lastActivityAt;
  }

  public String getHolderId() {
    return holderId;
  }

  public Instant getAcquiredAt() {
    return acquiredAt;
  }

  public Instant getLastActivityAt() {
    return lastActivityAt;
  }
}
