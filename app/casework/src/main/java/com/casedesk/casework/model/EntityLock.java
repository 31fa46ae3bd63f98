/*
 * どこで: Casework ドメインモデル
 * 何を: entity_locks の 1 行 (編集ロック) を表す
 * なぜ: 無操作タイムアウトによる失効を読込時に判定するため
 */
package com.casedesk.casework.model;

import java.time.Duration;
import java.time.Instant;

public record EntityLock(
    EntityRef entity, String holderId, Instant acquiredAt, Instant lastActivityAt) {

  // 失効はタイマーではなく保存済み時刻から毎回計算する。
  public boolean isLiveAt(Instant now, Duration inactivityTimeout) {
    return Duration.between(lastActivityAt, now).compareTo(inactivityTimeout) < 0;
  }

  public boolean isHeldBy(String actorId) {
    return holderId.equals(actorId);
  }
}
