/*
 * どこで: Casework API
 * 何を: エンティティロックの状態レスポンスを表す
 * なぜ: 保持者と最終活動時刻をクライアントに示すため
 */
package com.casedesk.casework.api;

import com.casedesk.casework.model.EntityLock;
import com.casedesk.casework.model.EntityRef;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import java.time.Instant;

@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
@JsonInclude(JsonInclude.Include.NON_NULL)
public record LockResponse(
    String entityType,
    String entityId,
    boolean locked,
    String holderId,
    Instant acquiredAt,
    Instant lastActivityAt) {

  public static LockResponse held(EntityLock lock) {
    return new LockResponse(
        lock.entity().entityType(),
        lock.entity().entityId(),
        true,
        lock.holderId(),
        lock.acquiredAt(),
        lock.lastActivityAt());
  }

  public static LockResponse unlocked(EntityRef entity) {
    return new LockResponse(entity.entityType(), entity.entityId(), false, null, null, null);
  }
}
