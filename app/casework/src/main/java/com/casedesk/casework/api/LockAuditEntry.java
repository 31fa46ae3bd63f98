package com.casedesk.casework.api;

import com.casedesk.casework.model.LockAuditRecord;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import java.time.Instant;

@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
@JsonInclude(JsonInclude.Include.NON_NULL)
public record LockAuditEntry(
    String action, String actorId, String previousHolderId, Instant occurredAt, String detail) {

  public static LockAuditEntry from(LockAuditRecord record) {
    return new LockAuditEntry(
        record.action().name(),
        record.actorId(),
        record.previousHolderId(),
        record.occurredAt(),
        record.detail());
  }
}
