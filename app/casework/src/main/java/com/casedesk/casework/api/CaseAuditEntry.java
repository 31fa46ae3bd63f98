package com.casedesk.casework.api;

import com.casedesk.casework.model.CaseAuditRecord;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import java.time.Instant;

@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record CaseAuditEntry(
    String fromStatus, String toStatus, String actorId, Instant occurredAt, String annotation) {

  public static CaseAuditEntry from(CaseAuditRecord record) {
    return new CaseAuditEntry(
        record.fromStatus() == null ? null : record.fromStatus().name(),
        record.toStatus().name(),
        record.actorId(),
        record.occurredAt(),
        record.annotation());
  }
}
