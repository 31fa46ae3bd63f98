/*
 * どこで: Casework API
 * 何を: ケースのレスポンスを表す
 * なぜ: API 仕様に沿った JSON を返すため
 */
package com.casedesk.casework.api;

import com.casedesk.casework.model.CaseRecord;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import java.time.Instant;
import java.util.UUID;

@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record CaseResponse(
    UUID caseId,
    String tenantId,
    String caseNumber,
    String title,
    String description,
    String status,
    Instant pendingUntil,
    String createdBy,
    Instant createdAt,
    String lastTransitionBy,
    Instant lastTransitionAt,
    long version) {

  public static CaseResponse from(CaseRecord record) {
    return new CaseResponse(
        record.caseId(),
        record.tenantId(),
        record.caseNumber(),
        record.title(),
        record.description(),
        record.status().name(),
        record.pendingUntil(),
        record.createdBy(),
        record.createdAt(),
        record.lastTransitionBy(),
        record.lastTransitionAt(),
        record.version());
  }
}
