package com.casedesk.casework.api;

import com.casedesk.casework.model.CircuitBreakerRecord;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import java.time.Instant;

@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record CircuitBreakerView(
    String name,
    String state,
    int failureCount,
    Instant openedAt,
    Instant probeStartedAt,
    Instant updatedAt) {

  public static CircuitBreakerView from(CircuitBreakerRecord record) {
    return new CircuitBreakerView(
        record.name(),
        record.state().name(),
        record.failureCount(),
        record.openedAt(),
        record.probeStartedAt(),
        record.updatedAt());
  }
}
