package com.casedesk.casework.api;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record CircuitBreakersResponse(List<CircuitBreakerView> breakers) {
  public CircuitBreakersResponse {
    // SpotBugs の EI_EXPOSE_REP 対応: 受け取ったリストを防御的コピーして不変化する
    breakers =
        breakers == null
            ? Collections.emptyList()
            : Collections.unmodifiableList(new ArrayList<>(breakers));
  }
}
