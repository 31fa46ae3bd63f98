/*
 * どこで: Casework API
 * 何を: ケースの遷移履歴レスポンスを表す
 * なぜ: case_id と履歴を明示的に返すため
 */
package com.casedesk.casework.api;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.UUID;

@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record CaseAuditResponse(UUID caseId, List<CaseAuditEntry> entries) {
  public CaseAuditResponse {
    // SpotBugs の EI_EXPOSE_REP 対応: 受け取ったリストを防御的コピーして不変化する
    entries =
        entries == null
            ? Collections.emptyList()
            : Collections.unmodifiableList(new ArrayList<>(entries));
  }
}
