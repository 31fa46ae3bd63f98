/*
 * どこで: Casework API
 * 何を: 状態遷移リクエストの入力を保持する
 * なぜ: JSON からのバインドと検証を明確にするため
 */
package com.casedesk.casework.api;

import com.casedesk.casework.model.CaseStatus;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import jakarta.validation.constraints.NotNull;
import java.time.Instant;

// comment の必須判定は遷移ごとに異なるため、ここでは検証しない
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record CaseTransitionRequest(
    @NotNull(message = "target_status is required") CaseStatus targetStatus,
    String comment,
    Instant resumeAt,
    Long expectedVersion) {}
