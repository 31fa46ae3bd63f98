package com.casedesk.casework.service;

import com.casedesk.casework.model.CaseStatus;
import java.time.Instant;
import java.util.UUID;

/**
 * @param expectedVersion 読み取り時の version。null なら現在値との照合を省略する
 */
public record CaseTransitionCommand(
    String tenantId,
    UUID caseId,
    CaseStatus targetStatus,
    String annotation,
    Instant resumeAt,
    String actorId,
    Long expectedVersion) {}
