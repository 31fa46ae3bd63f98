/*
 * どこで: Casework ドメインモデル
 * 何を: case_audit の登録用データを表す
 * なぜ: 状態遷移ごとに不変の監査レコードを 1 件残すため
 */
package com.casedesk.casework.model;

import java.time.Instant;
import java.util.UUID;

public record CaseAuditRecord(
    UUID auditId,
    String tenantId,
    UUID caseId,
    CaseStatus fromStatus,
    CaseStatus toStatus,
    String actorId,
    Instant occurredAt,
    String annotation,
    String detailJson) {}
