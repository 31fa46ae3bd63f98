/*
 * どこで: Casework ドメインモデル
 * 何を: cases テーブルのスナップショットを表す
 * なぜ: API 応答と状態遷移の楽観ロック判定で共通化するため
 */
package com.casedesk.casework.model;

import java.time.Instant;
import java.util.UUID;

public record CaseRecord(
    UUID caseId,
    String tenantId,
    String caseNumber,
    String title,
    String description,
    CaseStatus status,
    Instant pendingUntil,
    String createdBy,
    Instant createdAt,
    String lastTransitionBy,
    Instant lastTransitionAt,
    long version) {}
