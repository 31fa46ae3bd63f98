/*
 * どこで: Casework ドメインモデル
 * 何を: lock_audit の登録用データを表す
 * なぜ: ロックの取得/解除/自動解除を後から追跡できるようにするため
 */
package com.casedesk.casework.model;

import java.time.Instant;
import java.util.UUID;

public record LockAuditRecord(
    UUID auditId,
    EntityRef entity,
    LockAction action,
    String actorId,
    String previousHolderId,
    Instant occurredAt,
    String detail) {}
