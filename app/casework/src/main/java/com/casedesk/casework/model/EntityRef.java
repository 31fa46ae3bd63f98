/*
 * どこで: Casework ドメインモデル
 * 何を: ロック対象エンティティをテナント込みで識別する
 * なぜ: テナントを跨いだ同一 ID の衝突を避けるため
 */
package com.casedesk.casework.model;

public record EntityRef(String tenantId, String entityType, String entityId) {

  public static final String TYPE_CASE = "CASE";

  public EntityRef {
    if (tenantId == null || tenantId.isBlank()) {
      throw new IllegalArgumentException("tenantId is required");
    }
    if (entityType == null || entityType.isBlank()) {
      throw new IllegalArgumentException("entityType is required");
    }
    if (entityId == null || entityId.isBlank()) {
      throw new IllegalArgumentException("entityId is required");
    }
  }

  public static EntityRef ofCase(String tenantId, String caseId) {
    return new EntityRef(tenantId, TYPE_CASE, caseId);
  }

  // advisory lock のキー生成元。区切り文字を固定して曖昧さを避ける。
  public String qualifiedName() {
    return tenantId + "|" + entityType + "|" + entityId;
  }
}
