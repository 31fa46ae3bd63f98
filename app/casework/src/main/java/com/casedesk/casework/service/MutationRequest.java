/*
 * どこで: Casework サービス層
 * 何を: 変更系リクエストの共通属性をまとめる
 * なぜ: Idempotency とトランザクション制御を操作ごとに書き分けないため
 */
package com.casedesk.casework.service;

/**
 * @param resourcePath fingerprint に含める対象パス。同じ本文でも対象が違えば別リクエストになる
 * @param successStatus 成功時に返す HTTP ステータス。再送時も同じ値を返す
 * @param skipTransaction トランザクションを開かずに実行する
 */
public record MutationRequest(
    String tenantId,
    String actorId,
    String idempotencyKey,
    String operation,
    String resourcePath,
    Object body,
    int successStatus,
    boolean skipTransaction) {

  public MutationRequest {
    if (tenantId == null || tenantId.isBlank()) {
      throw new IllegalArgumentException("tenantId is required");
    }
    if (actorId == null || actorId.isBlank()) {
      throw new IllegalArgumentException("actorId is required");
    }
    if (operation == null || operation.isBlank()) {
      throw new IllegalArgumentException("operation is required");
    }
  }

  public static MutationRequest transactional(
      String tenantId,
      String actorId,
      String idempotencyKey,
      String operation,
      String resourcePath,
      Object body,
      int successStatus) {
    return new MutationRequest(
        tenantId, actorId, idempotencyKey, operation, resourcePath, body, successStatus, false);
  }
}
