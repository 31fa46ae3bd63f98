/*
 * どこで: 共通ユーティリティ
 * 何を: リクエスト相関 ID を生成する
 * なぜ: 上流が X-Request-Id を付与しない場合でもログを突合できるようにするため
 */
package com.casedesk.common;

import java.util.UUID;

public final class TraceIds {
  private TraceIds() {}

  public static String newTraceId() {
    return UUID.randomUUID().toString();
  }

  public static String resolve(String candidate) {
    if (candidate == null || candidate.isBlank()) {
      return newTraceId();
    }
    return candidate;
  }
}
