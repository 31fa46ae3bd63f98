/*
 * どこで: Casework API
 * 何を: エラーレスポンスの共通フォーマットを定義する
 * なぜ: クライアントが再試行すべきか判断できる情報 (保持者/現状態) を返すため
 */
package com.casedesk.casework.api;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
@JsonInclude(JsonInclude.Include.NON_EMPTY)
public record ApiErrorResponse(ApiErrorCode code, String message, Map<String, String> details) {

  public ApiErrorResponse {
    // SpotBugs の EI_EXPOSE_REP 対応: 受け取ったマップを防御的コピーして不変化する
    details =
        details == null
            ? Collections.emptyMap()
            : Collections.unmodifiableMap(new LinkedHashMap<>(details));
  }

  public ApiErrorResponse(ApiErrorCode code, String message) {
    this(code, message, null);
  }
}
