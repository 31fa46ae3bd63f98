/*
 * どこで: Casework ドメインモデル
 * 何を: 連番カウンタのスコープ (テナント + ドメイン + 日付) を表す
 * なぜ: 日付が変わると新しいキーになり、明示的なリセットを不要にするため
 */
package com.casedesk.casework.model;

import java.time.LocalDate;
import java.time.format.DateTimeFormatter;

public record SequenceScope(String tenantId, String domain, LocalDate date) {

  private static final DateTimeFormatter KEY_DATE = DateTimeFormatter.BASIC_ISO_DATE;

  public SequenceScope {
    if (tenantId == null || tenantId.isBlank()) {
      throw new IllegalArgumentException("tenantId is required");
    }
    if (domain == null || domain.isBlank()) {
      throw new IllegalArgumentException("domain is required");
    }
    if (date == null) {
      throw new IllegalArgumentException("date is required");
    }
  }

  /** 区切りの ':' と '%' は要素内でエスケープし、異なるスコープが同じキーにならないようにする。 */
  public String scopeKey() {
    return escape(tenantId) + ":" + escape(domain) + ":" + date.format(KEY_DATE);
  }

  private static String escape(String part) {
    return part.replace("%", "%25").replace(":", "%3A");
  }
}
