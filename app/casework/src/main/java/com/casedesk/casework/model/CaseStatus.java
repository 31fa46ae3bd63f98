/*
 * どこで: Casework ドメインモデル
 * 何を: ケースのライフサイクル状態を定義する
 * なぜ: 状態遷移表と永続化の整合性を保つため
 */
package com.casedesk.casework.model;

public enum CaseStatus {
  UNASSIGNED,
  OPEN,
  // 再開日時まで保留中。期限到来でスイープが OPEN に戻す。
  PENDED,
  RESOLVED,
  FILED
}
