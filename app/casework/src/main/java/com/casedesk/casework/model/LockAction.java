/*
 * どこで: Casework ドメインモデル
 * 何を: lock_audit.action の有効値を定義する
 * なぜ: 自動解除を明示的な遷移として記録するため
 */
package com.casedesk.casework.model;

public enum LockAction {
  ACQUIRED,
  RELEASED,
  AUTO_RELEASED
}
