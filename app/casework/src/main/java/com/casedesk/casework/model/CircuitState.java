/*
 * どこで: Casework ドメインモデル
 * 何を: サーキットブレーカーの状態を定義する
 * なぜ: 遷移を記録済みの成功/失敗と経過時間だけで駆動するため
 */
package com.casedesk.casework.model;

public enum CircuitState {
  CLOSED,
  OPEN,
  // cooldown 経過後、プローブ 1 件だけを通す。
  HALF_OPEN
}
