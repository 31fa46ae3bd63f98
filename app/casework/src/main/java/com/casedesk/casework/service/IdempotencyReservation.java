/*
 * どこで: Casework サービス層
 * 何を: Idempotency 予約の結果 (未追跡/実行可/再送) を表す
 * なぜ: 呼び出し側が結果ごとに分岐できるようにするため
 */
package com.casedesk.casework.service;

import com.casedesk.casework.model.CachedResponse;
import java.util.UUID;

public record IdempotencyReservation(Outcome outcome, UUID token, CachedResponse cachedResponse) {

  public enum Outcome {
    // キーなし。記録せずに実行する
    UNTRACKED,
    PROCEED,
    REPLAY
  }

  public static IdempotencyReservation untracked() {
    return new IdempotencyReservation(Outcome.UNTRACKED, null, null);
  }

  public static IdempotencyReservation proceed(UUID token) {
    return new IdempotencyReservation(Outcome.PROCEED, token, null);
  }

  public static IdempotencyReservation replay(CachedResponse cachedResponse) {
    return new IdempotencyReservation(Outcome.REPLAY, null, cachedResponse);
  }

  public boolean isReplay() {
    return outcome == Outcome.REPLAY;
  }

  public boolean isTracked() {
    return outcome == Outcome.PROCEED;
  }
}
