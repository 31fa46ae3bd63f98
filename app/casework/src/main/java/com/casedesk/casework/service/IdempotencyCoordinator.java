/*
 * どこで: Casework サービス層
 * 何を: Idempotency-Key の予約・再送判定・結果確定を行う
 * なぜ: 同じ変更要求の再送を 1 回の実行に畳み込み、同一レスポンスを返すため
 */
package com.casedesk.casework.service;

import com.casedesk.casework.api.IdempotencyConflictException;
import com.casedesk.casework.api.IdempotencyInProgressException;
import com.casedesk.casework.config.CaseworkIdempotencyProperties;
import com.casedesk.casework.model.CachedResponse;
import com.casedesk.casework.model.IdempotencyRecord;
import com.casedesk.casework.model.IdempotencyStatus;
import com.casedesk.casework.repository.IdempotencyRecordRepository;
import java.time.Clock;
import java.time.Instant;
import java.util.Optional;
import java.util.UUID;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * 予約と失敗の記録は独立した短いトランザクションで行う。COMMITTED への確定だけは業務の作業単位に含める。
 *
 * <p>エラー応答はキャッシュしない。失敗した予約は FAILED になり、同じ内容の再送で再実行できる。
 */
@Service
@RequiredArgsConstructor
public class IdempotencyCoordinator {

  private static final Logger logger = LoggerFactory.getLogger(IdempotencyCoordinator.class);

  private final IdempotencyRecordRepository repository;
  private final TransactionGuard transactionGuard;
  private final CaseworkIdempotencyProperties properties;
  private final Clock clock;

  public IdempotencyReservation reserve(
      String tenantId, String actorId, String idempotencyKey, String fingerprint) {
    if (idempotencyKey == null || idempotencyKey.isBlank()) {
      return IdempotencyReservation.untracked();
    }
    // 待機上限は経過時間で測るため、業務時刻の Clock ではなく単調時計を使う
    final long deadline = System.nanoTime() + properties.pendingWait().toNanos();
    while (true) {
      final Instant now = Instant.now(clock);
      final IdempotencyRecord candidate =
          new IdempotencyRecord(
              tenantId,
              actorId,
              idempotencyKey,
              fingerprint,
              IdempotencyStatus.PENDING,
              UUID.randomUUID(),
              null,
              null,
              now,
              now.plus(properties.pendingLease()),
              now.plus(properties.retention()));
      if (repository.reserve(candidate, now)) {
        return IdempotencyReservation.proceed(candidate.token());
      }
      final Optional<IdempotencyRecord> existing =
          repository.findByKey(tenantId, actorId, idempotencyKey);
      if (existing.isPresent()) {
        final IdempotencyRecord record = existing.get();
        if (!record.isExpiredAt(now)) {
          if (!record.fingerprint().equals(fingerprint)) {
            throw new IdempotencyConflictException("Idempotency-Key conflict");
          }
          if (record.status() == IdempotencyStatus.COMMITTED) {
            return IdempotencyReservation.replay(
                new CachedResponse(record.responseCode(), record.responseBodyJson()));
          }
        }
        // PENDING 以外 (期限切れ/FAILED/リース切れ) は次の予約で取り直せる
      }
      if (System.nanoTime() - deadline >= 0) {
        throw new IdempotencyInProgressException(
            "a request with the same Idempotency-Key is still in progress");
      }
      pause();
    }
  }

  /**
   * 作業単位の中で予約を COMMITTED にし、応答を保存する。作業単位と一緒にコミットされる。
   *
   * <p>予約が他のリクエストに取り直されていた場合は例外で作業単位ごとロールバックする。
   */
  public void commit(
      TransactionContext context, IdempotencyReservation reservation, CachedResponse response) {
    transactionGuard.requireActive(context);
    if (!reservation.isTracked()) {
      return;
    }
    final int updated =
        repository.markCommitted(reservation.token(), response.statusCode(), response.bodyJson());
    if (updated == 0) {
      // リース切れで別リクエストが同じキーを実行中。二重実行を避けるためこちらを取り消す
      logger.warn("idempotency reservation was superseded token={}", reservation.token());
      throw new IdempotencyInProgressException(
          "a request with the same Idempotency-Key took over this reservation");
    }
  }

  /**
   * ロールバック後に予約を FAILED にする。同じ内容の再送は再実行される。
   */
  public void fail(IdempotencyReservation reservation) {
    if (!reservation.isTracked()) {
      return;
    }
    if (repository.markFailed(reservation.token()) == 0) {
      logger.warn(
          "idempotency reservation was superseded before failure token={}", reservation.token());
    }
  }

  private void pause() {
    try {
      Thread.sleep(properties.pendingPollInterval().toMillis());
    } catch (InterruptedException ex) {
      Thread.currentThread().interrupt();
      throw new IdempotencyInProgressException(
          "interrupted while waiting for a request with the same Idempotency-Key");
    }
  }
}
