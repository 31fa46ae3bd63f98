/*
 * どこで: Casework retention サービス
 * 何を: 期限切れの idempotency 記録を削除する
 * なぜ: テーブル肥大化を防ぎ、運用負荷を下げるため
 */
package com.casedesk.casework.service;

import com.casedesk.casework.repository.IdempotencyRecordRepository;
import java.time.Clock;
import java.time.Instant;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

@Service
@RequiredArgsConstructor
public class CaseworkRetentionService {

  private static final Logger logger = LoggerFactory.getLogger(CaseworkRetentionService.class);

  private final IdempotencyRecordRepository idempotencyRecordRepository;
  private final Clock clock;

  public int cleanup() {
    final Instant now = Instant.now(clock);
    // 監査テーブルは追記専用のため対象にしない
    final int deleted = idempotencyRecordRepository.deleteExpired(now);
    logger.info("casework retention cleanup deleted idempotencyRecords={} threshold={}", deleted, now);
    return deleted;
  }
}
