/*
 * どこで: Casework retention ワーカー
 * 何を: retention cleanup をスケジュールで起動する
 * なぜ: 手動介入なしで期限切れ削除を回すため
 */
package com.casedesk.casework.service;

import lombok.RequiredArgsConstructor;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

@Component
@RequiredArgsConstructor
@ConditionalOnProperty(name = "casework.retention.enabled", havingValue = "true")
public class CaseworkRetentionWorker {

  private final CaseworkRetentionService retentionService;

  @Scheduled(fixedDelayString = "${casework.retention.cleanup-interval}")
  public void run() {
    // 直前の処理が終わってから次を待つ固定遅延で回す。
    retentionService.cleanup();
  }
}
