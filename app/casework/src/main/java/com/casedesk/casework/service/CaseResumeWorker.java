/*
 * どこで: Casework lifecycle ワーカー
 * 何を: 保留期限が来たケースの再開スイープをスケジュールで起動する
 * なぜ: 再開日時を過ぎた PENDED を手動介入なしで OPEN に戻すため
 */
package com.casedesk.casework.service;

import lombok.RequiredArgsConstructor;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

@Component
@RequiredArgsConstructor
@ConditionalOnProperty(name = "casework.lifecycle.resume-enabled", havingValue = "true")
public class CaseResumeWorker {

  private final CaseLifecycleService lifecycleService;

  @Scheduled(fixedDelayString = "${casework.lifecycle.resume-interval}")
  public void run() {
    lifecycleService.resumeDuePendedCases();
  }
}
