/*
 * どこで: Casework サービス層
 * 何を: ケースの状態遷移と、保留期限が来たケースの自動再開を担う
 * なぜ: 遷移表・コメント必須・ロック・楽観ロック・監査を一つの手順で強制するため
 */
package com.casedesk.casework.service;

import com.casedesk.casework.api.CaseNotFoundException;
import com.casedesk.casework.api.CaseVersionConflictException;
import com.casedesk.casework.api.InvalidTransitionException;
import com.casedesk.casework.api.MissingAnnotationException;
import com.casedesk.casework.config.CaseworkLifecycleProperties;
import com.casedesk.casework.model.CaseAuditRecord;
import com.casedesk.casework.model.CaseRecord;
import com.casedesk.casework.model.CaseStatus;
import com.casedesk.casework.model.EntityRef;
import com.casedesk.casework.repository.CaseAuditRepository;
import com.casedesk.casework.repository.CaseRepository;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.time.Clock;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

@Service
@RequiredArgsConstructor
public class CaseLifecycleService {

  private static final Logger logger = LoggerFactory.getLogger(CaseLifecycleService.class);

  private final CaseRepository caseRepository;
  private final CaseAuditRepository auditRepository;
  private final EntityLockService lockService;
  private final TransactionGuard transactionGuard;
  private final CaseworkLifecycleProperties lifecycleProperties;
  private final CaseworkMetrics metrics;
  private final ObjectMapper objectMapper;
  private final Clock clock;

  public CaseRecord applyTransition(TransactionContext context, CaseTransitionCommand command) {
    transactionGuard.requireActive(context);
    final CaseRecord current =
        caseRepository
            .findById(command.tenantId(), command.caseId())
            .orElseThrow(() -> new CaseNotFoundException("case not found: " + command.caseId()));
    if (command.expectedVersion() != null && command.expectedVersion() != current.version()) {
      throw new CaseVersionConflictException("case was modified by another request");
    }
    final CaseStatus target = command.targetStatus();
    final TransitionRule rule = CaseLifecycle.DEFINITION.assertTransition(current.status(), target);
    if (rule.systemOnly()) {
      throw new InvalidTransitionException(
          current.status().name(),
          target.name(),
          "transition from " + current.status() + " to " + target + " is performed by the system");
    }
    final Instant now = Instant.now(clock);
    final String annotation = normalize(command.annotation());
    if (rule.requiresAnnotation() && annotation == null) {
      throw new MissingAnnotationException("comment is required to move a case to " + target);
    }
    if (rule.requiresResumeAt()) {
      if (command.resumeAt() == null) {
        throw new IllegalArgumentException("resume_at is required to move a case to " + target);
      }
      if (!command.resumeAt().isAfter(now)) {
        throw new IllegalArgumentException("resume_at must be in the future");
      }
    }
    // ロックは任意。他者が保持している間だけ人手の遷移を拒否する
    lockService.ensureNotHeldByOther(
        EntityRef.ofCase(command.tenantId(), command.caseId().toString()), command.actorId());

    final Instant pendingUntil = rule.requiresResumeAt() ? command.resumeAt() : null;
    return transition(
        context, current, target, pendingUntil, annotation, command.actorId(), now, false);
  }

  /**
   * 保留期限を過ぎた PENDED を OPEN に戻す。1 件ずつ別トランザクションで処理し、失敗は記録して次へ進む。
   *
   * @return 再開できた件数
   */
  public int resumeDuePendedCases() {
    final Instant now = Instant.now(clock);
    final List<CaseRecord> due =
        caseRepository.findDuePended(now, lifecycleProperties.resumeBatchSize());
    int resumed = 0;
    for (CaseRecord pended : due) {
      try {
        transactionGuard.execute(TransactionContext.create(), context -> resume(context, pended, now));
        resumed++;
      } catch (CaseVersionConflictException ex) {
        logger.info("pended case changed before resume caseId={}", pended.caseId());
      } catch (RuntimeException ex) {
        logger.warn("failed to resume pended case caseId={}", pended.caseId(), ex);
      }
    }
    metrics.recordAutoResumed(resumed);
    if (!due.isEmpty()) {
      logger.info("pended case resume sweep due={} resumed={}", due.size(), resumed);
    }
    return resumed;
  }

  private CaseRecord resume(TransactionContext context, CaseRecord pended, Instant now) {
    transactionGuard.requireActive(context);
    CaseLifecycle.DEFINITION.assertTransition(pended.status(), CaseStatus.OPEN);
    final String annotation =
        "automatically reopened after pending period expired (pending until "
            + pended.pendingUntil()
            + ")";
    return transition(
        context,
        pended,
        CaseStatus.OPEN,
        null,
        annotation,
        lifecycleProperties.systemActor(),
        now,
        true);
  }

  private CaseRecord transition(
      TransactionContext context,
      CaseRecord current,
      CaseStatus target,
      Instant pendingUntil,
      String annotation,
      String actorId,
      Instant now,
      boolean automatic) {
    final CaseRecord updated =
        caseRepository
            .updateStatus(current, target, pendingUntil, actorId, now)
            .orElseThrow(
                () -> new CaseVersionConflictException("case was modified by another request"));
    // 遷移と同じトランザクションで監査を書き、失敗時は遷移ごと戻す
    auditRepository.insert(
        new CaseAuditRecord(
            UUID.randomUUID(),
            current.tenantId(),
            current.caseId(),
            current.status(),
            target,
            actorId,
            now,
            annotation,
            buildAuditDetail(current, updated, automatic)));
    // 計測とログはコミットされた遷移だけを数える
    context.afterCommit(
        () -> {
          metrics.recordTransition(current.status().name(), target.name());
          logger.info(
              "case transitioned caseId={} from={} to={} actor={}",
              current.caseId(),
              current.status(),
              target,
              actorId);
        });
    return updated;
  }

  private String buildAuditDetail(CaseRecord before, CaseRecord after, boolean automatic) {
    final Map<String, Object> detail = new LinkedHashMap<>();
    detail.put("case_number", before.caseNumber());
    detail.put("version_before", before.version());
    detail.put("version_after", after.version());
    if (after.pendingUntil() != null) {
      detail.put("pending_until", after.pendingUntil().toString());
    }
    if (before.pendingUntil() != null && automatic) {
      detail.put("elapsed_pending_until", before.pendingUntil().toString());
    }
    detail.put("automatic", automatic);
    try {
      return objectMapper.writeValueAsString(detail);
    } catch (JsonProcessingException ex) {
      throw new IllegalStateException("failed to serialize audit detail", ex);
    }
  }

  private String normalize(String annotation) {
    if (annotation == null || annotation.isBlank()) {
      return null;
    }
    return annotation.strip();
  }
}
