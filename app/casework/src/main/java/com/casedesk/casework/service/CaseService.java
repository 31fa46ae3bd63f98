/*
 * どこで: Casework サービス層
 * 何を: ケースの作成 (番号採番を含む) と参照を行う
 * なぜ: 採番・作成・監査を同じトランザクションで確定させるため
 */
package com.casedesk.casework.service;

import com.casedesk.casework.api.CaseNotFoundException;
import com.casedesk.casework.model.CaseAuditRecord;
import com.casedesk.casework.model.CaseRecord;
import com.casedesk.casework.model.CaseStatus;
import com.casedesk.casework.model.SequenceScope;
import com.casedesk.casework.repository.CaseAuditRepository;
import com.casedesk.casework.repository.CaseRepository;
import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.util.List;
import java.util.UUID;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

@Service
@RequiredArgsConstructor
public class CaseService {

  private static final Logger logger = LoggerFactory.getLogger(CaseService.class);

  private final CaseRepository caseRepository;
  private final CaseAuditRepository auditRepository;
  private final SequenceCounterService sequenceCounterService;
  private final CaseNumberFormatter caseNumberFormatter;
  private final TransactionGuard transactionGuard;
  private final Clock clock;

  public CaseRecord create(TransactionContext context, CreateCaseCommand command) {
    transactionGuard.requireActive(context);
    final Instant now = Instant.now(clock);
    // 番号の日付は Clock のタイムゾーン (既定 UTC) で決める
    final LocalDate today = LocalDate.now(clock);
    final long sequence =
        sequenceCounterService.next(
            context,
            new SequenceScope(command.tenantId(), CaseNumberFormatter.SEQUENCE_DOMAIN, today));
    final CaseRecord created =
        new CaseRecord(
            UUID.randomUUID(),
            command.tenantId(),
            caseNumberFormatter.format(today, sequence),
            command.title(),
            command.description(),
            CaseStatus.UNASSIGNED,
            null,
            command.actorId(),
            now,
            command.actorId(),
            now,
            0L);
    caseRepository.insert(created);
    auditRepository.insert(
        new CaseAuditRecord(
            UUID.randomUUID(),
            created.tenantId(),
            created.caseId(),
            null,
            CaseStatus.UNASSIGNED,
            command.actorId(),
            now,
            null,
            null));
    logger.info(
        "case created caseId={} caseNumber={} tenant={}",
        created.caseId(),
        created.caseNumber(),
        created.tenantId());
    return created;
  }

  public CaseRecord get(String tenantId, UUID caseId) {
    return caseRepository
        .findById(tenantId, caseId)
        .orElseThrow(() -> new CaseNotFoundException("case not found: " + caseId));
  }

  public List<CaseAuditRecord> history(String tenantId, UUID caseId) {
    // 存在しないケースは空の履歴ではなく 404 にする
    get(tenantId, caseId);
    return auditRepository.findByCase(tenantId, caseId);
  }
}
