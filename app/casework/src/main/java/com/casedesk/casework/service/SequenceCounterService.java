/*
 * どこで: Casework サービス層
 * 何を: スコープ (テナント/業務種別/日付) ごとの連番を採番する
 * なぜ: 業務番号を重複なく発行するため
 */
package com.casedesk.casework.service;

import com.casedesk.casework.api.SequenceAllocationException;
import com.casedesk.casework.model.SequenceScope;
import com.casedesk.casework.repository.SequenceCounterRepository;
import java.time.Clock;
import java.time.Instant;
import java.util.OptionalLong;
import lombok.RequiredArgsConstructor;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Service;

/**
 * 採番は呼び出し元のトランザクションに含まれる。ロールバックすると番号も戻るため、
 * 発行済み番号に欠番は出ないが、コミット順と番号順は一致しない場合がある。
 */
@Service
@RequiredArgsConstructor
public class SequenceCounterService {

  private final SequenceCounterRepository repository;
  private final TransactionGuard transactionGuard;
  private final Clock clock;

  public long next(TransactionContext context, SequenceScope scope) {
    transactionGuard.requireActive(context);
    try {
      return repository.incrementAndGet(scope.scopeKey(), Instant.now(clock));
    } catch (DataAccessException ex) {
      throw new SequenceAllocationException(
          "failed to allocate sequence for " + scope.scopeKey(), ex);
    }
  }

  public OptionalLong current(SequenceScope scope) {
    return repository.findValue(scope.scopeKey());
  }
}
