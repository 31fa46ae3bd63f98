/*
 * どこで: Casework サービス層
 * 何を: エンティティ単位の協調ロック (取得/解放/ハートビート/参照) を提供する
 * なぜ: 同じケースを複数の担当者が同時に編集しないようにするため
 */
package com.casedesk.casework.service;

import com.casedesk.casework.api.LockConflictException;
import com.casedesk.casework.api.LockNotHeldException;
import com.casedesk.casework.config.CaseworkLifecycleProperties;
import com.casedesk.casework.config.CaseworkLockProperties;
import com.casedesk.casework.model.EntityLock;
import com.casedesk.casework.model.EntityRef;
import com.casedesk.casework.model.LockAction;
import com.casedesk.casework.model.LockAuditRecord;
import com.casedesk.casework.repository.EntityLockRepository;
import com.casedesk.casework.repository.LockAuditRepository;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * 失効はタイマーを持たず、アクセス時に last_activity_at と非活動タイムアウトから判定する。
 * 変更系はすべて対象エンティティの advisory lock を取ってから判定と書き込みを行う。
 */
@Service
@RequiredArgsConstructor
public class EntityLockService {

  private static final Logger logger = LoggerFactory.getLogger(EntityLockService.class);

  private final EntityLockRepository lockRepository;
  private final LockAuditRepository auditRepository;
  private final AdvisoryLockKeyGenerator lockKeyGenerator;
  private final TransactionGuard transactionGuard;
  private final CaseworkLockProperties lockProperties;
  private final CaseworkLifecycleProperties lifecycleProperties;
  private final CaseworkMetrics metrics;
  private final Clock clock;

  public EntityLock acquire(TransactionContext context, EntityRef entity, String actorId) {
    transactionGuard.requireActive(context);
    requireActor(actorId);
    lockRepository.lockEntity(lockKeyGenerator.generate(entity.qualifiedName()));
    final Instant now = Instant.now(clock);
    final Duration timeout = lockProperties.inactivityTimeout();

    String previousHolderId = null;
    final Optional<EntityLock> current = lockRepository.find(entity);
    if (current.isPresent()) {
      final EntityLock existing = current.get();
      final boolean live = existing.isLiveAt(now, timeout);
      if (live && existing.isHeldBy(actorId)) {
        // 保持者自身の再取得は延長として扱い、監査は残さない
        final EntityLock refreshed =
            new EntityLock(entity, actorId, existing.acquiredAt(), now);
        lockRepository.upsert(refreshed);
        return refreshed;
      }
      if (live) {
        metrics.recordLockEvent("conflict");
        throw new LockConflictException(
            existing.holderId(), existing.acquiredAt(), existing.lastActivityAt());
      }
      autoRelease(existing, now, timeout);
      previousHolderId = existing.holderId();
    }

    final EntityLock granted = new EntityLock(entity, actorId, now, now);
    lockRepository.upsert(granted);
    auditRepository.insert(
        new LockAuditRecord(
            UUID.randomUUID(), entity, LockAction.ACQUIRED, actorId, previousHolderId, now, null));
    metrics.recordLockEvent("acquired");
    logger.info(
        "lock acquired entityType={} entityId={} holder={}",
        entity.entityType(),
        entity.entityId(),
        actorId);
    return granted;
  }

  /**
   * 保持者だけが解放できる。ロックが無ければ false。
   */
  public boolean release(TransactionContext context, EntityRef entity, String actorId) {
    transactionGuard.requireActive(context);
    requireActor(actorId);
    lockRepository.lockEntity(lockKeyGenerator.generate(entity.qualifiedName()));
    final Optional<EntityLock> current = lockRepository.find(entity);
    if (current.isEmpty()) {
      return false;
    }
    if (!current.get().isHeldBy(actorId)) {
      throw new LockNotHeldException("only the lock holder can release the lock");
    }
    final Instant now = Instant.now(clock);
    lockRepository.delete(entity);
    auditRepository.insert(
        new LockAuditRecord(
            UUID.randomUUID(), entity, LockAction.RELEASED, actorId, null, now, null));
    metrics.recordLockEvent("released");
    return true;
  }

  public EntityLock heartbeat(TransactionContext context, EntityRef entity, String actorId) {
    transactionGuard.requireActive(context);
    requireActor(actorId);
    lockRepository.lockEntity(lockKeyGenerator.generate(entity.qualifiedName()));
    final Instant now = Instant.now(clock);
    final EntityLock existing =
        lockRepository
            .find(entity)
            .filter(lock -> lock.isHeldBy(actorId))
            .filter(lock -> lock.isLiveAt(now, lockProperties.inactivityTimeout()))
            .orElseThrow(() -> new LockNotHeldException("caller does not hold a live lock"));
    lockRepository.touch(entity, actorId, now);
    return new EntityLock(entity, actorId, existing.acquiredAt(), now);
  }

  public Optional<EntityLock> findLive(EntityRef entity) {
    final Instant now = Instant.now(clock);
    return lockRepository
        .find(entity)
        .filter(lock -> lock.isLiveAt(now, lockProperties.inactivityTimeout()));
  }

  public List<LockAuditRecord> history(EntityRef entity) {
    return auditRepository.findByEntity(entity);
  }

  /**
   * 他者が有効なロックを持っていれば LockConflictException。ロックなしでの変更は許可する。
   */
  public void ensureNotHeldByOther(EntityRef entity, String actorId) {
    final Optional<EntityLock> live = findLive(entity);
    if (live.isPresent() && !live.get().isHeldBy(actorId)) {
      final EntityLock lock = live.get();
      metrics.recordLockEvent("conflict");
      throw new LockConflictException(lock.holderId(), lock.acquiredAt(), lock.lastActivityAt());
    }
  }

  private void autoRelease(EntityLock expired, Instant now, Duration timeout) {
    final Duration idle = Duration.between(expired.lastActivityAt(), now);
    final String detail =
        String.format(
            "auto-released after %d minutes of inactivity (timeout %d minutes), previous holder %s",
            idle.toMinutes(), timeout.toMinutes(), expired.holderId());
    lockRepository.delete(expired.entity());
    auditRepository.insert(
        new LockAuditRecord(
            UUID.randomUUID(),
            expired.entity(),
            LockAction.AUTO_RELEASED,
            lifecycleProperties.systemActor(),
            expired.holderId(),
            now,
            detail));
    metrics.recordLockEvent("auto_released");
    logger.warn(
        "lock auto-released entityType={} entityId={} previousHolder={} idleMinutes={}",
        expired.entity().entityType(),
        expired.entity().entityId(),
        expired.holderId(),
        idle.toMinutes());
  }

  private void requireActor(String actorId) {
    if (actorId == null || actorId.isBlank()) {
      throw new IllegalArgumentException("actorId is required");
    }
  }
}
