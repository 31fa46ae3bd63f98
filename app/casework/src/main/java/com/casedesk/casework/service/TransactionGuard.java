/*
 * どこで: Casework サービス層
 * 何を: 作業単位をトランザクションで実行し、変更系の前提条件を検査する
 * なぜ: トランザクション外からの書き込みを実行時に検出し、部分書き込みを防ぐため
 */
package com.casedesk.casework.service;

import com.casedesk.casework.api.NoActiveTransactionException;
import com.casedesk.casework.config.CaseworkTransactionProperties;
import java.util.List;
import java.util.function.Function;
import java.util.function.Supplier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.support.TransactionSynchronizationManager;
import org.springframework.transaction.support.TransactionTemplate;

@Component
public class TransactionGuard {

  private static final Logger logger = LoggerFactory.getLogger(TransactionGuard.class);

  private final TransactionTemplate transactionTemplate;

  public TransactionGuard(
      PlatformTransactionManager transactionManager,
      CaseworkTransactionProperties transactionProperties) {
    this.transactionTemplate = new TransactionTemplate(transactionManager);
    this.transactionTemplate.setTimeout(
        Math.toIntExact(transactionProperties.timeout().toSeconds()));
  }

  /**
   * 変更系メソッドの先頭で呼ぶ。作業単位が開いていなければ NoActiveTransactionException。
   *
   * <p>skipped のコンテキストも拒否する。skip は書き込みを伴わない操作のためのもの。
   */
  public void requireActive(TransactionContext context) {
    if (context == null) {
      logger.error("mutating operation called without a transaction context");
      throw new NoActiveTransactionException("transaction context is required");
    }
    if (context.isSkipped()) {
      logger.error("mutating operation called with a skipped transaction context");
      throw new NoActiveTransactionException("transaction was skipped for this request");
    }
    if (!context.isActive() || !TransactionSynchronizationManager.isActualTransactionActive()) {
      logger.error("mutating operation called outside an active transaction");
      throw new NoActiveTransactionException("no active transaction");
    }
  }

  /**
   * work を 1 つのトランザクションで実行する。committed はコミット完了後にだけ立つ。
   * skipped のコンテキストではトランザクションを開かずにそのまま実行する。
   *
   * <p>afterCommit で登録された処理はコミット後に実行し、ロールバック時は破棄する。
   */
  public <T> T execute(TransactionContext context, Function<TransactionContext, T> work) {
    if (context.isSkipped()) {
      final T result = runDiscardingEffectsOnFailure(context, () -> work.apply(context));
      runAfterCommitEffects(context);
      return result;
    }
    if (context.isActive() || context.isCommitted()) {
      throw new IllegalStateException("transaction context is already in use");
    }
    final T result =
        runDiscardingEffectsOnFailure(
            context,
            () ->
                transactionTemplate.execute(
                    status -> {
                      context.markActive();
                      try {
                        return work.apply(context);
                      } finally {
                        context.markInactive();
                      }
                    }));
    context.markCommitted();
    runAfterCommitEffects(context);
    return result;
  }

  private <T> T runDiscardingEffectsOnFailure(TransactionContext context, Supplier<T> work) {
    try {
      return work.get();
    } catch (RuntimeException ex) {
      final List<Runnable> discarded = context.drainAfterCommitEffects();
      if (!discarded.isEmpty()) {
        logger.info("discarded after-commit effects on rollback count={}", discarded.size());
      }
      throw ex;
    }
  }

  // コミット済みの書き込みは戻せないため、後続処理の失敗は記録だけして残りを続ける
  private void runAfterCommitEffects(TransactionContext context) {
    for (Runnable effect : context.drainAfterCommitEffects()) {
      try {
        effect.run();
      } catch (RuntimeException ex) {
        logger.warn("after-commit effect failed", ex);
      }
    }
  }
}
