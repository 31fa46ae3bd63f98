/*
 * どこで: Casework サービス層
 * 何を: 1 リクエスト分の作業単位の状態 (実行中/コミット済み/省略) を保持する
 * なぜ: 変更系メソッドが「トランザクション内で呼ばれたか」を明示的に検査できるようにするため
 */
package com.casedesk.casework.service;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * リクエストごとに生成し、共有しない。スレッドセーフではない。
 */
public final class TransactionContext {

  private final boolean skipped;
  private boolean active;
  private boolean committed;
  private final List<Runnable> afterCommitEffects = new ArrayList<>();

  private TransactionContext(boolean skipped) {
    this.skipped = skipped;
  }

  public static TransactionContext create() {
    return new TransactionContext(false);
  }

  /** トランザクションを開かない操作用。committed にはならない。 */
  public static TransactionContext skipped() {
    return new TransactionContext(true);
  }

  public boolean isActive() {
    return active;
  }

  public boolean isCommitted() {
    return committed;
  }

  public boolean isSkipped() {
    return skipped;
  }

  /**
   * コミット完了後に一度だけ実行する処理を登録する。ロールバックした場合は実行せずに破棄する。
   * skipped のコンテキストでは作業の正常終了後に実行する。
   */
  public void afterCommit(Runnable effect) {
    afterCommitEffects.add(Objects.requireNonNull(effect, "effect"));
  }

  List<Runnable> drainAfterCommitEffects() {
    final List<Runnable> drained = List.copyOf(afterCommitEffects);
    afterCommitEffects.clear();
    return drained;
  }

  void markActive() {
    active = true;
  }

  void markInactive() {
    active = false;
  }

  void markCommitted() {
    committed = true;
  }
}
