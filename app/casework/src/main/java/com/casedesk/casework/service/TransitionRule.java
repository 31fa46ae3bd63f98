package com.casedesk.casework.service;

/**
 * 遷移ごとの追加条件。
 *
 * @param requiresAnnotation 空でないコメントを必須にする
 * @param requiresResumeAt 未来の再開日時を必須にする
 * @param systemOnly 利用者の操作では行えず、システム処理だけが行う
 */
public record TransitionRule(
    boolean requiresAnnotation, boolean requiresResumeAt, boolean systemOnly) {

  public static TransitionRule plain() {
    return new TransitionRule(false, false, false);
  }

  public static TransitionRule annotated() {
    return new TransitionRule(true, false, false);
  }

  public static TransitionRule annotatedWithResumeAt() {
    return new TransitionRule(true, true, false);
  }

  public static TransitionRule systemAction() {
    return new TransitionRule(false, false, true);
  }
}
