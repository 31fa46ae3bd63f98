/*
 * どこで: Casework API
 * 何を: サーキットブレーカーによる即時失敗(503)を表す例外を定義する
 * なぜ: 依存先の障害を入力検証エラーと混同させないため
 */
package com.casedesk.casework.api;

public class DependencyUnavailableException extends RuntimeException {

  private final String dependency;

  public DependencyUnavailableException(String dependency) {
    this(dependency, dependency + " is unavailable");
  }

  public DependencyUnavailableException(String dependency, String message) {
    super(message);
    this.dependency = dependency;
  }

  public String getDependency() {
    return dependency;
  }
}
