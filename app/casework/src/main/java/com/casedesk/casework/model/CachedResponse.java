/*
 * どこで: Casework ドメインモデル
 * 何を: 冪等キーに紐づく確定済みレスポンスを表す
 * なぜ: 再送時にハンドラを再実行せず同一の応答を返すため
 */
package com.casedesk.casework.model;

public record CachedResponse(int statusCode, String bodyJson) {}
