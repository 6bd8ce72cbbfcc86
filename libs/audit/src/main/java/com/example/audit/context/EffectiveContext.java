/*
 * どこで: 監査コンテキスト
 * 何を: 書き込み時に各行へ刻む確定済みのコンテキストを表す
 * なぜ: スコープが閉じた後でもコミット時に同じ値を使うため
 */
package com.example.audit.context;

public record EffectiveContext(String actingUserId, String reason, String impersonatedBy) {

  public static final EffectiveContext EMPTY = new EffectiveContext(null, null, null);
}
