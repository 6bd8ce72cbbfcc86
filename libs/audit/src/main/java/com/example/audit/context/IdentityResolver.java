/*
 * どこで: 監査コンテキスト
 * 何を: フレームに操作者が無いときに現在の利用者 ID を返す拡張点を定義する
 * なぜ: 認証基盤への依存をホスト側に閉じ込めるため
 */
package com.example.audit.context;

@FunctionalInterface
public interface IdentityResolver {

  IdentityResolver NONE = () -> null;

  /** Returns the current user id, or {@code null} when no user is known. */
  String currentUserId();
}
