/*
 * どこで: 監査差分検出
 * 何を: 作業単位内でのインスタンスの状態区分を定義する
 * なぜ: 新規/更新/削除で旧値と新値の扱いが異なるため
 */
package com.example.audit.diff;

public enum DirtyState {
  NEW,
  UPDATED,
  DELETED
}
