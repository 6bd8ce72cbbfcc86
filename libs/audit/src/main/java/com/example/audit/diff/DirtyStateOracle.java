/*
 * どこで: 監査差分検出
 * 何を: 永続化層が持つ変更前後の値を差分エンジンへ渡す口を定義する
 * なぜ: 特定の ORM に依存せずに差分を計算するため
 */
package com.example.audit.diff;

/**
 * Answers what the persistence layer knows about an instance inside the current unit of work.
 *
 * <p>{@link #previousValue} is the value as last loaded from the store and is only consulted for
 * {@link DirtyState#UPDATED} and {@link DirtyState#DELETED} instances. {@link #pendingValue} is the
 * value about to be written and is only consulted for {@link DirtyState#NEW} and {@link
 * DirtyState#UPDATED} instances.
 */
public interface DirtyStateOracle {

  default Class<?> recordType(Object instance) {
    return instance.getClass();
  }

  DirtyState classify(Object instance);

  Object previousValue(Object instance, String field);

  Object pendingValue(Object instance, String field);
}
