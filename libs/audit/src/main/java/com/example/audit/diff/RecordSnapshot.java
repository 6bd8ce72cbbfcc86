/*
 * どこで: 監査差分検出
 * 何を: ORM を持たないホスト向けに変更前後のレコードを 1 組で保持する
 * なぜ: JdbcTemplate で書くアプリでも差分検出を使えるようにするため
 */
package com.example.audit.diff;

import java.util.Objects;

/**
 * Before/after pair of one record. A created record has no {@code before}; a deleted record has no
 * {@code after}.
 */
public final class RecordSnapshot {

  private final Object before;
  private final Object after;
  private final DirtyState state;

  private RecordSnapshot(Object before, Object after, DirtyState state) {
    this.before = before;
    this.after = after;
    this.state = state;
  }

  public static RecordSnapshot created(Object after) {
    return new RecordSnapshot(null, Objects.requireNonNull(after, "after"), DirtyState.NEW);
  }

  public static RecordSnapshot updated(Object before, Object after) {
    Objects.requireNonNull(before, "before");
    Objects.requireNonNull(after, "after");
    if (before.getClass() != after.getClass()) {
      throw new IllegalArgumentException(
          "before and after must have the same type: "
              + before.getClass().getName()
              + " vs "
              + after.getClass().getName());
    }
    return new RecordSnapshot(before, after, DirtyState.UPDATED);
  }

  public static RecordSnapshot deleted(Object before) {
    return new RecordSnapshot(Objects.requireNonNull(before, "before"), null, DirtyState.DELETED);
  }

  public Object before() {
    return before;
  }

  public Object after() {
    return after;
  }

  public DirtyState state() {
    return state;
  }

  public Class<?> recordType() {
    return after != null ? after.getClass() : before.getClass();
  }
}
