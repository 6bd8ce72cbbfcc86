/*
 * どこで: 監査差分検出
 * 何を: RecordSnapshot から変更前後の値を読み出す
 * なぜ: スナップショット方式のホストに既定の実装を提供するため
 */
package com.example.audit.diff;

import com.example.audit.schema.FieldReader;

public class SnapshotDirtyStateOracle implements DirtyStateOracle {

  @Override
  public Class<?> recordType(Object instance) {
    return snapshot(instance).recordType();
  }

  @Override
  public DirtyState classify(Object instance) {
    return snapshot(instance).state();
  }

  @Override
  public Object previousValue(Object instance, String field) {
    final RecordSnapshot snapshot = snapshot(instance);
    if (snapshot.before() == null) {
      return null;
    }
    return FieldReader.read(snapshot.before(), field);
  }

  @Override
  public Object pendingValue(Object instance, String field) {
    final RecordSnapshot snapshot = snapshot(instance);
    if (snapshot.after() == null) {
      return null;
    }
    return FieldReader.read(snapshot.after(), field);
  }

  private static RecordSnapshot snapshot(Object instance) {
    if (instance instanceof RecordSnapshot snapshot) {
      return snapshot;
    }
    throw new IllegalArgumentException(
        "expected a RecordSnapshot but got " + instance.getClass().getName());
  }
}
