/*
 * どこで: 監査差分検出
 * 何を: 作業単位内のインスタンスから監査対象フィールドの変更を抽出する
 * なぜ: コミット直前に保存形式で比較し、実際の変更だけを記録するため
 */
package com.example.audit.diff;

import com.example.audit.schema.TrackedField;
import com.example.audit.schema.TrackedSchema;
import com.example.audit.serializer.TypeRegistry;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import lombok.RequiredArgsConstructor;

/**
 * Turns enlisted instances into {@link PendingChange}s.
 *
 * <p>Values are compared in stored form, so two values that serialize identically never produce a
 * change. Output follows instance order, then field declaration order. Any failure aborts the
 * whole computation.
 */
@RequiredArgsConstructor
public class DiffEngine {

  private final TypeRegistry typeRegistry;

  public List<PendingChange> computeChanges(
      List<TrackedInstance> instances, DirtyStateOracle oracle) {
    final List<PendingChange> changes = new ArrayList<>();
    for (TrackedInstance tracked : instances) {
      collect(tracked, oracle, changes);
    }
    return Collections.unmodifiableList(changes);
  }

  private void collect(TrackedInstance tracked, DirtyStateOracle oracle, List<PendingChange> out) {
    final Object instance = tracked.instance();
    final TrackedSchema schema = tracked.schema();
    final DirtyState state = oracle.classify(instance);
    final String resourceId = resourceId(instance, schema, state, oracle);
    final String instanceUserId = instanceUserId(instance, schema, state, oracle);

    for (TrackedField field : schema.fields()) {
      final String oldValue =
          state == DirtyState.NEW
              ? null
              : typeRegistry.serialize(
                  oracle.previousValue(instance, field.name()), field.genericType());
      final String newValue =
          state == DirtyState.DELETED
              ? null
              : typeRegistry.serialize(
                  oracle.pendingValue(instance, field.name()), field.genericType());
      final PendingChange change =
          new PendingChange(schema, resourceId, field.name(), oldValue, newValue, instanceUserId);
      if (!change.isNoOp()) {
        out.add(change);
      }
    }
  }

  private static String resourceId(
      Object instance, TrackedSchema schema, DirtyState state, DirtyStateOracle oracle) {
    final Object raw = valueOf(instance, schema.resourceIdField(), state, oracle);
    return ResourceIds.normalize(raw)
        .orElseThrow(
            () ->
                new InvalidResourceIdException(
                    "resource id "
                        + schema.resourceIdField()
                        + " of "
                        + schema.tableName()
                        + " is missing or unsupported: "
                        + raw));
  }

  private static String instanceUserId(
      Object instance, TrackedSchema schema, DirtyState state, DirtyStateOracle oracle) {
    if (schema.userIdField() == null) {
      return null;
    }
    final Object raw = valueOf(instance, schema.userIdField(), state, oracle);
    if (raw == null) {
      return null;
    }
    final String text = raw.toString();
    return text.isBlank() ? null : text;
  }

  // 削除時は変更前の値、それ以外は書き込み予定の値を使う
  private static Object valueOf(
      Object instance, String field, DirtyState state, DirtyStateOracle oracle) {
    return state == DirtyState.DELETED
        ? oracle.previousValue(instance, field)
        : oracle.pendingValue(instance, field);
  }
}
