/*
 * どこで: 監査差分検出
 * 何を: 書き込み待ちの 1 フィールド分の変更を表す
 * なぜ: 差分計算と書き込みを分離するため
 */
package com.example.audit.diff;

import com.example.audit.schema.TrackedSchema;
import java.util.Objects;

/**
 * One field-level change in stored form. {@code oldValue} is {@code null} for creations and {@code
 * newValue} is {@code null} for deletions; the two never compare equal.
 */
public record PendingChange(
    TrackedSchema schema,
    String resourceId,
    String fieldName,
    String oldValue,
    String newValue,
    String instanceUserId) {

  public boolean isNoOp() {
    return Objects.equals(oldValue, newValue);
  }
}
