/*
 * どこで: 監査履歴の照会
 * 何を: 型復元済みの変更履歴 1 件を表す
 * なぜ: 呼び出し側が保存形式を意識せずに履歴を扱えるようにするため
 */
package com.example.audit.retrieval;

import com.example.audit.AuditException;
import java.time.Instant;

/**
 * One restored change-log entry. When the stored values could not be restored, {@code failure} is
 * set, {@code oldValue}/{@code newValue} are {@code null} and the raw stored forms are kept.
 */
public record ChangeRecord(
    String tableLabel,
    String fieldName,
    String resourceId,
    Object oldValue,
    Object newValue,
    String storedOldValue,
    String storedNewValue,
    Instant timestamp,
    String changedBy,
    String reason,
    String impersonatedBy,
    AuditException failure) {

  public boolean restored() {
    return failure == null;
  }
}
