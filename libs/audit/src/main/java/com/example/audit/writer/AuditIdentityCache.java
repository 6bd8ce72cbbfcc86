/*
 * どこで: 監査書き込み
 * 何を: コミット済みのテーブル/フィールド識別行の ID を保持する
 * なぜ: 毎回の upsert を省きつつ、ロールバックされた ID を参照しないため
 */
package com.example.audit.writer;

import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;

/**
 * Process-wide cache of identity rows known to be committed. Entries are only added through
 * {@link #promote}, which callers invoke after the creating transaction has committed. Resource rows
 * are not cached here because their number is unbounded.
 */
public class AuditIdentityCache {

  private final ConcurrentMap<String, Long> tableIds = new ConcurrentHashMap<>();
  private final ConcurrentMap<FieldKey, Long> fieldIds = new ConcurrentHashMap<>();

  public Optional<Long> tableId(String tableName) {
    return Optional.ofNullable(tableIds.get(tableName));
  }

  public Optional<Long> fieldId(long tableId, String fieldName) {
    return Optional.ofNullable(fieldIds.get(new FieldKey(tableId, fieldName)));
  }

  public void promote(Map<String, Long> tables, Map<FieldKey, Long> fields) {
    tableIds.putAll(tables);
    fieldIds.putAll(fields);
  }

  public void clear() {
    tableIds.clear();
    fieldIds.clear();
  }

  public record FieldKey(long tableId, String fieldName) {}
}
