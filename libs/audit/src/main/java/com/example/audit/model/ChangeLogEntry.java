/*
 * どこで: 監査ログのデータモデル
 * 何を: audit_change_log へ追記する 1 行を表す
 * なぜ: 書き込み時の列値を 1 つにまとめるため
 */
package com.example.audit.model;

import java.time.Instant;

public record ChangeLogEntry(
    long fieldId,
    long resourceRowId,
    String oldValue,
    String newValue,
    Instant changedAt,
    String changedBy,
    String reason,
    String impersonatedBy) {}
