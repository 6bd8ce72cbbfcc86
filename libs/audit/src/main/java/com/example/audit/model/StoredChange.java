/*
 * どこで: 監査ログのデータモデル
 * 何を: 照会で読み出した変更ログ 1 行(保存形式のまま)を表す
 * なぜ: 型復元の前段でフィールド名とリソース ID を解決済みの形で扱うため
 */
package com.example.audit.model;

import java.time.Instant;

public record StoredChange(
    long changeId,
    String fieldName,
    String resourceId,
    String oldValue,
    String newValue,
    Instant changedAt,
    String changedBy,
    String reason,
    String impersonatedBy) {}
