/*
 * どこで: Customer API
 * 何を: 監査履歴の 1 件をレスポンスとして表す
 * なぜ: 復元できなかった値も原因付きで返すため
 */
package com.example.customer.api;

import com.example.audit.retrieval.ChangeRecord;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import java.time.Instant;

@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record CustomerChangeResponse(
    String field,
    Object oldValue,
    Object newValue,
    Instant changedAt,
    String changedBy,
    String reason,
    String impersonatedBy,
    String error) {

  public static CustomerChangeResponse from(ChangeRecord record) {
    if (!record.restored()) {
      // 復元できない行は保存文字列のまま返す
      return new CustomerChangeResponse(
          record.fieldName(),
          record.storedOldValue(),
          record.storedNewValue(),
          record.timestamp(),
          record.changedBy(),
          record.reason(),
          record.impersonatedBy(),
          record.failure().getMessage());
    }
    return new CustomerChangeResponse(
        record.fieldName(),
        record.oldValue(),
        record.newValue(),
        record.timestamp(),
        record.changedBy(),
        record.reason(),
        record.impersonatedBy(),
        null);
  }
}
