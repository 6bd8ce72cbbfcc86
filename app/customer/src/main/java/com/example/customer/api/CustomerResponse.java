/*
 * どこで: Customer API
 * 何を: 顧客の現在値をレスポンスとして表す
 * なぜ: API 仕様に沿った JSON を返すため
 */
package com.example.customer.api;

import com.example.customer.model.CustomerRecord;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import java.time.Instant;
import java.util.List;

@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record CustomerResponse(
    long customerId,
    String name,
    String email,
    String userId,
    List<String> tags,
    Instant updatedAt) {

  public static CustomerResponse from(CustomerRecord record) {
    return new CustomerResponse(
        record.customerId(),
        record.name(),
        record.email(),
        record.userId(),
        record.tags(),
        record.updatedAt());
  }
}
