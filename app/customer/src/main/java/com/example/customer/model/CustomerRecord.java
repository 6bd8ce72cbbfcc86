/*
 * どこで: Customer ドメインモデル
 * 何を: customers テーブルの 1 行を表す
 * なぜ: 監査対象のフィールドを型付きで受け渡すため
 */
package com.example.customer.model;

import java.time.Instant;
import java.util.List;

public record CustomerRecord(
    long customerId,
    String name,
    String email,
    String userId,
    List<String> tags,
    Instant updatedAt) {

  public CustomerRecord {
    tags = tags == null ? List.of() : List.copyOf(tags);
  }

  public CustomerRecord withChanges(String name, String email, List<String> tags, Instant at) {
    return new CustomerRecord(
        customerId,
        name == null ? this.name : name,
        email == null ? this.email : email,
        userId,
        tags == null ? this.tags : tags,
        at);
  }
}
