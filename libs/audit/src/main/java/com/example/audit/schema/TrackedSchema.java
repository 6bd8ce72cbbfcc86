/*
 * どこで: 監査スキーマ登録
 * 何を: 1 つのレコード型に対する監査設定を保持する
 * なぜ: 差分検出/書き込み/照会が同じ宣言を参照するため
 */
package com.example.audit.schema;

import java.util.List;
import java.util.Optional;

public record TrackedSchema(
    Class<?> recordType,
    String tableName,
    List<TrackedField> fields,
    String resourceIdField,
    String userIdField,
    String label) {

  public TrackedSchema {
    fields = List.copyOf(fields);
  }

  public Optional<TrackedField> field(String name) {
    return fields.stream().filter(field -> field.name().equals(name)).findFirst();
  }

  public List<String> fieldNames() {
    return fields.stream().map(TrackedField::name).toList();
  }

  public Optional<String> userIdFieldName() {
    return Optional.ofNullable(userIdField);
  }
}
