/*
 * どこで: 監査スキーマ登録
 * 何を: 監査対象レコード型の宣言内容を組み立てる
 * なぜ: 省略可能な項目を持つ宣言を読みやすく記述するため
 */
package com.example.audit.schema;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Objects;

public final class TrackedSchemaDeclaration {

  private final Class<?> recordType;
  private final List<String> trackedFields = new ArrayList<>();
  private String tableName;
  private String resourceIdField;
  private String userIdField;
  private String label;

  private TrackedSchemaDeclaration(Class<?> recordType) {
    this.recordType = Objects.requireNonNull(recordType, "recordType");
  }

  public static TrackedSchemaDeclaration of(Class<?> recordType) {
    return new TrackedSchemaDeclaration(recordType);
  }

  public TrackedSchemaDeclaration fields(String... names) {
    return fields(List.of(names));
  }

  public TrackedSchemaDeclaration fields(Collection<String> names) {
    trackedFields.addAll(names);
    return this;
  }

  public TrackedSchemaDeclaration tableName(String tableName) {
    this.tableName = tableName;
    return this;
  }

  public TrackedSchemaDeclaration resourceIdField(String resourceIdField) {
    this.resourceIdField = resourceIdField;
    return this;
  }

  public TrackedSchemaDeclaration userIdField(String userIdField) {
    this.userIdField = userIdField;
    return this;
  }

  public TrackedSchemaDeclaration label(String label) {
    this.label = label;
    return this;
  }

  public Class<?> recordType() {
    return recordType;
  }

  public List<String> trackedFields() {
    return List.copyOf(trackedFields);
  }

  public String tableName() {
    return tableName;
  }

  public String resourceIdField() {
    return resourceIdField;
  }

  public String userIdField() {
    return userIdField;
  }

  public String label() {
    return label;
  }
}
