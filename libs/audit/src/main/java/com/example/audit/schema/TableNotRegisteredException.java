/*
 * どこで: 監査スキーマ登録
 * 何を: 未宣言のレコード型が参照された場合の例外を定義する
 * なぜ: 監査対象外の型への照会を明示的に失敗させるため
 */
package com.example.audit.schema;

public class TableNotRegisteredException extends ConfigurationException {

  public TableNotRegisteredException(Class<?> recordType) {
    super("record type is not tracked: " + recordType.getName());
  }
}
