/*
 * どこで: 監査スキーマ登録
 * 何を: 監査対象の宣言が不正な場合の例外を定義する
 * なぜ: 起動時に設定誤りを検出して即座に失敗させるため
 */
package com.example.audit.schema;

import com.example.audit.AuditException;

public class ConfigurationException extends AuditException {

  public ConfigurationException(String message) {
    super(message);
  }

  public ConfigurationException(String message, Throwable cause) {
    super(message, cause);
  }
}
