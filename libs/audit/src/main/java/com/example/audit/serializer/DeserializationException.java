/*
 * どこで: 監査値シリアライザ
 * 何を: 保存形式の文字列を型付き値に戻せない失敗を表す
 * なぜ: 読み出し経路でエントリ単位の失敗として扱うため
 */
package com.example.audit.serializer;

import com.example.audit.AuditException;

public class DeserializationException extends AuditException {

  public DeserializationException(String message) {
    super(message);
  }

  public DeserializationException(String message, Throwable cause) {
    super(message, cause);
  }
}
