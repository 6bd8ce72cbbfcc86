/*
 * どこで: 監査値シリアライザ
 * 何を: ハンドラ未登録/エンコード不能な値の失敗を表す
 * なぜ: 書き込み経路で未知の型を黙って落とさないため
 */
package com.example.audit.serializer;

import com.example.audit.AuditException;

public class UnsupportedTypeException extends AuditException {

  public UnsupportedTypeException(String message) {
    super(message);
  }

  public UnsupportedTypeException(String message, Throwable cause) {
    super(message, cause);
  }
}
