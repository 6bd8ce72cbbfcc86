/*
 * どこで: 監査エンジン共通
 * 何を: 監査エンジンが送出する例外の基底型を定義する
 * なぜ: ホスト側が監査起因の失敗をまとめて識別できるようにするため
 */
package com.example.audit;

public class AuditException extends RuntimeException {

  public AuditException(String message) {
    super(message);
  }

  public AuditException(String message, Throwable cause) {
    super(message, cause);
  }
}
