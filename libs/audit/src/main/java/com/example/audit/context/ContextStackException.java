/*
 * どこで: 監査コンテキスト
 * 何を: コンテキストスタックの不整合(空 pop/順序違いの close)を表す例外を定義する
 * なぜ: スコープの取り違えを黙って進めないため
 */
package com.example.audit.context;

import com.example.audit.AuditException;

public class ContextStackException extends AuditException {

  public ContextStackException(String message) {
    super(message);
  }
}
