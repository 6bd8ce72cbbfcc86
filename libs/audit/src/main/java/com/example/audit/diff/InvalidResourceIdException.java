/*
 * どこで: 監査差分検出
 * 何を: リソース ID が欠落/空/非対応型のときの例外を定義する
 * なぜ: 誰のものか分からない監査行を作らないため
 */
package com.example.audit.diff;

import com.example.audit.AuditException;

public class InvalidResourceIdException extends AuditException {

  public InvalidResourceIdException(String message) {
    super(message);
  }
}
