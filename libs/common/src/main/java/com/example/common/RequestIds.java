/*
 * どこで: 共通ユーティリティ
 * 何を: リクエスト ID の受け取りと採番を行う
 * なぜ: ログと監査の突き合わせに使う ID を全アプリで揃えるため
 */
package com.example.common;

import java.util.UUID;

public final class RequestIds {

  public static final String HEADER = "X-Request-Id";

  private RequestIds() {}

  /** Returns the caller supplied id when present, otherwise a new random one. */
  public static String resolve(String headerValue) {
    if (headerValue != null && !headerValue.isBlank()) {
      return headerValue.trim();
    }
    return newRequestId();
  }

  public static String newRequestId() {
    return UUID.randomUUID().toString();
  }
}
