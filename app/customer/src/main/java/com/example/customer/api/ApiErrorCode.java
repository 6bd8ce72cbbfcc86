/*
 * どこで: Customer API
 * 何を: エラー応答のコードを定義する
 * なぜ: 同じ HTTP ステータスでも原因を区別できるようにするため
 */
package com.example.customer.api;

public enum ApiErrorCode {
  BAD_REQUEST,
  CUSTOMER_NOT_FOUND,
  AUDIT_FAILURE
}
