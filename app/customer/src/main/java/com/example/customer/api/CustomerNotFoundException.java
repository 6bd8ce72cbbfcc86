/*
 * どこで: Customer API
 * 何を: 指定 ID の顧客が存在しないことを表す
 * なぜ: 404 応答へ一貫して変換するため
 */
package com.example.customer.api;

public class CustomerNotFoundException extends RuntimeException {

  public CustomerNotFoundException(long customerId) {
    super("customer not found: " + customerId);
  }
}
