/*
 * どこで: Customer API
 * 何を: 顧客 1 件分の監査履歴一覧を表す
 * なぜ: 履歴参照 API の応答形式を固定するため
 */
package com.example.customer.api;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import java.util.List;

@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record CustomerChangesResponse(long customerId, List<CustomerChangeResponse> changes) {}
