/*
 * どこで: Customer API
 * 何を: 顧客の登録/更新/削除/参照と監査履歴のエンドポイントを提供する
 * なぜ: アプリの公開インターフェースを明確にするため
 */
package com.example.customer.api;

import com.example.audit.retrieval.SortDirection;
import com.example.customer.service.CustomerService;
import com.example.customer.service.CustomerService.CustomerHistoryFilter;
import jakarta.validation.Valid;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.Positive;
import jakarta.validation.constraints.PositiveOrZero;
import java.time.Instant;
import java.util.List;
import lombok.RequiredArgsConstructor;
import org.springframework.format.annotation.DateTimeFormat;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.validation.annotation.Validated;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PatchMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/v1/customers")
@RequiredArgsConstructor
@Validated
public class CustomerController {

  private static final String HEADER_IMPERSONATED_BY = "X-Impersonated-By";

  private final CustomerService customerService;

  @PostMapping
  public ResponseEntity<CustomerResponse> create(
      @RequestHeader(value = HEADER_IMPERSONATED_BY, required = false) String impersonatedBy,
      @Valid @RequestBody CustomerCreateRequest request) {
    final CustomerResponse response = customerService.create(request, impersonatedBy);
    return ResponseEntity.status(HttpStatus.CREATED).body(response);
  }

  @GetMapping("/{customer_id}")
  public CustomerResponse get(
      @PathVariable("customer_id") @Positive(message = "customer_id must be positive")
          long customerId) {
    return customerService.get(customerId);
  }

  @PatchMapping("/{customer_id}")
  public CustomerResponse update(
      @PathVariable("customer_id") @Positive(message = "customer_id must be positive")
          long customerId,
      @RequestHeader(value = HEADER_IMPERSONATED_BY, required = false) String impersonatedBy,
      @Valid @RequestBody CustomerUpdateRequest request) {
    return customerService.update(customerId, request, impersonatedBy);
  }

  @DeleteMapping("/{customer_id}")
  public ResponseEntity<Void> delete(
      @PathVariable("customer_id") @Positive(message = "customer_id must be positive")
          long customerId,
      @RequestParam(value = "reason", required = false) String reason,
      @RequestHeader(value = HEADER_IMPERSONATED_BY, required = false) String impersonatedBy) {
    customerService.delete(customerId, reason, impersonatedBy);
    return ResponseEntity.noContent().build();
  }

  @GetMapping("/{customer_id}/changes")
  public CustomerChangesResponse changes(
      @PathVariable("customer_id") @Positive(message = "customer_id must be positive")
          long customerId,
      @RequestParam(value = "field", required = false) List<String> fields,
      @RequestParam(value = "user_id", required = false) List<String> userIds,
      @RequestParam(value = "from", required = false)
          @DateTimeFormat(iso = DateTimeFormat.ISO.DATE_TIME)
          Instant from,
      @RequestParam(value = "to", required = false)
          @DateTimeFormat(iso = DateTimeFormat.ISO.DATE_TIME)
          Instant to,
      @RequestParam(value = "order", defaultValue = "ASC") SortDirection order,
      @RequestParam(value = "limit", required = false)
          @Min(value = 1, message = "limit must be between 1 and 1000")
          @Max(value = 1000, message = "limit must be between 1 and 1000")
          Integer limit,
      @RequestParam(value = "offset", required = false)
          @PositiveOrZero(message = "offset must not be negative")
          Integer offset) {
    return customerService.history(
        customerId, new CustomerHistoryFilter(fields, userIds, from, to, order, limit, offset));
  }
}
