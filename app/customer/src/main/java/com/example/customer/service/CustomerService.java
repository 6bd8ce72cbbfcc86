/*
 * どこで: Customer サービス
 * 何を: 顧客の登録/更新/削除と監査履歴の参照を行う
 * なぜ: 業務更新と監査記録を同一トランザクションで確定させるため
 */
package com.example.customer.service;

import com.example.audit.context.AuditFrame;
import com.example.audit.context.ChangeContextHolder;
import com.example.audit.retrieval.ChangeQuery;
import com.example.audit.retrieval.ChangeRetriever;
import com.example.audit.retrieval.SortDirection;
import com.example.audit.session.ChangeRecorder;
import com.example.customer.api.CustomerChangeResponse;
import com.example.customer.api.CustomerChangesResponse;
import com.example.customer.api.CustomerCreateRequest;
import com.example.customer.api.CustomerNotFoundException;
import com.example.customer.api.CustomerResponse;
import com.example.customer.api.CustomerUpdateRequest;
import com.example.customer.model.CustomerRecord;
import com.example.customer.repository.CustomerRepository;
import java.time.Clock;
import java.time.Instant;
import java.util.List;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

@Service
@RequiredArgsConstructor
public class CustomerService {

  private static final Logger logger = LoggerFactory.getLogger(CustomerService.class);

  private final CustomerRepository customerRepository;
  private final ChangeRecorder changeRecorder;
  private final ChangeRetriever changeRetriever;
  private final ChangeContextHolder contextHolder;
  private final Clock clock;

  @Transactional
  public CustomerResponse create(CustomerCreateRequest request, String impersonatedBy) {
    final AuditFrame frame = frame(request.reason(), impersonatedBy);
    final CustomerRecord created =
        customerRepository.insert(
            request.name(), request.email(), request.userId(), request.tags(), clock.instant());
    contextHolder.runWith(frame, () -> changeRecorder.recordCreated(created));
    logger.info(
        "customer created customer_id={} user_id={}", created.customerId(), created.userId());
    return CustomerResponse.from(created);
  }

  @Transactional
  public CustomerResponse update(
      long customerId, CustomerUpdateRequest request, String impersonatedBy) {
    final AuditFrame frame = frame(request.reason(), impersonatedBy);
    final CustomerRecord before =
        customerRepository
            .findByIdForUpdate(customerId)
            .orElseThrow(() -> new CustomerNotFoundException(customerId));
    final CustomerRecord after =
        before.withChanges(request.name(), request.email(), request.tags(), clock.instant());
    customerRepository.update(after);
    // 値が変わらなかったフィールドは差分検出で落ちるため、そのまま登録してよい
    contextHolder.runWith(frame, () -> changeRecorder.recordUpdated(before, after));
    logger.info("customer updated customer_id={}", customerId);
    return CustomerResponse.from(after);
  }

  @Transactional
  public void delete(long customerId, String reason, String impersonatedBy) {
    final AuditFrame frame = frame(reason, impersonatedBy);
    final CustomerRecord before =
        customerRepository
            .findByIdForUpdate(customerId)
            .orElseThrow(() -> new CustomerNotFoundException(customerId));
    customerRepository.delete(customerId);
    contextHolder.runWith(frame, () -> changeRecorder.recordDeleted(before));
    logger.info("customer deleted customer_id={}", customerId);
  }

  @Transactional(readOnly = true)
  public CustomerResponse get(long customerId) {
    return customerRepository
        .findById(customerId)
        .map(CustomerResponse::from)
        .orElseThrow(() -> new CustomerNotFoundException(customerId));
  }

  /**
   * Returns the audit history of one customer. The customer row itself may already be deleted;
   * its history stays readable.
   */
  @Transactional(readOnly = true)
  public CustomerChangesResponse history(long customerId, CustomerHistoryFilter filter) {
    final ChangeQuery.Builder query =
        ChangeQuery.forResources(customerId)
            .fieldNames(filter.fields())
            .userIds(filter.userIds())
            .between(filter.from(), filter.to())
            .direction(filter.direction() == null ? SortDirection.ASC : filter.direction());
    if (filter.limit() != null) {
      query.limit(filter.limit());
    }
    if (filter.offset() != null) {
      query.offset(filter.offset());
    }
    final List<CustomerChangeResponse> changes =
        changeRetriever.query(CustomerRecord.class, query.build()).stream()
            .map(CustomerChangeResponse::from)
            .toList();
    return new CustomerChangesResponse(customerId, changes);
  }

  private AuditFrame frame(String reason, String impersonatedBy) {
    // 操作者はフレームに持たず、リクエストの user_id から解決させる
    return new AuditFrame(null, blankToNull(reason), blankToNull(impersonatedBy));
  }

  private String blankToNull(String value) {
    return value == null || value.isBlank() ? null : value;
  }

  /** Filter of the customer history endpoint; empty lists mean no restriction. */
  public record CustomerHistoryFilter(
      List<String> fields,
      List<String> userIds,
      Instant from,
      Instant to,
      SortDirection direction,
      Integer limit,
      Integer offset) {

    public CustomerHistoryFilter {
      fields = fields == null ? List.of() : List.copyOf(fields);
      userIds = userIds == null ? List.of() : List.copyOf(userIds);
    }

    public static CustomerHistoryFilter all() {
      return new CustomerHistoryFilter(null, null, null, null, SortDirection.ASC, null, null);
    }
  }
}
