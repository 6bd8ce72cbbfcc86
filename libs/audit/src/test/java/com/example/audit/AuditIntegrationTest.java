/*
 * どこで: 監査エンジンの統合テスト
 * 何を: 実 DB 上で識別行の正規化/履歴の並び順と絞り込み/ロールバック時の原子性を検証する
 * なぜ: 業務データと監査行が同じトランザクションで確定することを保証するため
 */
package com.example.audit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.tuple;

import com.example.audit.context.AuditFrame;
import com.example.audit.context.ChangeContextHolder;
import com.example.audit.repository.AuditFieldRepository;
import com.example.audit.repository.AuditResourceRepository;
import com.example.audit.repository.AuditTableRepository;
import com.example.audit.repository.ChangeLogRepository;
import com.example.audit.retrieval.ChangeQuery;
import com.example.audit.retrieval.ChangeRecord;
import com.example.audit.retrieval.ChangeRetriever;
import com.example.audit.retrieval.SortDirection;
import com.example.audit.serializer.UnsupportedTypeException;
import com.example.audit.session.ChangeRecorder;
import com.example.audit.support.MutableClock;
import com.example.audit.support.Widget;
import com.example.audit.writer.AuditIdentityCache;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.dao.DataAccessException;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.test.context.ActiveProfiles;
import org.springframework.transaction.IllegalTransactionStateException;
import org.springframework.transaction.support.TransactionTemplate;
import org.testcontainers.junit.jupiter.Testcontainers;

@SpringBootTest
@ActiveProfiles("test")
@Testcontainers(disabledWithoutDocker = true)
class AuditIntegrationTest extends AbstractPostgresContainerTest {

  private static final Instant T0 = AuditTestApplication.START;
  private static final Instant T1 = T0.plus(Duration.ofMinutes(1));
  private static final Instant T2 = T0.plus(Duration.ofMinutes(2));

  @Autowired private ChangeRecorder recorder;
  @Autowired private ChangeRetriever retriever;
  @Autowired private ChangeContextHolder contextHolder;
  @Autowired private TransactionTemplate transactionTemplate;
  @Autowired private NamedParameterJdbcTemplate jdbcTemplate;
  @Autowired private MutableClock clock;
  @Autowired private AuditIdentityCache identityCache;
  @Autowired private AuditTableRepository tableRepository;
  @Autowired private AuditFieldRepository fieldRepository;
  @Autowired private AuditResourceRepository resourceRepository;
  @Autowired private ChangeLogRepository changeLogRepository;

  @BeforeEach
  void cleanup() {
    // 変更ログは UPDATE/DELETE をトリガーで拒否するため TRUNCATE で初期化する
    jdbcTemplate.update(
        "TRUNCATE audit_change_log, audit_resources, audit_fields, audit_tables, widgets"
            + " RESTART IDENTITY CASCADE",
        new MapSqlParameterSource());
    identityCache.clear();
    clock.set(T0);
  }

  @Test
  void identityRowsAreNormalisedAcrossTransactions() {
    final Widget widget = new Widget("w-1", "bolt", 1.0d, List.of("m3"), true, "owner-1");
    inTransaction(() -> recorder.recordCreated(widget));
    inTransaction(() -> recorder.recordUpdated(widget, widget.withName("nut")));
    inTransaction(() -> recorder.recordUpdated(widget.withName("nut"), widget.withName("screw")));

    final long tableId = tableRepository.findIdByName("Widget").orElseThrow();
    assertThat(tableRepository.countAll()).isEqualTo(1);
    assertThat(fieldRepository.countByTableId(tableId)).isEqualTo(4);
    assertThat(resourceRepository.countByTableId(tableId)).isEqualTo(1);
    assertThat(changeLogRepository.countAll()).isEqualTo(6);
  }

  @Test
  void historyIsOrderedAndFiltered() {
    final Widget widget = new Widget("w-1", "bolt", 1.5d, null, null, "owner-1");
    final Widget other = new Widget("w-2", "gear", 9.0d, null, null, "owner-2");
    inTransaction(() -> recorder.recordCreated(widget));
    clock.set(T1);
    contextHolder.runWith(
        AuditFrame.actingUser("editor").withReason("rename"),
        () ->
            inTransaction(
                () -> {
                  recorder.recordUpdated(widget, widget.withName("nut"));
                  recorder.recordCreated(other);
                }));
    clock.set(T2);
    inTransaction(() -> recorder.recordUpdated(widget.withName("nut"), widget.withPrice(2.25d)));

    final List<ChangeRecord> all =
        retriever.query(Widget.class, ChangeQuery.forResources("w-1").build());
    assertThat(all)
        .extracting(ChangeRecord::fieldName, ChangeRecord::newValue, ChangeRecord::timestamp)
        .containsExactly(
            tuple("name", "bolt", T0),
            tuple("price", 1.5d, T0),
            tuple("name", "nut", T1),
            tuple("name", "bolt", T2),
            tuple("price", 2.25d, T2));
    assertThat(all.get(2).changedBy()).isEqualTo("editor");
    assertThat(all.get(2).reason()).isEqualTo("rename");
    assertThat(all.get(0).changedBy()).isEqualTo("owner-1");
    assertThat(all.get(0).tableLabel()).isEqualTo("Widget");

    final List<ChangeRecord> names =
        retriever.query(
            Widget.class, ChangeQuery.forResources("w-1").fieldNames("name").build());
    assertThat(names).extracting(ChangeRecord::newValue).containsExactly("bolt", "nut", "bolt");

    final List<ChangeRecord> atT1 =
        retriever.query(
            Widget.class, ChangeQuery.forResources("w-1", "w-2").between(T1, T1).build());
    assertThat(atT1).extracting(ChangeRecord::resourceId).containsExactly("w-1", "w-2", "w-2");

    final List<ChangeRecord> byEditor =
        retriever.query(
            Widget.class, ChangeQuery.forResources("w-1", "w-2").userIds("editor").build());
    assertThat(byEditor).hasSize(3);

    final List<ChangeRecord> newestFirst =
        retriever.query(
            Widget.class,
            ChangeQuery.forResources("w-1")
                .direction(SortDirection.DESC)
                .limit(2)
                .offset(1)
                .build());
    assertThat(newestFirst)
        .extracting(ChangeRecord::fieldName, ChangeRecord::timestamp)
        .containsExactly(tuple("name", T2), tuple("name", T1));
  }

  @Test
  void deletionRecordsOldValuesOnly() {
    final Widget widget = new Widget("w-3", "washer", null, List.of("zinc"), false, null);
    inTransaction(() -> recorder.recordDeleted(widget));

    final List<ChangeRecord> history =
        retriever.query(Widget.class, ChangeQuery.forResources("w-3").build());

    assertThat(history)
        .extracting(ChangeRecord::fieldName, ChangeRecord::oldValue, ChangeRecord::newValue)
        .containsExactly(
            tuple("name", "washer", null),
            tuple("tags", List.of("zinc"), null),
            tuple("active", false, null));
  }

  @Test
  void failedAuditRollsBackBusinessWriteAndRetryIsRecordedOnce() {
    final Widget broken = new Widget("w-4", "spring", 3.0d, List.of(new Object()), true, null);
    final Widget fixed = new Widget("w-4", "spring", 3.0d, List.of("steel"), true, null);

    assertThatThrownBy(() -> inTransaction(() -> createWidget(broken)))
        .isInstanceOf(UnsupportedTypeException.class);
    assertThat(countWidgets()).isZero();
    assertThat(changeLogRepository.countAll()).isZero();

    inTransaction(() -> createWidget(fixed));

    assertThat(countWidgets()).isEqualTo(1);
    assertThat(retriever.query(Widget.class, ChangeQuery.forResources("w-4").build()))
        .extracting(ChangeRecord::fieldName)
        .containsExactly("name", "price", "tags", "active");
  }

  @Test
  void ownerIdLongerThanFrameLimitIsStored() {
    final String owner = "owner-" + "x".repeat(AuditFrame.MAX_USER_ID_LENGTH);
    final Widget widget = new Widget("w-7", "rivet", null, null, null, owner);

    inTransaction(() -> createWidget(widget));

    assertThat(countWidgets()).isEqualTo(1);
    assertThat(retriever.query(Widget.class, ChangeQuery.forResources("w-7").build()))
        .singleElement()
        .satisfies(record -> assertThat(record.changedBy()).isEqualTo(owner));
  }

  @Test
  void changeLogIsAppendOnly() {
    inTransaction(
        () -> recorder.recordCreated(new Widget("w-5", "pin", null, null, null, null)));

    assertThatThrownBy(
            () ->
                jdbcTemplate.update(
                    "UPDATE audit_change_log SET new_value = 'x'", new MapSqlParameterSource()))
        .isInstanceOf(DataAccessException.class);
    assertThatThrownBy(
            () -> jdbcTemplate.update("DELETE FROM audit_change_log", new MapSqlParameterSource()))
        .isInstanceOf(DataAccessException.class);
  }

  @Test
  void enlistingOutsideTransactionFails() {
    assertThatThrownBy(
            () -> recorder.recordCreated(new Widget("w-6", "cap", null, null, null, null)))
        .isInstanceOf(IllegalTransactionStateException.class);
  }

  private void createWidget(Widget widget) {
    jdbcTemplate.update(
        "INSERT INTO widgets (widget_id, name, price) VALUES (:id, :name, :price)",
        new MapSqlParameterSource()
            .addValue("id", widget.widgetId())
            .addValue("name", widget.name())
            .addValue("price", widget.price()));
    recorder.recordCreated(widget);
  }

  private int countWidgets() {
    final Integer count =
        jdbcTemplate.queryForObject(
            "SELECT COUNT(*) FROM widgets", new MapSqlParameterSource(), Integer.class);
    return count == null ? 0 : count;
  }

  private void inTransaction(Runnable action) {
    transactionTemplate.executeWithoutResult(status -> action.run());
  }
}
