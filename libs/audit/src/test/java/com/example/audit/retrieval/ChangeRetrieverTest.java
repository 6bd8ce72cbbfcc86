/*
 * どこで: 監査履歴の照会のテスト
 * 何を: 型復元と、復元できない行をエラー印付きで返す方針を検証する
 * なぜ: 1 行の破損で履歴全体が読めなくならないことを保証するため
 */
package com.example.audit.retrieval;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyBoolean;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

import com.example.audit.config.AuditMetrics;
import com.example.audit.model.StoredChange;
import com.example.audit.repository.AuditTableRepository;
import com.example.audit.repository.ChangeLogRepository;
import com.example.audit.schema.TableNotRegisteredException;
import com.example.audit.schema.TrackedSchemaDeclaration;
import com.example.audit.schema.TrackedSchemaRegistry;
import com.example.audit.serializer.DeserializationException;
import com.example.audit.serializer.TypeRegistry;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
class ChangeRetrieverTest {

  private static final Instant AT = Instant.parse("2026-03-01T09:00:00Z");

  record Order(String orderId, Integer quantity, Boolean paid, List<Long> lineIds) {}

  record Untracked(String id) {}

  @Mock private AuditTableRepository tableRepository;
  @Mock private ChangeLogRepository changeLogRepository;

  private final SimpleMeterRegistry meterRegistry = new SimpleMeterRegistry();
  private ChangeRetriever retriever;

  @BeforeEach
  void setUp() {
    final TypeRegistry typeRegistry = new TypeRegistry();
    final TrackedSchemaRegistry schemaRegistry = new TrackedSchemaRegistry(typeRegistry, null);
    schemaRegistry.declare(
        TrackedSchemaDeclaration.of(Order.class).fields("quantity", "paid", "lineIds").label("Orders"));
    retriever =
        new ChangeRetriever(
            schemaRegistry,
            typeRegistry,
            tableRepository,
            changeLogRepository,
            new AuditMetrics(meterRegistry));
  }

  @Test
  void storedValuesAreRestoredToDeclaredTypes() {
    stubRows(
        new StoredChange(1L, "quantity", "o-1", null, "3", AT, "u-1", "checkout", null),
        new StoredChange(2L, "paid", "o-1", "0", "1", AT, "u-1", null, "support-9"));

    final List<ChangeRecord> records =
        retriever.query(Order.class, ChangeQuery.forResources("o-1").build());

    assertThat(records).hasSize(2);
    assertThat(records.get(0).newValue()).isEqualTo(3);
    assertThat(records.get(0).oldValue()).isNull();
    assertThat(records.get(0).tableLabel()).isEqualTo("Orders");
    assertThat(records.get(0).reason()).isEqualTo("checkout");
    assertThat(records.get(1).oldValue()).isEqualTo(Boolean.FALSE);
    assertThat(records.get(1).newValue()).isEqualTo(Boolean.TRUE);
    assertThat(records.get(1).impersonatedBy()).isEqualTo("support-9");
    assertThat(records).allSatisfy(record -> assertThat(record.restored()).isTrue());
  }

  @Test
  void structuredValuesAreRestoredWithDeclaredElementTypes() {
    stubRows(
        new StoredChange(
            1L, "lineIds", "o-1", "[1]", "[1,9007199254740993]", AT, null, null, null));

    final ChangeRecord record =
        retriever.query(Order.class, ChangeQuery.forResources("o-1").build()).get(0);

    assertThat(record.restored()).isTrue();
    assertThat(record.oldValue()).isEqualTo(List.of(1L));
    assertThat(record.newValue()).isEqualTo(List.of(1L, 9007199254740993L));
  }

  @Test
  void malformedEntryIsMarkedAndQueryContinues() {
    stubRows(
        new StoredChange(1L, "quantity", "o-1", "2", "three", AT, null, null, null),
        new StoredChange(2L, "quantity", "o-1", "2", "4", AT, null, null, null));

    final List<ChangeRecord> records =
        retriever.query(Order.class, ChangeQuery.forResources("o-1").build());

    assertThat(records.get(0).restored()).isFalse();
    assertThat(records.get(0).failure()).isInstanceOf(DeserializationException.class);
    assertThat(records.get(0).newValue()).isNull();
    assertThat(records.get(0).storedNewValue()).isEqualTo("three");
    assertThat(records.get(1).newValue()).isEqualTo(4);
    assertThat(meterRegistry.get("audit.retrieval.restore.failures").counter().count())
        .isEqualTo(1.0d);
  }

  @Test
  void entriesOfFieldsNoLongerTrackedAreMarked() {
    stubRows(new StoredChange(1L, "discount", "o-1", null, "5", AT, null, null, null));

    final List<ChangeRecord> records =
        retriever.query(Order.class, ChangeQuery.forResources("o-1").build());

    assertThat(records)
        .singleElement()
        .satisfies(
            record -> {
              assertThat(record.failure()).hasMessageContaining("no longer tracked");
              assertThat(record.storedNewValue()).isEqualTo("5");
            });
  }

  @Test
  void declaredTableWithoutRowsYieldsEmptyList() {
    when(tableRepository.findIdByName("Order")).thenReturn(Optional.empty());

    assertThat(retriever.query(Order.class, ChangeQuery.forResources("o-1").build())).isEmpty();
    verifyNoInteractions(changeLogRepository);
  }

  @Test
  void undeclaredTypeIsRejected() {
    assertThatThrownBy(
            () -> retriever.query(Untracked.class, ChangeQuery.forResources("x").build()))
        .isInstanceOf(TableNotRegisteredException.class);
  }

  private void stubRows(StoredChange... rows) {
    when(tableRepository.findIdByName("Order")).thenReturn(Optional.of(5L));
    when(changeLogRepository.find(
            eq(5L), any(), any(), any(), any(), any(), any(), any(), anyBoolean()))
        .thenReturn(List.of(rows));
  }
}
