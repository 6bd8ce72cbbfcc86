/*
 * どこで: 監査トランザクション連携のテスト
 * 何を: 登録時のコンテキスト捕捉/コミット直前の一括書き込み/失敗時の伝播を検証する
 * なぜ: 監査行がトランザクションと運命を共にすることを保証するため
 */
package com.example.audit.session;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.inOrder;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

import com.example.audit.config.AuditMetrics;
import com.example.audit.context.AuditFrame;
import com.example.audit.context.ChangeContext;
import com.example.audit.context.ChangeContextHolder;
import com.example.audit.context.EffectiveContext;
import com.example.audit.context.IdentityResolver;
import com.example.audit.diff.DiffEngine;
import com.example.audit.diff.PendingChange;
import com.example.audit.diff.RecordSnapshot;
import com.example.audit.diff.SnapshotDirtyStateOracle;
import com.example.audit.schema.TrackedSchemaDeclaration;
import com.example.audit.schema.TrackedSchemaRegistry;
import com.example.audit.serializer.TypeRegistry;
import com.example.audit.writer.AuditWriter;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.InOrder;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.transaction.IllegalTransactionStateException;
import org.springframework.transaction.support.TransactionSynchronization;
import org.springframework.transaction.support.TransactionSynchronizationManager;

@ExtendWith(MockitoExtension.class)
class ChangeRecorderTest {

  private static final Instant NOW = Instant.parse("2026-03-01T09:00:00Z");

  record Note(String id, String body) {}

  record Scratch(String id, String body) {}

  @Mock private AuditWriter writer;

  private final SimpleMeterRegistry meterRegistry = new SimpleMeterRegistry();
  private final ChangeContextHolder contextHolder = new ChangeContextHolder(IdentityResolver.NONE);
  private TrackedSchemaRegistry schemaRegistry;
  private ChangeRecorder recorder;

  @BeforeEach
  void setUp() {
    final TypeRegistry typeRegistry = new TypeRegistry();
    schemaRegistry = new TrackedSchemaRegistry(typeRegistry, null);
    schemaRegistry.declare(TrackedSchemaDeclaration.of(Note.class).fields("body"));
    recorder = newRecorder(true, typeRegistry);
    TransactionSynchronizationManager.initSynchronization();
    TransactionSynchronizationManager.setActualTransactionActive(true);
  }

  @AfterEach
  void tearDown() {
    if (TransactionSynchronizationManager.isSynchronizationActive()) {
      TransactionSynchronizationManager.clear();
    }
  }

  @Test
  void contextIsCapturedAtEnlistAndBatchSharesOneTimestamp() {
    when(writer.commit(any(), any(), any())).thenReturn(1);
    contextHolder.runWith(
        AuditFrame.actingUser("alice").withReason("import"),
        () -> recorder.recordCreated(new Note("n-1", "hello")));
    contextHolder.runWith(
        AuditFrame.actingUser("bob"),
        () -> recorder.recordUpdated(new Note("n-2", "old"), new Note("n-2", "new")));

    beforeCommit();

    final EffectiveContext alice = new EffectiveContext("alice", "import", null);
    final EffectiveContext bob = new EffectiveContext("bob", null, null);
    verify(writer).commit(eq(List.of(change("n-1", null, "hello"))), eq(alice), eq(NOW));
    verify(writer).commit(eq(List.of(change("n-2", "old", "new"))), eq(bob), eq(NOW));
  }

  @Test
  void interleavedContextsAreWrittenInEnlistOrder() {
    when(writer.commit(any(), any(), any())).thenReturn(1);
    final AuditFrame aliceFrame = AuditFrame.actingUser("alice");
    contextHolder.runWith(aliceFrame, () -> recorder.recordCreated(new Note("n-a", "a")));
    contextHolder.runWith(
        AuditFrame.actingUser("bob"), () -> recorder.recordCreated(new Note("n-b", "b")));
    contextHolder.runWith(
        aliceFrame,
        () -> {
          recorder.recordCreated(new Note("n-c", "c"));
          recorder.recordCreated(new Note("n-d", "d"));
        });

    beforeCommit();

    final EffectiveContext alice = new EffectiveContext("alice", null, null);
    final EffectiveContext bob = new EffectiveContext("bob", null, null);
    final InOrder inOrder = inOrder(writer);
    inOrder.verify(writer).commit(eq(List.of(change("n-a", null, "a"))), eq(alice), eq(NOW));
    inOrder.verify(writer).commit(eq(List.of(change("n-b", null, "b"))), eq(bob), eq(NOW));
    inOrder
        .verify(writer)
        .commit(
            eq(List.of(change("n-c", null, "c"), change("n-d", null, "d"))), eq(alice), eq(NOW));
    inOrder.verifyNoMoreInteractions();
  }

  @Test
  void explicitContextIsUsedInsteadOfThreadContext() {
    when(writer.commit(any(), any(), any())).thenReturn(1);
    final ChangeContext explicit = new ChangeContext();
    explicit.push(AuditFrame.actingUser("batch-job"));

    contextHolder.runWith(
        AuditFrame.actingUser("ignored"),
        () -> recorder.enlist(RecordSnapshot.deleted(new Note("n-3", "bye")), explicit));
    beforeCommit();

    verify(writer)
        .commit(
            eq(List.of(change("n-3", "bye", null))),
            eq(new EffectiveContext("batch-job", null, null)),
            eq(NOW));
  }

  @Test
  void sameInstanceEnlistedTwiceIsRecordedOnce() {
    when(writer.commit(any(), any(), any())).thenReturn(1);
    final RecordSnapshot snapshot = RecordSnapshot.created(new Note("n-4", "once"));

    recorder.enlist(snapshot);
    recorder.enlist(snapshot);
    beforeCommit();

    @SuppressWarnings("unchecked")
    final ArgumentCaptor<List<PendingChange>> captor = ArgumentCaptor.forClass(List.class);
    verify(writer, times(1)).commit(captor.capture(), any(), any());
    assertThat(captor.getValue()).hasSize(1);
  }

  @Test
  void unchangedInstancesDoNotReachTheWriter() {
    recorder.recordUpdated(new Note("n-5", "same"), new Note("n-5", "same"));

    beforeCommit();

    verifyNoInteractions(writer);
  }

  @Test
  void untrackedTypesAreIgnored() {
    recorder.recordCreated(new Scratch("s-1", "draft"));

    assertThat(TransactionSynchronizationManager.getSynchronizations()).isEmpty();
  }

  @Test
  void enlistingOutsideTransactionFails() {
    TransactionSynchronizationManager.clear();

    assertThatThrownBy(() -> recorder.recordCreated(new Note("n-6", "x")))
        .isInstanceOf(IllegalTransactionStateException.class);
  }

  @Test
  void readOnlyTransactionRejectsTrackedChanges() {
    TransactionSynchronizationManager.setCurrentTransactionReadOnly(true);

    assertThatThrownBy(() -> recorder.recordCreated(new Note("n-7", "x")))
        .isInstanceOf(IllegalStateException.class)
        .hasMessageContaining("read-only");
  }

  @Test
  void disabledRecorderIsNoOp() {
    TransactionSynchronizationManager.clear();
    final ChangeRecorder disabled = newRecorder(false, new TypeRegistry());

    disabled.recordCreated(new Note("n-8", "x"));

    verifyNoInteractions(writer);
  }

  @Test
  void writeFailurePropagatesAndIsCounted() {
    when(writer.commit(any(), any(), any())).thenThrow(new IllegalStateException("db down"));
    recorder.recordCreated(new Note("n-9", "x"));

    assertThatThrownBy(this::beforeCommit)
        .isInstanceOf(IllegalStateException.class)
        .hasMessage("db down");
    assertThat(meterRegistry.get("audit.commit.failures").counter().count()).isEqualTo(1.0d);
  }

  private ChangeRecorder newRecorder(boolean enabled, TypeRegistry typeRegistry) {
    return new ChangeRecorder(
        enabled,
        schemaRegistry,
        contextHolder,
        new SnapshotDirtyStateOracle(),
        new DiffEngine(typeRegistry),
        writer,
        new AuditMetrics(meterRegistry),
        Clock.fixed(NOW, ZoneOffset.UTC));
  }

  private PendingChange change(String id, String oldValue, String newValue) {
    return new PendingChange(
        schemaRegistry.require(Note.class), id, "body", oldValue, newValue, null);
  }

  private void beforeCommit() {
    for (TransactionSynchronization synchronization :
        TransactionSynchronizationManager.getSynchronizations()) {
      synchronization.beforeCommit(false);
    }
  }
}
