/*
 * どこで: 監査トランザクション連携
 * 何を: 変更されたインスタンスを現在のトランザクションへ登録する
 * なぜ: コミット時に監査対象の差分を漏れなく記録するため
 */
package com.example.audit.session;

import com.example.audit.config.AuditMetrics;
import com.example.audit.context.ChangeContext;
import com.example.audit.context.ChangeContextHolder;
import com.example.audit.diff.DiffEngine;
import com.example.audit.diff.DirtyStateOracle;
import com.example.audit.diff.RecordSnapshot;
import com.example.audit.diff.SnapshotDirtyStateOracle;
import com.example.audit.diff.TrackedInstance;
import com.example.audit.schema.TrackedSchema;
import com.example.audit.schema.TrackedSchemaRegistry;
import com.example.audit.writer.AuditWriter;
import java.time.Clock;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.transaction.IllegalTransactionStateException;
import org.springframework.transaction.support.TransactionSynchronization;
import org.springframework.transaction.support.TransactionSynchronizationManager;

/**
 * Entry point for hosts: enlist every instance touched in a transaction and the audit rows are
 * written just before that transaction commits.
 *
 * <p>The effective context is captured at enlist time, so a scope that closes before commit still
 * applies to the changes made inside it.
 */
public class ChangeRecorder {

  private static final Logger logger = LoggerFactory.getLogger(ChangeRecorder.class);

  private final boolean enabled;
  private final TrackedSchemaRegistry schemaRegistry;
  private final ChangeContextHolder contextHolder;
  private final DirtyStateOracle dirtyStateOracle;
  private final SnapshotDirtyStateOracle snapshotOracle = new SnapshotDirtyStateOracle();
  private final DiffEngine diffEngine;
  private final AuditWriter writer;
  private final AuditMetrics metrics;
  private final Clock clock;

  public ChangeRecorder(
      boolean enabled,
      TrackedSchemaRegistry schemaRegistry,
      ChangeContextHolder contextHolder,
      DirtyStateOracle dirtyStateOracle,
      DiffEngine diffEngine,
      AuditWriter writer,
      AuditMetrics metrics,
      Clock clock) {
    this.enabled = enabled;
    this.schemaRegistry = schemaRegistry;
    this.contextHolder = contextHolder;
    this.dirtyStateOracle = dirtyStateOracle;
    this.diffEngine = diffEngine;
    this.writer = writer;
    this.metrics = metrics;
    this.clock = clock;
  }

  /** Enlists an instance the configured {@link DirtyStateOracle} knows about. */
  public void enlist(Object instance) {
    enlist(instance, contextHolder.current(), dirtyStateOracle);
  }

  public void enlist(Object instance, ChangeContext context) {
    enlist(instance, context, dirtyStateOracle);
  }

  public void recordCreated(Object after) {
    enlist(RecordSnapshot.created(after), contextHolder.current(), snapshotOracle);
  }

  public void recordUpdated(Object before, Object after) {
    enlist(RecordSnapshot.updated(before, after), contextHolder.current(), snapshotOracle);
  }

  public void recordDeleted(Object before) {
    enlist(RecordSnapshot.deleted(before), contextHolder.current(), snapshotOracle);
  }

  private void enlist(Object instance, ChangeContext context, DirtyStateOracle oracle) {
    if (!enabled) {
      return;
    }
    if (!TransactionSynchronizationManager.isActualTransactionActive()
        || !TransactionSynchronizationManager.isSynchronizationActive()) {
      throw new IllegalTransactionStateException(
          "audit enlisting requires an active transaction");
    }
    final Class<?> recordType = oracle.recordType(instance);
    final Optional<TrackedSchema> schema = schemaRegistry.lookup(recordType);
    if (schema.isEmpty()) {
      logger.debug("untracked record type ignored type={}", recordType.getName());
      return;
    }
    if (TransactionSynchronizationManager.isCurrentTransactionReadOnly()) {
      throw new IllegalStateException(
          "tracked record " + recordType.getSimpleName() + " changed in a read-only transaction");
    }
    session().add(new TrackedInstance(instance, schema.get()), context.current(), oracle);
  }

  private AuditSession session() {
    for (TransactionSynchronization synchronization :
        TransactionSynchronizationManager.getSynchronizations()) {
      if (synchronization instanceof AuditTransactionSynchronization audit
          && audit.ownedBy(this)) {
        return audit.session();
      }
    }
    final AuditSession session = new AuditSession();
    TransactionSynchronizationManager.registerSynchronization(
        new AuditTransactionSynchronization(this, session, diffEngine, writer, metrics, clock));
    return session;
  }
}
