/*
 * どこで: 監査書き込み
 * 何を: 差分を識別行へ正規化し、変更ログとして同一トランザクション内で追記する
 * なぜ: 業務データと監査行を必ず一緒にコミット/ロールバックさせるため
 */
package com.example.audit.writer;

import com.example.audit.config.AuditMetrics;
import com.example.audit.context.EffectiveContext;
import com.example.audit.diff.PendingChange;
import com.example.audit.model.ChangeLogEntry;
import com.example.audit.repository.AuditFieldRepository;
import com.example.audit.repository.AuditResourceRepository;
import com.example.audit.repository.AuditTableRepository;
import com.example.audit.repository.ChangeLogRepository;
import com.example.audit.schema.TrackedSchema;
import com.example.audit.writer.AuditIdentityCache.FieldKey;
import com.example.common.JdbcTimestampUtils;
import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;
import org.springframework.transaction.support.TransactionSynchronization;
import org.springframework.transaction.support.TransactionSynchronizationManager;

/**
 * Appends {@link PendingChange}s to the change log inside the caller's transaction.
 *
 * <p>Every row of one call shares a single timestamp. The acting user comes from the context and
 * falls back to the per-instance user id of the change.
 */
@RequiredArgsConstructor
public class AuditWriter {

  private static final Logger logger = LoggerFactory.getLogger(AuditWriter.class);

  private final AuditTableRepository tableRepository;
  private final AuditFieldRepository fieldRepository;
  private final AuditResourceRepository resourceRepository;
  private final ChangeLogRepository changeLogRepository;
  private final AuditIdentityCache identityCache;
  private final AuditMetrics metrics;
  private final Clock clock;

  @Transactional(propagation = Propagation.MANDATORY)
  public int commit(List<PendingChange> changes, EffectiveContext context) {
    return commit(changes, context, JdbcTimestampUtils.truncateToDbPrecision(clock.instant()));
  }

  @Transactional(propagation = Propagation.MANDATORY)
  public int commit(List<PendingChange> changes, EffectiveContext context, Instant batchTimestamp) {
    Objects.requireNonNull(context, "context");
    Objects.requireNonNull(batchTimestamp, "batchTimestamp");
    if (changes.isEmpty()) {
      return 0;
    }
    for (PendingChange change : changes) {
      if (change.isNoOp()) {
        throw new IllegalArgumentException(
            "change of "
                + change.schema().tableName()
                + "."
                + change.fieldName()
                + " has equal old and new values");
      }
    }

    final Instant changedAt = JdbcTimestampUtils.truncateToDbPrecision(batchTimestamp);
    final Batch batch = new Batch();
    final List<ChangeLogEntry> entries = new ArrayList<>(changes.size());
    final Map<String, Integer> perTable = new LinkedHashMap<>();
    for (PendingChange change : changes) {
      final TrackedSchema schema = change.schema();
      final long tableId = batch.tableId(schema);
      final long fieldId = batch.fieldId(tableId, change.fieldName());
      final long resourceRowId = batch.resourceRowId(tableId, change.resourceId());
      final String actor =
          context.actingUserId() != null ? context.actingUserId() : change.instanceUserId();
      entries.add(
          new ChangeLogEntry(
              fieldId,
              resourceRowId,
              change.oldValue(),
              change.newValue(),
              changedAt,
              actor,
              context.reason(),
              context.impersonatedBy()));
      perTable.merge(schema.tableName(), 1, Integer::sum);
    }

    final int inserted = changeLogRepository.insertAll(entries);
    batch.promoteAfterCommit();
    perTable.forEach(metrics::recordWritten);
    logger.debug(
        "audit rows written count={} tables={} changedAt={}", inserted, perTable.keySet(), changedAt);
    return inserted;
  }

  private record ResourceKey(long tableId, String resourceId) {}

  /** Identity ids resolved during one call; new ones reach the shared cache after commit. */
  private final class Batch {

    private final Map<String, Long> tables = new HashMap<>();
    private final Map<FieldKey, Long> fields = new HashMap<>();
    private final Map<ResourceKey, Long> resources = new HashMap<>();
    private final Map<String, Long> newTables = new HashMap<>();
    private final Map<FieldKey, Long> newFields = new HashMap<>();

    long tableId(TrackedSchema schema) {
      return tables.computeIfAbsent(
          schema.tableName(),
          name ->
              identityCache
                  .tableId(name)
                  .orElseGet(
                      () -> {
                        final long id = tableRepository.upsert(schema);
                        newTables.put(name, id);
                        return id;
                      }));
    }

    long fieldId(long tableId, String fieldName) {
      return fields.computeIfAbsent(
          new FieldKey(tableId, fieldName),
          key ->
              identityCache
                  .fieldId(tableId, fieldName)
                  .orElseGet(
                      () -> {
                        final long id = fieldRepository.upsert(tableId, fieldName);
                        newFields.put(key, id);
                        return id;
                      }));
    }

    long resourceRowId(long tableId, String resourceId) {
      return resources.computeIfAbsent(
          new ResourceKey(tableId, resourceId),
          key -> resourceRepository.upsert(tableId, resourceId));
    }

    void promoteAfterCommit() {
      if (newTables.isEmpty() && newFields.isEmpty()) {
        return;
      }
      final Map<String, Long> tablesToPromote = Map.copyOf(newTables);
      final Map<FieldKey, Long> fieldsToPromote = Map.copyOf(newFields);
      if (!TransactionSynchronizationManager.isSynchronizationActive()) {
        return;
      }
      TransactionSynchronizationManager.registerSynchronization(
          new TransactionSynchronization() {
            @Override
            public void afterCommit() {
              identityCache.promote(tablesToPromote, fieldsToPromote);
            }
          });
    }
  }
}
