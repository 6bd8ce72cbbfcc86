/*
 * どこで: 監査履歴の照会
 * 何を: 条件に合う変更ログを読み出し、宣言型へ復元して返す
 * なぜ: 監査履歴を時系列で型付きのまま参照できるようにするため
 */
package com.example.audit.retrieval;

import com.example.audit.AuditException;
import com.example.audit.config.AuditMetrics;
import com.example.audit.model.StoredChange;
import com.example.audit.repository.AuditTableRepository;
import com.example.audit.repository.ChangeLogRepository;
import com.example.audit.schema.TrackedField;
import com.example.audit.schema.TrackedSchema;
import com.example.audit.schema.TrackedSchemaRegistry;
import com.example.audit.serializer.DeserializationException;
import com.example.audit.serializer.TypeRegistry;
import java.lang.reflect.Type;
import java.util.List;
import java.util.Optional;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.transaction.annotation.Transactional;

@RequiredArgsConstructor
public class ChangeRetriever {

  private static final Logger logger = LoggerFactory.getLogger(ChangeRetriever.class);

  private final TrackedSchemaRegistry schemaRegistry;
  private final TypeRegistry typeRegistry;
  private final AuditTableRepository tableRepository;
  private final ChangeLogRepository changeLogRepository;
  private final AuditMetrics metrics;

  /**
   * Returns the changes of {@code recordType} matching {@code query}, ordered by timestamp then
   * insertion order in the requested direction.
   *
   * @throws com.example.audit.schema.TableNotRegisteredException when the type is not tracked
   */
  @Transactional(readOnly = true)
  public List<ChangeRecord> query(Class<?> recordType, ChangeQuery query) {
    final TrackedSchema schema = schemaRegistry.require(recordType);
    final Optional<Long> tableId = tableRepository.findIdByName(schema.tableName());
    if (tableId.isEmpty()) {
      // 宣言済みだがまだ 1 件も書き込まれていない
      return List.of();
    }
    final List<StoredChange> rows =
        changeLogRepository.find(
            tableId.get(),
            query.resourceIds(),
            query.fieldNames(),
            query.userIds(),
            query.from(),
            query.to(),
            query.limit(),
            query.offset(),
            query.direction() == SortDirection.DESC);
    return rows.stream().map(row -> restore(schema, row)).toList();
  }

  private ChangeRecord restore(TrackedSchema schema, StoredChange row) {
    final Optional<TrackedField> field = schema.field(row.fieldName());
    if (field.isEmpty()) {
      return failed(
          schema,
          row,
          new DeserializationException(
              "field " + row.fieldName() + " is no longer tracked on " + schema.tableName()));
    }
    final Type type = field.get().genericType();
    try {
      return new ChangeRecord(
          schema.label(),
          row.fieldName(),
          row.resourceId(),
          typeRegistry.deserialize(row.oldValue(), type),
          typeRegistry.deserialize(row.newValue(), type),
          row.oldValue(),
          row.newValue(),
          row.changedAt(),
          row.changedBy(),
          row.reason(),
          row.impersonatedBy(),
          null);
    } catch (AuditException ex) {
      return failed(schema, row, ex);
    }
  }

  private ChangeRecord failed(TrackedSchema schema, StoredChange row, AuditException failure) {
    metrics.recordRestoreFailure();
    logger.warn(
        "audit entry could not be restored table={} field={} changeId={}",
        schema.tableName(),
        row.fieldName(),
        row.changeId(),
        failure);
    return new ChangeRecord(
        schema.label(),
        row.fieldName(),
        row.resourceId(),
        null,
        null,
        row.oldValue(),
        row.newValue(),
        row.changedAt(),
        row.changedBy(),
        row.reason(),
        row.impersonatedBy(),
        failure);
  }
}
