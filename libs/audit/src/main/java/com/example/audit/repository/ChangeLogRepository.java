/*
 * どこで: 監査データアクセス
 * 何を: audit_change_log への追記と条件付き照会を行う
 * なぜ: 変更履歴を正規化された識別行と結合して読み書きするため
 */
package com.example.audit.repository;

import static com.example.common.JdbcTimestampUtils.toInstant;
import static com.example.common.JdbcTimestampUtils.toTimestamp;

import com.example.audit.model.ChangeLogEntry;
import com.example.audit.model.StoredChange;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.time.Instant;
import java.util.Collection;
import java.util.List;
import lombok.RequiredArgsConstructor;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.jdbc.core.namedparam.SqlParameterSource;
import org.springframework.stereotype.Repository;

@Repository
@RequiredArgsConstructor
public class ChangeLogRepository {

  private final NamedParameterJdbcTemplate jdbcTemplate;

  public int insertAll(List<ChangeLogEntry> entries) {
    if (entries.isEmpty()) {
      return 0;
    }
    final String sql =
        """
        INSERT INTO audit_change_log (
          field_id,
          resource_row_id,
          old_value,
          new_value,
          changed_at,
          changed_by,
          reason,
          impersonated_by
        ) VALUES (
          :fieldId,
          :resourceRowId,
          :oldValue,
          :newValue,
          :changedAt,
          :changedBy,
          :reason,
          :impersonatedBy
        )
        """;
    final SqlParameterSource[] batch =
        entries.stream().map(ChangeLogRepository::toParams).toArray(SqlParameterSource[]::new);
    int inserted = 0;
    for (int count : jdbcTemplate.batchUpdate(sql, batch)) {
      // ドライバが件数を返さない場合(SUCCESS_NO_INFO)は 1 件として数える
      inserted += count < 0 ? 1 : count;
    }
    return inserted;
  }

  /**
   * Returns the log rows of one table matching every given filter. {@code null} or empty filters
   * are not applied; {@code from} and {@code to} are inclusive.
   */
  public List<StoredChange> find(
      long tableId,
      Collection<String> resourceIds,
      Collection<String> fieldNames,
      Collection<String> userIds,
      Instant from,
      Instant to,
      Integer limit,
      Integer offset,
      boolean descending) {
    final StringBuilder sql =
        new StringBuilder(
            """
            SELECT
              l.change_id,
              f.field_name,
              r.resource_id,
              l.old_value,
              l.new_value,
              l.changed_at,
              l.changed_by,
              l.reason,
              l.impersonated_by
            FROM audit_change_log l
            JOIN audit_fields f ON f.field_id = l.field_id
            JOIN audit_resources r ON r.resource_row_id = l.resource_row_id
            WHERE r.table_id = :tableId
            """);
    final MapSqlParameterSource params = new MapSqlParameterSource().addValue("tableId", tableId);
    if (resourceIds != null && !resourceIds.isEmpty()) {
      sql.append("  AND r.resource_id IN (:resourceIds)\n");
      params.addValue("resourceIds", resourceIds);
    }
    if (fieldNames != null && !fieldNames.isEmpty()) {
      sql.append("  AND f.field_name IN (:fieldNames)\n");
      params.addValue("fieldNames", fieldNames);
    }
    if (userIds != null && !userIds.isEmpty()) {
      sql.append("  AND l.changed_by IN (:userIds)\n");
      params.addValue("userIds", userIds);
    }
    if (from != null) {
      sql.append("  AND l.changed_at >= :from\n");
      params.addValue("from", toTimestamp(from));
    }
    if (to != null) {
      sql.append("  AND l.changed_at <= :to\n");
      params.addValue("to", toTimestamp(to));
    }
    final String direction = descending ? "DESC" : "ASC";
    sql.append("ORDER BY l.changed_at ")
        .append(direction)
        .append(", l.change_id ")
        .append(direction)
        .append('\n');
    if (limit != null) {
      sql.append("LIMIT :limit\n");
      params.addValue("limit", limit);
    }
    if (offset != null) {
      sql.append("OFFSET :offset\n");
      params.addValue("offset", offset);
    }
    return jdbcTemplate.query(sql.toString(), params, this::mapRow);
  }

  public int countAll() {
    final Integer count =
        jdbcTemplate.queryForObject(
            "SELECT COUNT(*) FROM audit_change_log", new MapSqlParameterSource(), Integer.class);
    return count == null ? 0 : count;
  }

  private static MapSqlParameterSource toParams(ChangeLogEntry entry) {
    return new MapSqlParameterSource()
        .addValue("fieldId", entry.fieldId())
        .addValue("resourceRowId", entry.resourceRowId())
        .addValue("oldValue", entry.oldValue())
        .addValue("newValue", entry.newValue())
        .addValue("changedAt", toTimestamp(entry.changedAt()))
        .addValue("changedBy", entry.changedBy())
        .addValue("reason", entry.reason())
        .addValue("impersonatedBy", entry.impersonatedBy());
  }

  private StoredChange mapRow(ResultSet rs, int rowNum) throws SQLException {
    return new StoredChange(
        rs.getLong("change_id"),
        rs.getString("field_name"),
        rs.getString("resource_id"),
        rs.getString("old_value"),
        rs.getString("new_value"),
        toInstant(rs.getTimestamp("changed_at")),
        rs.getString("changed_by"),
        rs.getString("reason"),
        rs.getString("impersonated_by"));
  }
}
