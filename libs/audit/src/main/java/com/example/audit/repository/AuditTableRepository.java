/*
 * どこで: 監査データアクセス
 * 何を: audit_tables の識別行を登録/参照する
 * なぜ: 変更ログからテーブル名を正規化して参照するため
 */
package com.example.audit.repository;

import com.example.audit.schema.TrackedSchema;
import java.util.Optional;
import lombok.RequiredArgsConstructor;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.stereotype.Repository;

@Repository
@RequiredArgsConstructor
public class AuditTableRepository {

  private final NamedParameterJdbcTemplate jdbcTemplate;

  /** Inserts the table row or refreshes its metadata; returns the id either way. */
  public long upsert(TrackedSchema schema) {
    // 同時に初回書き込みが走っても一意制約で 1 行に収束させる
    final String sql =
        """
        INSERT INTO audit_tables (
          table_name,
          resource_id_field,
          label
        ) VALUES (
          :tableName,
          :resourceIdField,
          :label
        )
        ON CONFLICT (table_name)
        DO UPDATE SET
          resource_id_field = EXCLUDED.resource_id_field,
          label = EXCLUDED.label
        RETURNING table_id;
        """;
    final MapSqlParameterSource params =
        new MapSqlParameterSource()
            .addValue("tableName", schema.tableName())
            .addValue("resourceIdField", schema.resourceIdField())
            .addValue("label", schema.label());
    return jdbcTemplate.queryForObject(sql, params, Long.class);
  }

  public Optional<Long> findIdByName(String tableName) {
    final String sql =
        """
        SELECT table_id
        FROM audit_tables
        WHERE table_name = :tableName
        """;
    final MapSqlParameterSource params =
        new MapSqlParameterSource().addValue("tableName", tableName);
    return jdbcTemplate.queryForList(sql, params, Long.class).stream().findFirst();
  }

  public int countAll() {
    final Integer count =
        jdbcTemplate.queryForObject(
            "SELECT COUNT(*) FROM audit_tables", new MapSqlParameterSource(), Integer.class);
    return count == null ? 0 : count;
  }
}
