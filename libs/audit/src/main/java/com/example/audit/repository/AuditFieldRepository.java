/*
 * どこで: 監査データアクセス
 * 何を: audit_fields の識別行を登録する
 * なぜ: フィールド名を変更ログごとに重複保存しないため
 */
package com.example.audit.repository;

import lombok.RequiredArgsConstructor;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.stereotype.Repository;

@Repository
@RequiredArgsConstructor
public class AuditFieldRepository {

  private final NamedParameterJdbcTemplate jdbcTemplate;

  public long upsert(long tableId, String fieldName) {
    // DO NOTHING では既存行の ID が返らないため、同値で更新して RETURNING を効かせる
    final String sql =
        """
        INSERT INTO audit_fields (
          table_id,
          field_name
        ) VALUES (
          :tableId,
          :fieldName
        )
        ON CONFLICT (table_id, field_name)
        DO UPDATE SET
          field_name = EXCLUDED.field_name
        RETURNING field_id;
        """;
    final MapSqlParameterSource params =
        new MapSqlParameterSource()
            .addValue("tableId", tableId)
            .addValue("fieldName", fieldName);
    return jdbcTemplate.queryForObject(sql, params, Long.class);
  }

  public int countByTableId(long tableId) {
    final String sql =
        """
        SELECT COUNT(*)
        FROM audit_fields
        WHERE table_id = :tableId
        """;
    final Integer count =
        jdbcTemplate.queryForObject(
            sql, new MapSqlParameterSource().addValue("tableId", tableId), Integer.class);
    return count == null ? 0 : count;
  }
}
