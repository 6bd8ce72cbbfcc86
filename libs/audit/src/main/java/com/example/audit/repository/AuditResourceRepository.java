/*
 * どこで: 監査データアクセス
 * 何を: audit_resources の識別行を登録する
 * なぜ: リソース ID(業務キー)を変更ログごとに重複保存しないため
 */
package com.example.audit.repository;

import lombok.RequiredArgsConstructor;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.stereotype.Repository;

@Repository
@RequiredArgsConstructor
public class AuditResourceRepository {

  private final NamedParameterJdbcTemplate jdbcTemplate;

  public long upsert(long tableId, String resourceId) {
    final String sql =
        """
        INSERT INTO audit_resources (
          table_id,
          resource_id
        ) VALUES (
          :tableId,
          :resourceId
        )
        ON CONFLICT (table_id, resource_id)
        DO UPDATE SET
          resource_id = EXCLUDED.resource_id
        RETURNING resource_row_id;
        """;
    final MapSqlParameterSource params =
        new MapSqlParameterSource()
            .addValue("tableId", tableId)
            .addValue("resourceId", resourceId);
    return jdbcTemplate.queryForObject(sql, params, Long.class);
  }

  public int countByTableId(long tableId) {
    final String sql =
        """
        SELECT COUNT(*)
        FROM audit_resources
        WHERE table_id = :tableId
        """;
    final Integer count =
        jdbcTemplate.queryForObject(
            sql, new MapSqlParameterSource().addValue("tableId", tableId), Integer.class);
    return count == null ? 0 : count;
  }
}
