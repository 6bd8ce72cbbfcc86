/*
 * どこで: Customer データアクセス
 * 何を: customers テーブルの登録/取得/更新/削除を行う
 * なぜ: 監査対象レコードの永続化を 1 か所に閉じ込めるため
 */
package com.example.customer.repository;

import static com.example.common.JdbcTimestampUtils.toTimestamp;

import com.example.customer.model.CustomerRecord;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import lombok.RequiredArgsConstructor;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.stereotype.Repository;

@Repository
@RequiredArgsConstructor
public class CustomerRepository {

  private static final TypeReference<List<String>> TAGS_TYPE = new TypeReference<>() {};

  private final NamedParameterJdbcTemplate jdbcTemplate;
  private final ObjectMapper objectMapper;

  public CustomerRecord insert(
      String name, String email, String userId, List<String> tags, Instant createdAt) {
    final String sql =
        """
        INSERT INTO customers (
          name,
          email,
          user_id,
          tags,
          created_at,
          updated_at
        ) VALUES (
          :name,
          :email,
          :userId,
          :tags::jsonb,
          :createdAt,
          :createdAt
        )
        RETURNING customer_id, name, email, user_id, tags, updated_at
        """;
    final MapSqlParameterSource params =
        new MapSqlParameterSource()
            .addValue("name", name)
            .addValue("email", email)
            .addValue("userId", userId)
            .addValue("tags", writeTags(tags))
            .addValue("createdAt", toTimestamp(createdAt));
    return jdbcTemplate.queryForObject(sql, params, this::mapRow);
  }

  public Optional<CustomerRecord> findById(long customerId) {
    final String sql =
        """
        SELECT customer_id, name, email, user_id, tags, updated_at
        FROM customers
        WHERE customer_id = :customerId
        """;
    final MapSqlParameterSource params =
        new MapSqlParameterSource().addValue("customerId", customerId);
    return jdbcTemplate.query(sql, params, this::mapRow).stream().findFirst();
  }

  // 同一顧客への同時更新で変更前の値がずれないよう、行ロックを取って読む
  public Optional<CustomerRecord> findByIdForUpdate(long customerId) {
    final String sql =
        """
        SELECT customer_id, name, email, user_id, tags, updated_at
        FROM customers
        WHERE customer_id = :customerId
        FOR UPDATE
        """;
    final MapSqlParameterSource params =
        new MapSqlParameterSource().addValue("customerId", customerId);
    return jdbcTemplate.query(sql, params, this::mapRow).stream().findFirst();
  }

  public int update(CustomerRecord record) {
    final String sql =
        """
        UPDATE customers
        SET name = :name,
            email = :email,
            tags = :tags::jsonb,
            updated_at = :updatedAt
        WHERE customer_id = :customerId
        """;
    final MapSqlParameterSource params =
        new MapSqlParameterSource()
            .addValue("customerId", record.customerId())
            .addValue("name", record.name())
            .addValue("email", record.email())
            .addValue("tags", writeTags(record.tags()))
            .addValue("updatedAt", toTimestamp(record.updatedAt()));
    return jdbcTemplate.update(sql, params);
  }

  public int delete(long customerId) {
    final String sql = "DELETE FROM customers WHERE customer_id = :customerId";
    final MapSqlParameterSource params =
        new MapSqlParameterSource().addValue("customerId", customerId);
    return jdbcTemplate.update(sql, params);
  }

  private String writeTags(List<String> tags) {
    try {
      return objectMapper.writeValueAsString(tags == null ? List.of() : tags);
    } catch (JsonProcessingException ex) {
      throw new IllegalStateException("failed to serialize customer tags", ex);
    }
  }

  private List<String> readTags(String json) {
    try {
      return objectMapper.readValue(json, TAGS_TYPE);
    } catch (JsonProcessingException ex) {
      throw new IllegalStateException("failed to parse customer tags", ex);
    }
  }

  private CustomerRecord mapRow(ResultSet rs, int rowNum) throws SQLException {
    return new CustomerRecord(
        rs.getLong("customer_id"),
        rs.getString("name"),
        rs.getString("email"),
        rs.getString("user_id"),
        readTags(rs.getString("tags")),
        rs.getTimestamp("updated_at").toInstant());
  }
}
