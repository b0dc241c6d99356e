package com.example.auth.repository;

import com.example.common.JdbcTimestampUtils;
import java.time.Instant;
import java.util.Optional;
import lombok.RequiredArgsConstructor;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.stereotype.Repository;

@Repository
@SuppressWarnings("EI_EXPOSE_REP2")
@RequiredArgsConstructor
public class PropertyRepository {

  private final NamedParameterJdbcTemplate jdbcTemplate;

  public Optional<String> findValue(String key) {
    final String sql =
        """
        SELECT value
        FROM properties
        WHERE key = :key
        """;
    return jdbcTemplate
        .query(
            sql,
            new MapSqlParameterSource().addValue("key", key),
            (rs, rowNum) -> rs.getString("value"))
        .stream()
        .findFirst();
  }

  public void upsert(String key, String value, Instant updatedAt) {
    final String sql =
        """
        INSERT INTO properties (key, value, updated_at)
        VALUES (:key, :value, :updatedAt)
        ON CONFLICT (key) DO UPDATE
        SET value = EXCLUDED.value,
            updated_at = EXCLUDED.updated_at
        """;
    final MapSqlParameterSource params =
        new MapSqlParameterSource()
            .addValue("key", key)
            .addValue("value", value)
            .addValue("updatedAt", JdbcTimestampUtils.toTimestamp(updatedAt));
    jdbcTemplate.update(sql, params);
  }
}
