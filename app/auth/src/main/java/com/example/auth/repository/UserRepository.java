package com.example.auth.repository;

import com.example.auth.model.AuthProvider;
import com.example.auth.model.ProviderIdentity;
import com.example.auth.model.UserFilter;
import com.example.auth.model.UserRecord;
import com.example.auth.service.UserDirectory;
import com.example.common.JdbcTimestampUtils;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.UUID;
import lombok.NonNull;
import lombok.RequiredArgsConstructor;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.stereotype.Repository;

@Repository
@SuppressWarnings("EI_EXPOSE_REP2")
@RequiredArgsConstructor
public class UserRepository implements UserDirectory {

  private final NamedParameterJdbcTemplate jdbcTemplate;
  private final Clock clock;

  @Override
  public List<UserRecord> find(@NonNull UserFilter filter) {
    if (filter.addressesAccessTokenHash()) {
      final String sql =
          """
          SELECT id, provider, third_party_id, access_token_hash, created_at, updated_at
          FROM users
          WHERE access_token_hash = :accessTokenHash
          """;
      return jdbcTemplate.query(
          sql,
          new MapSqlParameterSource().addValue("accessTokenHash", filter.accessTokenHash()),
          this::mapRow);
    }
    final String sql =
        """
        SELECT id, provider, third_party_id, access_token_hash, created_at, updated_at
        FROM users
        WHERE provider = :provider AND third_party_id = :thirdPartyId
        """;
    final MapSqlParameterSource params =
        new MapSqlParameterSource()
            .addValue("provider", filter.provider().name())
            .addValue("thirdPartyId", filter.thirdPartyId());
    return jdbcTemplate.query(sql, params, this::mapRow);
  }

  @Override
  public UserRecord create(@NonNull ProviderIdentity identity) {
    final String sql =
        """
        INSERT INTO users (id, provider, third_party_id, created_at, updated_at)
        VALUES (:id, :provider, :thirdPartyId, :createdAt, :updatedAt)
        RETURNING id, provider, third_party_id, access_token_hash, created_at, updated_at
        """;
    final Instant now = Instant.now(clock);
    final MapSqlParameterSource params =
        new MapSqlParameterSource()
            .addValue("id", UUID.randomUUID().toString())
            .addValue("provider", identity.provider().name())
            .addValue("thirdPartyId", identity.thirdPartyId())
            .addValue("createdAt", JdbcTimestampUtils.toTimestamp(now))
            .addValue("updatedAt", JdbcTimestampUtils.toTimestamp(now));
    return jdbcTemplate.queryForObject(sql, params, this::mapRow);
  }

  private UserRecord mapRow(ResultSet rs, int rowNum) throws SQLException {
    return new UserRecord(
        rs.getString("id"),
        toProvider(rs.getString("provider")),
        rs.getString("third_party_id"),
        rs.getString("access_token_hash"),
        JdbcTimestampUtils.getInstant(rs, "created_at"),
        JdbcTimestampUtils.getInstant(rs, "updated_at"));
  }

  private AuthProvider toProvider(String stored) {
    try {
      return AuthProvider.valueOf(stored);
    } catch (IllegalArgumentException e) {
      throw new IllegalStateException("users.provider has unknown value: " + stored, e);
    }
  }
}
