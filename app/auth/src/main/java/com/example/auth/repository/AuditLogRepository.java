package com.example.auth.repository;

import com.example.auth.model.AuditLogRecord;
import com.example.common.JdbcTimestampUtils;
import lombok.RequiredArgsConstructor;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.stereotype.Repository;

@Repository
@SuppressWarnings("EI_EXPOSE_REP2")
@RequiredArgsConstructor
public class AuditLogRepository {

  private final NamedParameterJdbcTemplate jdbcTemplate;

  public void insert(AuditLogRecord auditLogRecord) {
    final String sql =
        """
        INSERT INTO audit_logs (id, actor_user_id, action, target, metadata_json, created_at)
        VALUES (:id, :actorUserId, :action, :target, CAST(:metadataJson AS jsonb), :createdAt)
        """;
    final MapSqlParameterSource params =
        new MapSqlParameterSource()
            .addValue("id", auditLogRecord.id())
            .addValue("actorUserId", auditLogRecord.actorUserId())
            .addValue("action", auditLogRecord.action())
            .addValue("target", auditLogRecord.target())
            .addValue("metadataJson", auditLogRecord.metadataJson())
            .addValue("createdAt", JdbcTimestampUtils.toTimestamp(auditLogRecord.createdAt()));
    jdbcTemplate.update(sql, params);
  }
}
