package com.example.commitment.repository;

import static com.example.common.JdbcTimestampUtils.getInstant;
import static com.example.common.JdbcTimestampUtils.toTimestamp;

import com.example.commitment.model.CommitmentAuditRecord;
import java.util.List;
import java.util.UUID;
import lombok.RequiredArgsConstructor;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.stereotype.Repository;

@Repository
@RequiredArgsConstructor
public class CommitmentAuditRepository {

  private final NamedParameterJdbcTemplate jdbcTemplate;

  public void insert(CommitmentAuditRecord record) {
    final String sql =
        """
        INSERT INTO commitment_audit (
          audit_id, commitment_id, actor_user_id, action, reason, detail, created_at)
        VALUES (
          :auditId, :commitmentId, :actorUserId, :action, :reason, CAST(:detail AS jsonb),
          :createdAt)
        """;
    final MapSqlParameterSource params =
        new MapSqlParameterSource()
            .addValue("auditId", record.auditId())
            .addValue("commitmentId", record.commitmentId())
            .addValue("actorUserId", record.actorUserId())
            .addValue("action", record.action())
            .addValue("reason", record.reason())
            .addValue("detail", record.detailJson())
            .addValue("createdAt", toTimestamp(record.createdAt()));
    jdbcTemplate.update(sql, params);
  }

  public List<CommitmentAuditRecord> findByCommitmentId(UUID commitmentId) {
    final String sql =
        """
        SELECT audit_id, commitment_id, actor_user_id, action, reason, detail::text AS detail_text,
               created_at
        FROM commitment_audit
        WHERE commitment_id = :commitmentId
        ORDER BY created_at
        """;
    return jdbcTemplate.query(
        sql,
        new MapSqlParameterSource().addValue("commitmentId", commitmentId),
        (rs, rowNum) ->
            new CommitmentAuditRecord(
                UUID.fromString(rs.getString("audit_id")),
                UUID.fromString(rs.getString("commitment_id")),
                rs.getString("actor_user_id"),
                rs.getString("action"),
                rs.getString("reason"),
                rs.getString("detail_text"),
                getInstant(rs, "created_at")));
  }
}
