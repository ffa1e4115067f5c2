/*
 * どこで: Commitment データアクセス
 * 何を: emergency_cancellation_requests の登録/参照を行う
 * なぜ: 早期解除の要請をコミットメントを変えずに記録するため
 */
package com.example.commitment.repository;

import static com.example.common.JdbcTimestampUtils.getInstant;
import static com.example.common.JdbcTimestampUtils.toTimestamp;

import com.example.commitment.model.EmergencyCancellationRecord;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.util.List;
import java.util.UUID;
import lombok.RequiredArgsConstructor;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.stereotype.Repository;

@Repository
@RequiredArgsConstructor
public class EmergencyCancellationRepository {

  private final NamedParameterJdbcTemplate jdbcTemplate;

  public int insert(EmergencyCancellationRecord record) {
    final String sql =
        """
        INSERT INTO emergency_cancellation_requests (
          request_id,
          commitment_id,
          user_id,
          reason,
          client_ip,
          user_agent,
          ticket_id,
          created_at
        ) VALUES (
          :requestId,
          :commitmentId,
          :userId,
          :reason,
          :clientIp,
          :userAgent,
          :ticketId,
          :createdAt
        )
        """;
    final MapSqlParameterSource params =
        new MapSqlParameterSource()
            .addValue("requestId", record.requestId())
            .addValue("commitmentId", record.commitmentId())
            .addValue("userId", record.userId())
            .addValue("reason", record.reason())
            .addValue("clientIp", record.clientIp())
            .addValue("userAgent", record.userAgent())
            .addValue("ticketId", record.ticketId())
            .addValue("createdAt", toTimestamp(record.createdAt()));
    return jdbcTemplate.update(sql, params);
  }

  public List<EmergencyCancellationRecord> findByCommitmentId(UUID commitmentId) {
    final String sql =
        """
        SELECT request_id, commitment_id, user_id, reason, client_ip, user_agent, ticket_id,
               created_at
        FROM emergency_cancellation_requests
        WHERE commitment_id = :commitmentId
        ORDER BY created_at DESC
        """;
    return jdbcTemplate.query(
        sql, new MapSqlParameterSource().addValue("commitmentId", commitmentId), this::mapRow);
  }

  private EmergencyCancellationRecord mapRow(ResultSet rs, int rowNum) throws SQLException {
    return new EmergencyCancellationRecord(
        UUID.fromString(rs.getString("request_id")),
        UUID.fromString(rs.getString("commitment_id")),
        rs.getString("user_id"),
        rs.getString("reason"),
        rs.getString("client_ip"),
        rs.getString("user_agent"),
        rs.getString("ticket_id"),
        getInstant(rs, "created_at"));
  }
}
