/*
 * どこで: Commitment データアクセス
 * 何を: timer_commitments の登録/状態遷移/スイープ対象の抽出を行う
 * なぜ: 端末ごとの一意性と単調な状態遷移を DB 側の条件付き更新で保証するため
 */
package com.example.commitment.repository;

import static com.example.common.JdbcTimestampUtils.getInstant;
import static com.example.common.JdbcTimestampUtils.toTimestamp;

import com.example.commitment.model.CommitmentRecord;
import com.example.commitment.model.CommitmentStatus;
import com.example.commitment.model.CommitmentStatusCount;
import com.example.commitment.model.LockedSettings;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import lombok.RequiredArgsConstructor;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.stereotype.Repository;

@Repository
@RequiredArgsConstructor
public class CommitmentRepository {

  private static final String SELECT_COLUMNS =
      """
      commitment_id,
      user_id,
      device_id,
      device_name,
      provider_device_id,
      subscription_tier,
      duration_days,
      commitment_start,
      commitment_end,
      status,
      enforcement_ref,
      warning_sent,
      locked_settings::text AS locked_settings_text,
      created_at,
      updated_at
      """;

  private final NamedParameterJdbcTemplate jdbcTemplate;
  private final ObjectMapper objectMapper;

  public Optional<CommitmentRecord> insertPending(CommitmentRecord record) {
    // 部分ユニーク索引 (device_id WHERE PENDING/ACTIVE) に衝突した場合は空結果を返す
    final String sql =
        """
        INSERT INTO timer_commitments (
          commitment_id,
          user_id,
          device_id,
          device_name,
          provider_device_id,
          subscription_tier,
          duration_days,
          commitment_start,
          commitment_end,
          status,
          enforcement_ref,
          warning_sent,
          locked_settings,
          created_at,
          updated_at
        ) VALUES (
          :commitmentId,
          :userId,
          :deviceId,
          :deviceName,
          :providerDeviceId,
          :subscriptionTier,
          :durationDays,
          :commitmentStart,
          :commitmentEnd,
          'PENDING',
          NULL,
          FALSE,
          CAST(:lockedSettings AS jsonb),
          :createdAt,
          :updatedAt
        )
        ON CONFLICT DO NOTHING
        RETURNING
        """
            + SELECT_COLUMNS;
    final MapSqlParameterSource params =
        new MapSqlParameterSource()
            .addValue("commitmentId", record.commitmentId())
            .addValue("userId", record.userId())
            .addValue("deviceId", record.deviceId())
            .addValue("deviceName", record.deviceName())
            .addValue("providerDeviceId", record.providerDeviceId())
            .addValue("subscriptionTier", record.subscriptionTier())
            .addValue("durationDays", record.durationDays())
            .addValue("commitmentStart", toTimestamp(record.commitmentStart()))
            .addValue("commitmentEnd", toTimestamp(record.commitmentEnd()))
            .addValue("lockedSettings", writeLockedSettings(record.lockedSettings()))
            .addValue("createdAt", toTimestamp(record.createdAt()))
            .addValue("updatedAt", toTimestamp(record.updatedAt()));
    return jdbcTemplate.query(sql, params, this::mapRow).stream().findFirst();
  }

  public Optional<CommitmentRecord> activate(
      UUID commitmentId, String enforcementReference, Instant updatedAt) {
    // PENDING のときだけ ACTIVE へ進め、参照の欠けた ACTIVE を作らない
    final String sql =
        """
        UPDATE timer_commitments
        SET status = 'ACTIVE',
            enforcement_ref = :enforcementRef,
            updated_at = :updatedAt
        WHERE commitment_id = :commitmentId
          AND status = 'PENDING'
        RETURNING
        """
            + SELECT_COLUMNS;
    final MapSqlParameterSource params =
        new MapSqlParameterSource()
            .addValue("enforcementRef", enforcementReference)
            .addValue("updatedAt", toTimestamp(updatedAt))
            .addValue("commitmentId", commitmentId);
    return jdbcTemplate.query(sql, params, this::mapRow).stream().findFirst();
  }

  public int deletePending(UUID commitmentId) {
    final String sql =
        """
        DELETE FROM timer_commitments
        WHERE commitment_id = :commitmentId
          AND status = 'PENDING'
        """;
    return jdbcTemplate.update(
        sql, new MapSqlParameterSource().addValue("commitmentId", commitmentId));
  }

  public Optional<CommitmentRecord> findById(UUID commitmentId) {
    final String sql =
        "SELECT " + SELECT_COLUMNS + " FROM timer_commitments WHERE commitment_id = :commitmentId";
    final MapSqlParameterSource params =
        new MapSqlParameterSource().addValue("commitmentId", commitmentId);
    return jdbcTemplate.query(sql, params, this::mapRow).stream().findFirst();
  }

  public Optional<CommitmentRecord> findActiveByDevice(String userId, String deviceId) {
    final String sql =
        "SELECT "
            + SELECT_COLUMNS
            + """
            FROM timer_commitments
            WHERE user_id = :userId
              AND device_id = :deviceId
              AND status = 'ACTIVE'
            """;
    final MapSqlParameterSource params =
        new MapSqlParameterSource().addValue("userId", userId).addValue("deviceId", deviceId);
    return jdbcTemplate.query(sql, params, this::mapRow).stream().findFirst();
  }

  public boolean existsOpenForDevice(String deviceId) {
    final String sql =
        """
        SELECT EXISTS (
          SELECT 1
          FROM timer_commitments
          WHERE device_id = :deviceId
            AND status IN ('PENDING', 'ACTIVE')
        )
        """;
    final Boolean exists =
        jdbcTemplate.queryForObject(
            sql, new MapSqlParameterSource().addValue("deviceId", deviceId), Boolean.class);
    return Boolean.TRUE.equals(exists);
  }

  public List<CommitmentRecord> findDueForExpiry(Instant now) {
    final String sql =
        "SELECT "
            + SELECT_COLUMNS
            + """
            FROM timer_commitments
            WHERE status = 'ACTIVE'
              AND commitment_end <= :now
            ORDER BY commitment_end
            """;
    return jdbcTemplate.query(
        sql, new MapSqlParameterSource().addValue("now", toTimestamp(now)), this::mapRow);
  }

  public List<CommitmentRecord> findDueForWarning(Instant now, Instant windowEnd) {
    // 両端を含む (BETWEEN)。期限到達済みの行は同じスイープの Phase A で処理済み
    final String sql =
        "SELECT "
            + SELECT_COLUMNS
            + """
            FROM timer_commitments
            WHERE status = 'ACTIVE'
              AND commitment_end BETWEEN :now AND :windowEnd
              AND warning_sent = FALSE
            ORDER BY commitment_end
            """;
    final MapSqlParameterSource params =
        new MapSqlParameterSource()
            .addValue("now", toTimestamp(now))
            .addValue("windowEnd", toTimestamp(windowEnd));
    return jdbcTemplate.query(sql, params, this::mapRow);
  }

  public int updateStatus(
      UUID commitmentId, CommitmentStatus expected, CommitmentStatus next, Instant updatedAt) {
    if (expected.isTerminal()) {
      throw new IllegalArgumentException("terminal status cannot transition: " + expected);
    }
    final String sql =
        """
        UPDATE timer_commitments
        SET status = :next,
            updated_at = :updatedAt
        WHERE commitment_id = :commitmentId
          AND status = :expected
        """;
    final MapSqlParameterSource params =
        new MapSqlParameterSource()
            // enum -> DB文字列を固定し、層内で不正値を防ぐ
            .addValue("next", next.name())
            .addValue("expected", expected.name())
            .addValue("updatedAt", toTimestamp(updatedAt))
            .addValue("commitmentId", commitmentId);
    return jdbcTemplate.update(sql, params);
  }

  public int markWarningSent(UUID commitmentId, Instant updatedAt) {
    final String sql =
        """
        UPDATE timer_commitments
        SET warning_sent = TRUE,
            updated_at = :updatedAt
        WHERE commitment_id = :commitmentId
          AND status = 'ACTIVE'
          AND warning_sent = FALSE
        """;
    final MapSqlParameterSource params =
        new MapSqlParameterSource()
            .addValue("updatedAt", toTimestamp(updatedAt))
            .addValue("commitmentId", commitmentId);
    return jdbcTemplate.update(sql, params);
  }

  public List<UUID> failStalePending(Instant createdBefore, Instant updatedAt) {
    final String sql =
        """
        UPDATE timer_commitments
        SET status = 'FAILED',
            updated_at = :updatedAt
        WHERE status = 'PENDING'
          AND created_at < :createdBefore
        RETURNING commitment_id
        """;
    final MapSqlParameterSource params =
        new MapSqlParameterSource()
            .addValue("updatedAt", toTimestamp(updatedAt))
            .addValue("createdBefore", toTimestamp(createdBefore));
    return jdbcTemplate.query(
        sql, params, (rs, rowNum) -> UUID.fromString(rs.getString("commitment_id")));
  }

  public List<CommitmentRecord> findHistoryByUser(String userId, int limit, int offset) {
    final String sql =
        "SELECT "
            + SELECT_COLUMNS
            + """
            FROM timer_commitments
            WHERE user_id = :userId
              AND status <> 'PENDING'
            ORDER BY created_at DESC
            LIMIT :limit OFFSET :offset
            """;
    final MapSqlParameterSource params =
        new MapSqlParameterSource()
            .addValue("userId", userId)
            .addValue("limit", limit)
            .addValue("offset", offset);
    return jdbcTemplate.query(sql, params, this::mapRow);
  }

  public long countHistoryByUser(String userId) {
    final String sql =
        """
        SELECT COUNT(*)
        FROM timer_commitments
        WHERE user_id = :userId
          AND status <> 'PENDING'
        """;
    final Long count =
        jdbcTemplate.queryForObject(
            sql, new MapSqlParameterSource().addValue("userId", userId), Long.class);
    return count == null ? 0L : count;
  }

  public List<CommitmentStatusCount> countByStatus() {
    final String sql =
        """
        SELECT status, COUNT(*) AS count, AVG(duration_days) AS avg_days
        FROM timer_commitments
        GROUP BY status
        ORDER BY status
        """;
    return jdbcTemplate.query(
        sql,
        new MapSqlParameterSource(),
        (rs, rowNum) ->
            new CommitmentStatusCount(
                CommitmentStatus.fromDatabase(rs.getString("status")),
                rs.getLong("count"),
                rs.getDouble("avg_days")));
  }

  private String writeLockedSettings(LockedSettings lockedSettings) {
    try {
      return objectMapper.writeValueAsString(
          lockedSettings == null ? LockedSettings.allLocked() : lockedSettings);
    } catch (JsonProcessingException ex) {
      throw new IllegalStateException("failed to serialize locked settings", ex);
    }
  }

  private LockedSettings readLockedSettings(String json) {
    try {
      return objectMapper.readValue(json, LockedSettings.class);
    } catch (JsonProcessingException ex) {
      throw new IllegalStateException("failed to parse locked settings", ex);
    }
  }

  private CommitmentRecord mapRow(ResultSet rs, int rowNum) throws SQLException {
    return new CommitmentRecord(
        UUID.fromString(rs.getString("commitment_id")),
        rs.getString("user_id"),
        rs.getString("device_id"),
        rs.getString("device_name"),
        rs.getString("provider_device_id"),
        rs.getString("subscription_tier"),
        rs.getInt("duration_days"),
        getInstant(rs, "commitment_start"),
        getInstant(rs, "commitment_end"),
        CommitmentStatus.fromDatabase(rs.getString("status")),
        rs.getString("enforcement_ref"),
        rs.getBoolean("warning_sent"),
        readLockedSettings(rs.getString("locked_settings_text")),
        getInstant(rs, "created_at"),
        getInstant(rs, "updated_at"));
  }
}
