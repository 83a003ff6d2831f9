/*
 * どこで: Certificate データアクセス
 * 何を: 監査イベント outbox の追記/claim/状態更新を担う
 * なぜ: 台帳更新と同一トランザクションでイベントを確定させ、後から publish するため
 */
package com.popchain.certificate.repository;

import static com.popchain.common.JdbcTimestampUtils.toTimestamp;

import com.popchain.certificate.model.OutboxEventRecord;
import com.popchain.certificate.model.OutboxStatus;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.time.Instant;
import java.util.List;
import java.util.UUID;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.stereotype.Repository;

@Repository
public class OutboxEventRepository {

  private final NamedParameterJdbcTemplate jdbcTemplate;

  public OutboxEventRepository(NamedParameterJdbcTemplate jdbcTemplate) {
    // SpotBugs の EI_EXPOSE_REP2 対応: 外部参照を直接保持せず、ラッパを作り直す
    this.jdbcTemplate = new NamedParameterJdbcTemplate(jdbcTemplate.getJdbcTemplate());
  }

  public int append(
      UUID eventId, String eventType, String aggregateKey, String payloadJson, Instant createdAt) {
    final String sql =
        """
        INSERT INTO outbox_events (
          event_id, event_type, aggregate_key, payload, status, attempt_count, created_at
        ) VALUES (
          :eventId, :eventType, :aggregateKey, :payload::jsonb, 'PENDING', 0, :createdAt
        )
        """;
    final MapSqlParameterSource params =
        new MapSqlParameterSource()
            .addValue("eventId", eventId)
            .addValue("eventType", eventType)
            .addValue("aggregateKey", aggregateKey)
            .addValue("payload", payloadJson)
            .addValue("createdAt", toTimestamp(createdAt));
    return jdbcTemplate.update(sql, params);
  }

  public List<OutboxEventRecord> claimPending(
      int limit, Instant now, Instant leaseUntil, String lockedBy) {
    // 再試行時刻を過ぎた PENDING と、リース切れの IN_FLIGHT を作成順に claim する
    final String sql =
        """
        WITH claimable AS (
          SELECT event_id
          FROM outbox_events
          WHERE (status = 'PENDING' AND (next_retry_at IS NULL OR next_retry_at <= :now))
             OR (status = 'IN_FLIGHT' AND (lease_until IS NULL OR lease_until <= :now))
          ORDER BY created_at
          LIMIT :limit
          FOR UPDATE SKIP LOCKED
        ), claimed AS (
          UPDATE outbox_events o
          SET status = 'IN_FLIGHT',
              locked_by = :lockedBy,
              locked_at = :now,
              lease_until = :leaseUntil,
              last_error = NULL
          FROM claimable
          WHERE o.event_id = claimable.event_id
          RETURNING o.event_id, o.event_type, o.aggregate_key, o.payload::text AS payload_text,
                    o.attempt_count, o.created_at
        )
        SELECT event_id, event_type, aggregate_key, payload_text, attempt_count
        FROM claimed
        ORDER BY created_at
        """;
    final MapSqlParameterSource params =
        new MapSqlParameterSource()
            .addValue("now", toTimestamp(now))
            .addValue("leaseUntil", toTimestamp(leaseUntil))
            .addValue("lockedBy", lockedBy)
            .addValue("limit", limit);
    // RETURNING は順序を保証しないため、外側の SELECT で作成順に並べ直す
    return jdbcTemplate.query(sql, params, this::mapRow);
  }

  public int markPublished(UUID eventId, String lockedBy, Instant publishedAt) {
    final String sql =
        """
        UPDATE outbox_events
        SET status = 'PUBLISHED',
            published_at = :publishedAt,
            locked_by = NULL,
            locked_at = NULL,
            lease_until = NULL
        WHERE event_id = :eventId
          AND locked_by = :lockedBy
        """;
    final MapSqlParameterSource params =
        new MapSqlParameterSource()
            .addValue("publishedAt", toTimestamp(publishedAt))
            .addValue("eventId", eventId)
            .addValue("lockedBy", lockedBy);
    return jdbcTemplate.update(sql, params);
  }

  public int markFailure(
      UUID eventId,
      String lockedBy,
      int attemptCount,
      OutboxStatus status,
      Instant nextRetryAt,
      String lastError) {
    final String sql =
        """
        UPDATE outbox_events
        SET attempt_count = :attemptCount,
            status = :status,
            next_retry_at = :nextRetryAt,
            locked_by = NULL,
            locked_at = NULL,
            lease_until = NULL,
            last_error = :lastError
        WHERE event_id = :eventId
          AND locked_by = :lockedBy
        """;
    final MapSqlParameterSource params =
        new MapSqlParameterSource()
            .addValue("attemptCount", attemptCount)
            .addValue("status", status.name())
            .addValue("nextRetryAt", toTimestamp(nextRetryAt))
            .addValue("lastError", lastError)
            .addValue("eventId", eventId)
            .addValue("lockedBy", lockedBy);
    return jdbcTemplate.update(sql, params);
  }

  public int countFailed() {
    final Integer count =
        jdbcTemplate.queryForObject(
            "SELECT COUNT(*) FROM outbox_events WHERE status = 'FAILED'",
            new MapSqlParameterSource(),
            Integer.class);
    return count == null ? 0 : count;
  }

  private OutboxEventRecord mapRow(ResultSet rs, int rowNum) throws SQLException {
    return new OutboxEventRecord(
        UUID.fromString(rs.getString("event_id")),
        rs.getString("event_type"),
        rs.getString("aggregate_key"),
        rs.getString("payload_text"),
        rs.getInt("attempt_count"));
  }
}
