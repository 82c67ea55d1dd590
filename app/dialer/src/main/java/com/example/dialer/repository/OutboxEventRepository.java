/*
 * どこで: Dialer データアクセス
 * 何を: 通話イベントを outbox_events に積み、publisher 向けに claim/結果反映する
 * なぜ: 通話の終端確定とイベント配信を同一トランザクションで揃えるため
 */
package com.example.dialer.repository;

import static com.example.common.JdbcTimestampUtils.toTimestamp;

import com.example.dialer.model.OutboxEventRecord;
import com.example.dialer.model.OutboxStatus;
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

  /**
   * 役割: 通話イベントを PENDING で積む。
   *
   * <p>動作: 同じ通話の同種イベントが既にあれば何もしない。
   *
   * @return 新規に積んだ場合 true
   */
  public boolean insertCallEvent(
      UUID eventId,
      String eventType,
      String orgId,
      String callHandle,
      String payloadJson,
      Instant createdAt) {
    final String sql =
        """
        INSERT INTO outbox_events (
          event_id, event_type, org_id, aggregate_key, payload,
          status, attempt_count, created_at
        ) VALUES (
          :eventId, :eventType, :orgId, :callHandle, :payload::jsonb,
          'PENDING', 0, :createdAt
        )
        ON CONFLICT (event_type, aggregate_key) DO NOTHING
        """;
    final MapSqlParameterSource params =
        new MapSqlParameterSource()
            .addValue("eventId", eventId)
            .addValue("eventType", eventType)
            .addValue("orgId", orgId)
            .addValue("callHandle", callHandle)
            .addValue("payload", payloadJson)
            .addValue("createdAt", toTimestamp(createdAt));
    return jdbcTemplate.update(sql, params) == 1;
  }

  public List<OutboxEventRecord> claimDue(
      int limit, Instant now, Instant leaseUntil, String lockedBy) {
    // 再送時刻を過ぎた PENDING と、publisher が落ちてリースが切れた IN_FLIGHT を拾う
    final String sql =
        """
        WITH due AS (
          SELECT event_id
          FROM outbox_events
          WHERE (status = 'PENDING' AND (next_retry_at IS NULL OR next_retry_at <= :now))
             OR (status = 'IN_FLIGHT' AND lease_until <= :now)
          ORDER BY created_at
          LIMIT :limit
          FOR UPDATE SKIP LOCKED
        )
        UPDATE outbox_events o
        SET status = 'IN_FLIGHT',
            locked_by = :lockedBy,
            locked_at = :now,
            lease_until = :leaseUntil
        FROM due
        WHERE o.event_id = due.event_id
        RETURNING o.event_id, o.event_type, o.org_id, o.aggregate_key,
                  o.payload::text AS payload_text, o.attempt_count
        """;
    final MapSqlParameterSource params =
        new MapSqlParameterSource()
            .addValue("now", toTimestamp(now))
            .addValue("leaseUntil", toTimestamp(leaseUntil))
            .addValue("lockedBy", lockedBy)
            .addValue("limit", limit);
    return jdbcTemplate.query(sql, params, this::mapRow);
  }

  public int markPublished(UUID eventId, String lockedBy, Instant publishedAt) {
    final String sql =
        """
        UPDATE outbox_events
        SET status = 'PUBLISHED',
            published_at = :publishedAt,
            last_error = NULL,
            locked_by = NULL,
            locked_at = NULL,
            lease_until = NULL
        WHERE event_id = :eventId
          AND locked_by = :lockedBy
        """;
    return jdbcTemplate.update(
        sql,
        new MapSqlParameterSource()
            .addValue("publishedAt", toTimestamp(publishedAt))
            .addValue("eventId", eventId)
            .addValue("lockedBy", lockedBy));
  }

  public int markRetry(
      UUID eventId, String lockedBy, int attemptCount, Instant nextRetryAt, String lastError) {
    return release(eventId, lockedBy, attemptCount, OutboxStatus.PENDING, nextRetryAt, lastError);
  }

  public int markFailed(UUID eventId, String lockedBy, int attemptCount, String lastError) {
    return release(eventId, lockedBy, attemptCount, OutboxStatus.FAILED, null, lastError);
  }

  private int release(
      UUID eventId,
      String lockedBy,
      int attemptCount,
      OutboxStatus status,
      Instant nextRetryAt,
      String lastError) {
    // locked_by が一致する場合のみ更新する。リースを奪われた publisher の結果は捨てる
    final String sql =
        """
        UPDATE outbox_events
        SET status = :status,
            attempt_count = :attemptCount,
            next_retry_at = :nextRetryAt,
            last_error = :lastError,
            locked_by = NULL,
            locked_at = NULL,
            lease_until = NULL
        WHERE event_id = :eventId
          AND locked_by = :lockedBy
        """;
    return jdbcTemplate.update(
        sql,
        new MapSqlParameterSource()
            .addValue("status", status.name())
            .addValue("attemptCount", attemptCount)
            .addValue("nextRetryAt", toTimestamp(nextRetryAt))
            .addValue("lastError", lastError)
            .addValue("eventId", eventId)
            .addValue("lockedBy", lockedBy));
  }

  public int deletePublishedOlderThan(Instant threshold) {
    // FAILED は手動調査のため残す
    final String sql =
        "DELETE FROM outbox_events WHERE status = 'PUBLISHED' AND published_at <= :threshold";
    return jdbcTemplate.update(
        sql, new MapSqlParameterSource().addValue("threshold", toTimestamp(threshold)));
  }

  public long countByStatus(OutboxStatus status) {
    final Long count =
        jdbcTemplate.queryForObject(
            "SELECT COUNT(*) FROM outbox_events WHERE status = :status",
            new MapSqlParameterSource().addValue("status", status.name()),
            Long.class);
    return count == null ? 0L : count;
  }

  private OutboxEventRecord mapRow(ResultSet rs, int rowNum) throws SQLException {
    return new OutboxEventRecord(
        rs.getObject("event_id", UUID.class),
        rs.getString("event_type"),
        rs.getString("org_id"),
        rs.getString("aggregate_key"),
        rs.getString("payload_text"),
        rs.getInt("attempt_count"));
  }
}
