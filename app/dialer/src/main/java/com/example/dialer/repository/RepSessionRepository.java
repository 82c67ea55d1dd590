/*
 * どこで: Dialer データアクセス
 * 何を: rep_sessions の登録/claim/release を担う
 * なぜ: 担当者の排他確保を 1 文の条件付き UPDATE として DB に閉じ込めるため
 */
package com.example.dialer.repository;

import static com.example.common.JdbcTimestampUtils.toInstant;
import static com.example.common.JdbcTimestampUtils.toTimestamp;

import com.example.dialer.model.RepAvailability;
import com.example.dialer.model.RepClaim;
import com.example.dialer.model.RepSessionRecord;
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
public class RepSessionRepository {

  private static final String COLUMNS =
      """
      session_id, org_id, rep_id, client_identity, availability, conference_name,
      claimed_call_handle, claimed_at, last_released_at, started_at, connected_call_count
      """;

  private final NamedParameterJdbcTemplate jdbcTemplate;

  public RepSessionRecord upsert(String orgId, String repId, String clientIdentity, Instant now) {
    // 既存セッションは claim 状態を保ったまま返す
    final String sql =
        """
        INSERT INTO rep_sessions (
          session_id, org_id, rep_id, client_identity, availability, started_at,
          connected_call_count
        ) VALUES (
          :sessionId, :orgId, :repId, :clientIdentity, 'AVAILABLE', :now, 0
        )
        ON CONFLICT (org_id, rep_id) DO UPDATE
        SET client_identity = EXCLUDED.client_identity
        RETURNING
        """
            + COLUMNS;
    final MapSqlParameterSource params =
        new MapSqlParameterSource()
            .addValue("sessionId", UUID.randomUUID())
            .addValue("orgId", orgId)
            .addValue("repId", repId)
            .addValue("clientIdentity", clientIdentity)
            .addValue("now", toTimestamp(now));
    return jdbcTemplate.queryForObject(sql, params, this::mapRow);
  }

  public Optional<RepSessionRecord> delete(String orgId, String repId) {
    final String sql =
        "DELETE FROM rep_sessions WHERE org_id = :orgId AND rep_id = :repId RETURNING " + COLUMNS;
    final MapSqlParameterSource params =
        new MapSqlParameterSource().addValue("orgId", orgId).addValue("repId", repId);
    return jdbcTemplate.query(sql, params, this::mapRow).stream().findFirst();
  }

  public Optional<RepSessionRecord> findBySessionId(UUID sessionId) {
    final String sql = "SELECT " + COLUMNS + " FROM rep_sessions WHERE session_id = :sessionId";
    return jdbcTemplate
        .query(sql, new MapSqlParameterSource().addValue("sessionId", sessionId), this::mapRow)
        .stream()
        .findFirst();
  }

  public List<RepSessionRecord> findByOrg(String orgId) {
    final String sql =
        "SELECT " + COLUMNS + " FROM rep_sessions WHERE org_id = :orgId ORDER BY started_at";
    return jdbcTemplate.query(
        sql, new MapSqlParameterSource().addValue("orgId", orgId), this::mapRow);
  }

  public Optional<RepClaim> claimAvailable(
      String orgId, String callHandle, String conferenceStamp, Instant now) {
    // 1 文の UPDATE ... RETURNING で確保する。ロック中の行は待たずに飛ばすので空振りは即時に返る
    final String sql =
        """
        WITH cte AS (
          SELECT session_id
          FROM rep_sessions
          WHERE org_id = :orgId
            AND availability = 'AVAILABLE'
          ORDER BY last_released_at ASC NULLS FIRST, started_at ASC
          LIMIT 1
          FOR UPDATE SKIP LOCKED
        )
        UPDATE rep_sessions r
        SET availability = 'CLAIMED',
            conference_name = 'turbo-' || r.org_id || '-' || r.rep_id || '-' || :stamp,
            claimed_call_handle = :callHandle,
            claimed_at = :now
        FROM cte
        WHERE r.session_id = cte.session_id
          AND r.availability = 'AVAILABLE'
        RETURNING r.session_id, r.rep_id, r.client_identity, r.conference_name
        """;
    final MapSqlParameterSource params =
        new MapSqlParameterSource()
            .addValue("orgId", orgId)
            .addValue("stamp", conferenceStamp)
            .addValue("callHandle", callHandle)
            .addValue("now", toTimestamp(now));
    final List<RepClaim> claimed =
        jdbcTemplate.query(
            sql,
            params,
            (rs, rowNum) ->
                new RepClaim(
                    UUID.fromString(rs.getString("session_id")),
                    rs.getString("rep_id"),
                    rs.getString("client_identity"),
                    rs.getString("conference_name")));
    return claimed.stream().findFirst();
  }

  public int release(UUID sessionId, String callHandle, Instant now) {
    // 別の通話で claim し直された担当者は解放しない
    final String sql =
        """
        UPDATE rep_sessions
        SET availability = 'AVAILABLE',
            conference_name = NULL,
            claimed_call_handle = NULL,
            claimed_at = NULL,
            last_released_at = :now
        WHERE session_id = :sessionId
          AND availability = 'CLAIMED'
          AND claimed_call_handle = :callHandle
        """;
    final MapSqlParameterSource params =
        new MapSqlParameterSource()
            .addValue("sessionId", sessionId)
            .addValue("callHandle", callHandle)
            .addValue("now", toTimestamp(now));
    return jdbcTemplate.update(sql, params);
  }

  public int releaseConference(UUID sessionId, String conferenceName, Instant now) {
    final String sql =
        """
        UPDATE rep_sessions
        SET availability = 'AVAILABLE',
            conference_name = NULL,
            claimed_call_handle = NULL,
            claimed_at = NULL,
            last_released_at = :now
        WHERE session_id = :sessionId
          AND availability = 'CLAIMED'
          AND conference_name = :conferenceName
        """;
    final MapSqlParameterSource params =
        new MapSqlParameterSource()
            .addValue("sessionId", sessionId)
            .addValue("conferenceName", conferenceName)
            .addValue("now", toTimestamp(now));
    return jdbcTemplate.update(sql, params);
  }

  public List<RepSessionRecord> releaseStaleClaims(Instant claimedBefore, Instant now) {
    // 通話がまだ生きている claim は対象外
    final String sql =
        """
        UPDATE rep_sessions r
        SET availability = 'AVAILABLE',
            conference_name = NULL,
            claimed_call_handle = NULL,
            claimed_at = NULL,
            last_released_at = :now
        WHERE r.availability = 'CLAIMED'
          AND r.claimed_at < :claimedBefore
          AND NOT EXISTS (
            SELECT 1
            FROM call_attempts c
            WHERE c.call_handle = r.claimed_call_handle
              AND c.status IN ('DIALING', 'RINGING', 'ANSWERED', 'HOLDING', 'CONNECTED', 'VOICEMAIL')
          )
        RETURNING
        """
            + COLUMNS;
    final MapSqlParameterSource params =
        new MapSqlParameterSource()
            .addValue("claimedBefore", toTimestamp(claimedBefore))
            .addValue("now", toTimestamp(now));
    return jdbcTemplate.query(sql, params, this::mapRow);
  }

  public int incrementConnected(UUID sessionId) {
    final String sql =
        """
        UPDATE rep_sessions
        SET connected_call_count = connected_call_count + 1
        WHERE session_id = :sessionId
        """;
    return jdbcTemplate.update(sql, new MapSqlParameterSource().addValue("sessionId", sessionId));
  }

  public int countAvailable(String orgId) {
    final String sql =
        """
        SELECT COUNT(*)
        FROM rep_sessions
        WHERE org_id = :orgId
          AND availability = 'AVAILABLE'
        """;
    final Integer count =
        jdbcTemplate.queryForObject(
            sql, new MapSqlParameterSource().addValue("orgId", orgId), Integer.class);
    return count == null ? 0 : count;
  }

  public List<String> findOrgsReadyToDial(Instant now) {
    // 空き担当者と発信可能なリードが両方ある org だけ
    final String sql =
        """
        SELECT DISTINCT r.org_id
        FROM rep_sessions r
        WHERE r.availability = 'AVAILABLE'
          AND EXISTS (
            SELECT 1
            FROM queue_entries q
            WHERE q.org_id = r.org_id
              AND q.status = 'QUEUED'
              AND (q.next_attempt_after IS NULL OR q.next_attempt_after <= :now)
          )
        ORDER BY r.org_id
        """;
    return jdbcTemplate.queryForList(
        sql, new MapSqlParameterSource().addValue("now", toTimestamp(now)), String.class);
  }

  private RepSessionRecord mapRow(ResultSet rs, int rowNum) throws SQLException {
    return new RepSessionRecord(
        UUID.fromString(rs.getString("session_id")),
        rs.getString("org_id"),
        rs.getString("rep_id"),
        rs.getString("client_identity"),
        RepAvailability.valueOf(rs.getString("availability")),
        rs.getString("conference_name"),
        rs.getString("claimed_call_handle"),
        toInstant(rs.getTimestamp("claimed_at")),
        toInstant(rs.getTimestamp("last_released_at")),
        toInstant(rs.getTimestamp("started_at")),
        rs.getInt("connected_call_count"));
  }
}
