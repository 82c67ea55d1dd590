/*
 * どこで: Dialer データアクセス
 * 何を: call_attempts の登録と状態遷移を担う
 * なぜ: 重複到着する webhook に対して遷移を条件付き UPDATE で冪等にするため
 */
package com.example.dialer.repository;

import static com.example.common.JdbcTimestampUtils.toInstant;
import static com.example.common.JdbcTimestampUtils.toTimestamp;

import com.example.dialer.model.CallAttemptRecord;
import com.example.dialer.model.CallAttemptStatus;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DuplicateKeyException;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.stereotype.Repository;

@Repository
@RequiredArgsConstructor
public class CallAttemptRepository {

  private static final Logger logger = LoggerFactory.getLogger(CallAttemptRepository.class);
  private static final String COLUMNS =
      """
      call_handle, queue_entry_id, org_id, lead_id, lead_phone, batch_id, status, caller_id,
      assigned_rep_id, session_id, conference_name, is_first_answer, claim_failures,
      dialed_at, ringing_at, answered_at, connected_at, ended_at, duration_seconds,
      recording_url, voicemail_url, voicemail_transcription
      """;
  private static final String TERMINAL_STATUSES =
      "('MACHINE', 'COMPLETED', 'BUSY', 'NO_ANSWER', 'FAILED', 'CANCELED')";

  private final NamedParameterJdbcTemplate jdbcTemplate;

  public void insertDialing(
      String callHandle,
      UUID queueEntryId,
      String orgId,
      String leadId,
      String leadPhone,
      UUID batchId,
      String callerId,
      Instant dialedAt) {
    final String sql =
        """
        INSERT INTO call_attempts (
          call_handle, queue_entry_id, org_id, lead_id, lead_phone, batch_id, status,
          caller_id, is_first_answer, claim_failures, dialed_at
        ) VALUES (
          :callHandle, :queueEntryId, :orgId, :leadId, :leadPhone, :batchId, 'DIALING',
          :callerId, FALSE, 0, :dialedAt
        )
        """;
    final MapSqlParameterSource params =
        new MapSqlParameterSource()
            .addValue("callHandle", callHandle)
            .addValue("queueEntryId", queueEntryId)
            .addValue("orgId", orgId)
            .addValue("leadId", leadId)
            .addValue("leadPhone", leadPhone)
            .addValue("batchId", batchId)
            .addValue("callerId", callerId)
            .addValue("dialedAt", toTimestamp(dialedAt));
    jdbcTemplate.update(sql, params);
  }

  public Optional<CallAttemptRecord> findByCallHandle(String callHandle) {
    final String sql = "SELECT " + COLUMNS + " FROM call_attempts WHERE call_handle = :callHandle";
    final MapSqlParameterSource params =
        new MapSqlParameterSource().addValue("callHandle", callHandle);
    return jdbcTemplate.query(sql, params, this::mapRow).stream().findFirst();
  }

  public List<CallAttemptRecord> findByBatchId(UUID batchId) {
    final String sql =
        "SELECT " + COLUMNS + " FROM call_attempts WHERE batch_id = :batchId ORDER BY dialed_at";
    return jdbcTemplate.query(
        sql, new MapSqlParameterSource().addValue("batchId", batchId), this::mapRow);
  }

  public List<CallAttemptRecord> findRingingSiblings(UUID batchId, String excludeCallHandle) {
    final String sql =
        "SELECT "
            + COLUMNS
            + """
            FROM call_attempts
            WHERE batch_id = :batchId
              AND call_handle <> :excludeCallHandle
              AND status IN ('DIALING', 'RINGING')
            """;
    final MapSqlParameterSource params =
        new MapSqlParameterSource()
            .addValue("batchId", batchId)
            .addValue("excludeCallHandle", excludeCallHandle);
    return jdbcTemplate.query(sql, params, this::mapRow);
  }

  public int markRinging(String callHandle, Instant ringingAt) {
    final String sql =
        """
        UPDATE call_attempts
        SET status = 'RINGING',
            ringing_at = COALESCE(ringing_at, :ringingAt)
        WHERE call_handle = :callHandle
          AND status = 'DIALING'
        """;
    final MapSqlParameterSource params =
        new MapSqlParameterSource()
            .addValue("callHandle", callHandle)
            .addValue("ringingAt", toTimestamp(ringingAt));
    return jdbcTemplate.update(sql, params);
  }

  public int markAnswered(String callHandle, Instant answeredAt) {
    final String sql =
        """
        UPDATE call_attempts
        SET status = 'ANSWERED',
            answered_at = COALESCE(answered_at, :answeredAt)
        WHERE call_handle = :callHandle
          AND status IN ('DIALING', 'RINGING')
        """;
    final MapSqlParameterSource params =
        new MapSqlParameterSource()
            .addValue("callHandle", callHandle)
            .addValue("answeredAt", toTimestamp(answeredAt));
    return jdbcTemplate.update(sql, params);
  }

  public Optional<CallAttemptRecord> markMachine(String callHandle, Instant endedAt) {
    final String sql =
        """
        UPDATE call_attempts
        SET status = 'MACHINE',
            answered_at = COALESCE(answered_at, :endedAt),
            ended_at = :endedAt
        WHERE call_handle = :callHandle
          AND status IN ('DIALING', 'RINGING', 'ANSWERED')
        RETURNING
        """
            + COLUMNS;
    final MapSqlParameterSource params =
        new MapSqlParameterSource()
            .addValue("callHandle", callHandle)
            .addValue("endedAt", toTimestamp(endedAt));
    return jdbcTemplate.query(sql, params, this::mapRow).stream().findFirst();
  }

  public int markHolding(String callHandle, Instant answeredAt) {
    final String sql =
        """
        UPDATE call_attempts
        SET status = 'HOLDING',
            claim_failures = claim_failures + 1,
            answered_at = COALESCE(answered_at, :answeredAt)
        WHERE call_handle = :callHandle
          AND status IN ('DIALING', 'RINGING', 'ANSWERED')
        """;
    final MapSqlParameterSource params =
        new MapSqlParameterSource()
            .addValue("callHandle", callHandle)
            .addValue("answeredAt", toTimestamp(answeredAt));
    return jdbcTemplate.update(sql, params);
  }

  public int markVoicemail(String callHandle) {
    // 2 回目の claim 失敗だけが留守電へ進む
    final String sql =
        """
        UPDATE call_attempts
        SET status = 'VOICEMAIL',
            claim_failures = claim_failures + 1
        WHERE call_handle = :callHandle
          AND status = 'HOLDING'
        """;
    return jdbcTemplate.update(
        sql, new MapSqlParameterSource().addValue("callHandle", callHandle));
  }

  public int markConnected(
      String callHandle, String repId, UUID sessionId, String conferenceName, Instant connectedAt) {
    final String sql =
        """
        UPDATE call_attempts
        SET status = 'CONNECTED',
            assigned_rep_id = :repId,
            session_id = :sessionId,
            conference_name = :conferenceName,
            answered_at = COALESCE(answered_at, :connectedAt),
            connected_at = :connectedAt
        WHERE call_handle = :callHandle
          AND status IN ('DIALING', 'RINGING', 'ANSWERED', 'HOLDING')
        """;
    final MapSqlParameterSource params =
        new MapSqlParameterSource()
            .addValue("callHandle", callHandle)
            .addValue("repId", repId)
            .addValue("sessionId", sessionId)
            .addValue("conferenceName", conferenceName)
            .addValue("connectedAt", toTimestamp(connectedAt));
    return jdbcTemplate.update(sql, params);
  }

  public boolean markFirstAnswer(String callHandle) {
    // batch 内で既に first answer がいれば部分ユニークインデックスで弾かれる
    final String sql =
        """
        UPDATE call_attempts
        SET is_first_answer = TRUE
        WHERE call_handle = :callHandle
          AND NOT is_first_answer
        """;
    try {
      return jdbcTemplate.update(
              sql, new MapSqlParameterSource().addValue("callHandle", callHandle))
          > 0;
    } catch (DuplicateKeyException ex) {
      logger.debug("first answer already taken in batch callHandle={}", callHandle);
      return false;
    }
  }

  public int markCanceled(String callHandle, Instant endedAt) {
    final String sql =
        """
        UPDATE call_attempts
        SET status = 'CANCELED',
            ended_at = :endedAt
        WHERE call_handle = :callHandle
          AND status IN ('DIALING', 'RINGING')
        """;
    final MapSqlParameterSource params =
        new MapSqlParameterSource()
            .addValue("callHandle", callHandle)
            .addValue("endedAt", toTimestamp(endedAt));
    return jdbcTemplate.update(sql, params);
  }

  public Optional<CallAttemptRecord> markTerminal(
      String callHandle,
      CallAttemptStatus status,
      Instant endedAt,
      Integer durationSeconds,
      String recordingUrl) {
    if (!status.isTerminal()) {
      throw new IllegalArgumentException("status must be terminal: " + status);
    }
    // 終端からの再遷移は行わない。遷移が起きた場合だけ行を返す
    final String sql =
        """
        UPDATE call_attempts
        SET status = :status,
            ended_at = :endedAt,
            duration_seconds = COALESCE(CAST(:durationSeconds AS INTEGER), duration_seconds),
            recording_url = COALESCE(:recordingUrl, recording_url)
        WHERE call_handle = :callHandle
          AND status NOT IN
        """
            + TERMINAL_STATUSES
            + "\nRETURNING "
            + COLUMNS;
    final MapSqlParameterSource params =
        new MapSqlParameterSource()
            .addValue("status", status.name())
            .addValue("endedAt", toTimestamp(endedAt))
            .addValue("durationSeconds", durationSeconds)
            .addValue("recordingUrl", recordingUrl)
            .addValue("callHandle", callHandle);
    return jdbcTemplate.query(sql, params, this::mapRow).stream().findFirst();
  }

  public int attachRecordingUrl(String callHandle, String recordingUrl) {
    final String sql =
        """
        UPDATE call_attempts
        SET recording_url = :recordingUrl
        WHERE call_handle = :callHandle
        """;
    final MapSqlParameterSource params =
        new MapSqlParameterSource()
            .addValue("callHandle", callHandle)
            .addValue("recordingUrl", recordingUrl);
    return jdbcTemplate.update(sql, params);
  }

  public int attachVoicemailUrl(String callHandle, String voicemailUrl) {
    final String sql =
        """
        UPDATE call_attempts
        SET voicemail_url = :voicemailUrl
        WHERE call_handle = :callHandle
        """;
    final MapSqlParameterSource params =
        new MapSqlParameterSource()
            .addValue("callHandle", callHandle)
            .addValue("voicemailUrl", voicemailUrl);
    return jdbcTemplate.update(sql, params);
  }

  public int attachTranscription(String callHandle, String transcription) {
    final String sql =
        """
        UPDATE call_attempts
        SET voicemail_transcription = :transcription
        WHERE call_handle = :callHandle
        """;
    final MapSqlParameterSource params =
        new MapSqlParameterSource()
            .addValue("callHandle", callHandle)
            .addValue("transcription", transcription);
    return jdbcTemplate.update(sql, params);
  }

  public int deleteFinishedOlderThan(Instant threshold) {
    final String sql =
        "DELETE FROM call_attempts WHERE ended_at < :threshold AND status IN " + TERMINAL_STATUSES;
    return jdbcTemplate.update(
        sql, new MapSqlParameterSource().addValue("threshold", toTimestamp(threshold)));
  }

  /** 担当者待ちになりうる通話数。CONNECTED は担当者側の CLAIMED で数える。 */
  public int countInFlight(String orgId) {
    final String sql =
        """
        SELECT COUNT(*) FROM call_attempts
        WHERE org_id = :orgId
          AND status IN ('DIALING', 'RINGING', 'ANSWERED', 'HOLDING')
        """;
    final Integer count =
        jdbcTemplate.queryForObject(
            sql, new MapSqlParameterSource().addValue("orgId", orgId), Integer.class);
    return count == null ? 0 : count;
  }

  public int countStaleLive(Instant threshold) {
    final String sql =
        "SELECT COUNT(*) FROM call_attempts WHERE dialed_at < :threshold AND status NOT IN "
            + TERMINAL_STATUSES;
    final Integer count =
        jdbcTemplate.queryForObject(
            sql,
            new MapSqlParameterSource().addValue("threshold", toTimestamp(threshold)),
            Integer.class);
    return count == null ? 0 : count;
  }

  private CallAttemptRecord mapRow(ResultSet rs, int rowNum) throws SQLException {
    final String sessionId = rs.getString("session_id");
    final int duration = rs.getInt("duration_seconds");
    final Integer durationSeconds = rs.wasNull() ? null : duration;
    return new CallAttemptRecord(
        rs.getString("call_handle"),
        UUID.fromString(rs.getString("queue_entry_id")),
        rs.getString("org_id"),
        rs.getString("lead_id"),
        rs.getString("lead_phone"),
        UUID.fromString(rs.getString("batch_id")),
        CallAttemptStatus.valueOf(rs.getString("status")),
        rs.getString("caller_id"),
        rs.getString("assigned_rep_id"),
        sessionId == null ? null : UUID.fromString(sessionId),
        rs.getString("conference_name"),
        rs.getBoolean("is_first_answer"),
        rs.getInt("claim_failures"),
        toInstant(rs.getTimestamp("dialed_at")),
        toInstant(rs.getTimestamp("ringing_at")),
        toInstant(rs.getTimestamp("answered_at")),
        toInstant(rs.getTimestamp("connected_at")),
        toInstant(rs.getTimestamp("ended_at")),
        durationSeconds,
        rs.getString("recording_url"),
        rs.getString("voicemail_url"),
        rs.getString("voicemail_transcription"));
  }
}
