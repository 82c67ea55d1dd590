/*
 * どこで: Dialer データアクセス
 * 何を: queue_entries の登録/取り出し/結果反映を担う
 * なぜ: 発信待ちリードの取り合いとリトライ上限を DB の条件付き更新で守るため
 */
package com.example.dialer.repository;

import static com.example.common.JdbcTimestampUtils.toInstant;
import static com.example.common.JdbcTimestampUtils.toTimestamp;

import com.example.dialer.model.Disposition;
import com.example.dialer.model.QueueEntryRecord;
import com.example.dialer.model.QueueEntryStatus;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.time.Instant;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import lombok.RequiredArgsConstructor;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.stereotype.Repository;

@Repository
@RequiredArgsConstructor
public class QueueEntryRepository {

  private static final String COLUMNS =
      """
      entry_id, org_id, lead_id, lead_phone, lead_name, priority, status, added_at, added_by,
      last_attempt_at, last_disposition, attempt_count, next_attempt_after
      """;

  private final NamedParameterJdbcTemplate jdbcTemplate;

  public QueueEntryRecord upsert(
      String orgId,
      String leadId,
      String leadPhone,
      String leadName,
      int priority,
      String addedBy,
      Instant now) {
    // 稼働中のエントリは状態を保ったまま優先度だけ更新し、終端のものは明示的な再投入として戻す
    final String sql =
        """
        INSERT INTO queue_entries (
          entry_id, org_id, lead_id, lead_phone, lead_name, priority, status,
          added_at, added_by, attempt_count
        ) VALUES (
          :entryId, :orgId, :leadId, :leadPhone, :leadName, :priority, 'QUEUED',
          :now, :addedBy, 0
        )
        ON CONFLICT (org_id, lead_id) DO UPDATE
        SET priority = EXCLUDED.priority,
            lead_phone = EXCLUDED.lead_phone,
            lead_name = COALESCE(EXCLUDED.lead_name, queue_entries.lead_name),
            added_by = EXCLUDED.added_by,
            status = CASE
              WHEN queue_entries.status IN ('COMPLETED', 'FAILED') THEN 'QUEUED'
              ELSE queue_entries.status
            END,
            attempt_count = CASE
              WHEN queue_entries.status IN ('COMPLETED', 'FAILED') THEN 0
              ELSE queue_entries.attempt_count
            END,
            added_at = CASE
              WHEN queue_entries.status IN ('COMPLETED', 'FAILED') THEN EXCLUDED.added_at
              ELSE queue_entries.added_at
            END,
            next_attempt_after = CASE
              WHEN queue_entries.status IN ('COMPLETED', 'FAILED') THEN NULL
              ELSE queue_entries.next_attempt_after
            END
        RETURNING
        """
            + COLUMNS;
    final MapSqlParameterSource params =
        new MapSqlParameterSource()
            .addValue("entryId", UUID.randomUUID())
            .addValue("orgId", orgId)
            .addValue("leadId", leadId)
            .addValue("leadPhone", leadPhone)
            .addValue("leadName", leadName)
            .addValue("priority", priority)
            .addValue("addedBy", addedBy)
            .addValue("now", toTimestamp(now));
    return jdbcTemplate.queryForObject(sql, params, this::mapRow);
  }

  public List<QueueEntryRecord> claimNextBatch(String orgId, int limit, Instant now) {
    // SKIP LOCKED で並行する発信サイクル同士が同じリードを掴まないようにする
    final String sql =
        """
        WITH cte AS (
          SELECT entry_id
          FROM queue_entries
          WHERE org_id = :orgId
            AND status = 'QUEUED'
            AND (next_attempt_after IS NULL OR next_attempt_after <= :now)
          ORDER BY priority DESC, added_at ASC
          LIMIT :limit
          FOR UPDATE SKIP LOCKED
        )
        UPDATE queue_entries q
        SET status = 'DIALING',
            last_attempt_at = :now
        FROM cte
        WHERE q.entry_id = cte.entry_id
        RETURNING q.entry_id, q.org_id, q.lead_id, q.lead_phone, q.lead_name, q.priority,
                  q.status, q.added_at, q.added_by, q.last_attempt_at, q.last_disposition,
                  q.attempt_count, q.next_attempt_after
        """;
    final MapSqlParameterSource params =
        new MapSqlParameterSource()
            .addValue("orgId", orgId)
            .addValue("limit", limit)
            .addValue("now", toTimestamp(now));
    final List<QueueEntryRecord> claimed = jdbcTemplate.query(sql, params, this::mapRow);
    // RETURNING の順序は保証されないため取り出し順に並べ直す
    return claimed.stream()
        .sorted(
            Comparator.comparingInt(QueueEntryRecord::priority)
                .reversed()
                .thenComparing(QueueEntryRecord::addedAt))
        .toList();
  }

  public Optional<QueueEntryStatus> markOutcome(
      UUID entryId, Disposition disposition, int retryLimit, Instant nextAttemptAfter) {
    // 終端エントリは対象外。attempt_count の加算と状態判定を 1 文で行う
    final String sql =
        """
        UPDATE queue_entries
        SET attempt_count = CASE
              WHEN CAST(:retryable AS BOOLEAN) THEN attempt_count + 1
              ELSE attempt_count
            END,
            status = CASE
              WHEN NOT CAST(:retryable AS BOOLEAN) THEN 'COMPLETED'
              WHEN attempt_count + 1 >= :retryLimit THEN 'FAILED'
              ELSE 'QUEUED'
            END,
            next_attempt_after = CASE
              WHEN CAST(:retryable AS BOOLEAN) AND attempt_count + 1 < :retryLimit
                THEN CAST(:nextAttemptAfter AS TIMESTAMPTZ)
              ELSE NULL
            END,
            last_disposition = :disposition
        WHERE entry_id = :entryId
          AND status NOT IN ('COMPLETED', 'FAILED')
        RETURNING status
        """;
    final MapSqlParameterSource params =
        new MapSqlParameterSource()
            .addValue("retryable", disposition.retryable())
            .addValue("retryLimit", retryLimit)
            .addValue("nextAttemptAfter", toTimestamp(nextAttemptAfter))
            .addValue("disposition", disposition.name())
            .addValue("entryId", entryId);
    final List<QueueEntryStatus> updated =
        jdbcTemplate.query(
            sql, params, (rs, rowNum) -> QueueEntryStatus.valueOf(rs.getString("status")));
    return updated.stream().findFirst();
  }

  public int returnToQueue(UUID entryId) {
    // 兄弟発信の取り消しは試行回数に数えない
    final String sql =
        """
        UPDATE queue_entries
        SET status = 'QUEUED'
        WHERE entry_id = :entryId
          AND status IN ('DIALING', 'RINGING')
        """;
    return jdbcTemplate.update(sql, new MapSqlParameterSource().addValue("entryId", entryId));
  }

  public int markRinging(UUID entryId) {
    final String sql =
        """
        UPDATE queue_entries
        SET status = 'RINGING'
        WHERE entry_id = :entryId
          AND status = 'DIALING'
        """;
    return jdbcTemplate.update(sql, new MapSqlParameterSource().addValue("entryId", entryId));
  }

  public int markAnswered(UUID entryId) {
    final String sql =
        """
        UPDATE queue_entries
        SET status = 'ANSWERED'
        WHERE entry_id = :entryId
          AND status IN ('DIALING', 'RINGING')
        """;
    return jdbcTemplate.update(sql, new MapSqlParameterSource().addValue("entryId", entryId));
  }

  public Optional<QueueEntryRecord> findById(UUID entryId) {
    final String sql = "SELECT " + COLUMNS + " FROM queue_entries WHERE entry_id = :entryId";
    final List<QueueEntryRecord> rows =
        jdbcTemplate.query(sql, new MapSqlParameterSource().addValue("entryId", entryId), this::mapRow);
    return rows.stream().findFirst();
  }

  public Optional<QueueEntryRecord> findByOrgAndLead(String orgId, String leadId) {
    final String sql =
        "SELECT " + COLUMNS + " FROM queue_entries WHERE org_id = :orgId AND lead_id = :leadId";
    final MapSqlParameterSource params =
        new MapSqlParameterSource().addValue("orgId", orgId).addValue("leadId", leadId);
    return jdbcTemplate.query(sql, params, this::mapRow).stream().findFirst();
  }

  public Map<QueueEntryStatus, Integer> countByStatus(String orgId) {
    final String sql =
        """
        SELECT status, COUNT(*) AS cnt
        FROM queue_entries
        WHERE org_id = :orgId
        GROUP BY status
        """;
    final Map<QueueEntryStatus, Integer> counts = new EnumMap<>(QueueEntryStatus.class);
    for (QueueEntryStatus status : QueueEntryStatus.values()) {
      counts.put(status, 0);
    }
    jdbcTemplate.query(
        sql,
        new MapSqlParameterSource().addValue("orgId", orgId),
        rs -> {
          counts.put(QueueEntryStatus.valueOf(rs.getString("status")), rs.getInt("cnt"));
        });
    return counts;
  }

  public List<QueueEntryRecord> findByOrgOrdered(String orgId, int limit) {
    // 次に発信される順 (QUEUED を先頭) で返す
    final String sql =
        "SELECT "
            + COLUMNS
            + """
            FROM queue_entries
            WHERE org_id = :orgId
            ORDER BY CASE WHEN status = 'QUEUED' THEN 0 ELSE 1 END, priority DESC, added_at ASC
            LIMIT :limit
            """;
    final MapSqlParameterSource params =
        new MapSqlParameterSource().addValue("orgId", orgId).addValue("limit", limit);
    return jdbcTemplate.query(sql, params, this::mapRow);
  }

  public int deleteIdle(String orgId, String leadId) {
    // 発信中のエントリは call_attempts が参照中のため消さない
    final String sql =
        """
        DELETE FROM queue_entries
        WHERE org_id = :orgId
          AND lead_id = :leadId
          AND status NOT IN ('DIALING', 'RINGING', 'ANSWERED')
        """;
    final MapSqlParameterSource params =
        new MapSqlParameterSource().addValue("orgId", orgId).addValue("leadId", leadId);
    return jdbcTemplate.update(sql, params);
  }

  public int deleteAllIdle(String orgId) {
    final String sql =
        """
        DELETE FROM queue_entries
        WHERE org_id = :orgId
          AND status NOT IN ('DIALING', 'RINGING', 'ANSWERED')
        """;
    return jdbcTemplate.update(sql, new MapSqlParameterSource().addValue("orgId", orgId));
  }

  public long countQueued() {
    final String sql = "SELECT COUNT(*) FROM queue_entries WHERE status = 'QUEUED'";
    final Long count = jdbcTemplate.queryForObject(sql, new MapSqlParameterSource(), Long.class);
    return count == null ? 0L : count;
  }

  private QueueEntryRecord mapRow(ResultSet rs, int rowNum) throws SQLException {
    final String lastDisposition = rs.getString("last_disposition");
    return new QueueEntryRecord(
        UUID.fromString(rs.getString("entry_id")),
        rs.getString("org_id"),
        rs.getString("lead_id"),
        rs.getString("lead_phone"),
        rs.getString("lead_name"),
        rs.getInt("priority"),
        QueueEntryStatus.valueOf(rs.getString("status")),
        toInstant(rs.getTimestamp("added_at")),
        rs.getString("added_by"),
        toInstant(rs.getTimestamp("last_attempt_at")),
        lastDisposition == null ? null : Disposition.valueOf(lastDisposition),
        rs.getInt("attempt_count"),
        toInstant(rs.getTimestamp("next_attempt_after")));
  }
}
