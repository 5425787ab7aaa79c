/*
 * どこで: Backoffice データアクセス
 * 何を: outbox_messages の追記/claim/処理結果更新/dead-letter 操作
 * なぜ: 書き込み側 (UnitOfWork) と relay が共有する唯一の可変テーブルを一箇所で扱うため
 */
package com.example.backoffice.repository;

import static com.example.common.JdbcTimestampUtils.getInstant;
import static com.example.common.JdbcTimestampUtils.toTimestamp;

import com.example.backoffice.model.DeadLetterQuery;
import com.example.backoffice.model.OutboxMessageRecord;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.stereotype.Repository;

@Repository
public class OutboxMessageRepository {

  private static final String COLUMNS =
      """
      m.id, m.event_id, m.aggregate_id, m.aggregate_type, m.event_type, m.payload_version,
      m.payload::text AS payload_text, m.occurred_at, m.processed_at, m.retry_count,
      m.last_error, m.claimed_by, m.claimed_until, m.available_at, m.dead_lettered_at,
      m.created_at
      """;

  private final NamedParameterJdbcTemplate jdbcTemplate;

  public OutboxMessageRepository(NamedParameterJdbcTemplate jdbcTemplate) {
    // SpotBugs の EI_EXPOSE_REP2 対応: 外部参照を直接保持せず、ラッパを作り直す
    this.jdbcTemplate = new NamedParameterJdbcTemplate(jdbcTemplate.getJdbcTemplate());
  }

  public int insert(
      UUID eventId,
      UUID aggregateId,
      String aggregateType,
      String eventType,
      int payloadVersion,
      String payloadJson,
      Instant occurredAt,
      Instant now) {
    final String sql =
        """
        INSERT INTO outbox_messages (
          event_id,
          aggregate_id,
          aggregate_type,
          event_type,
          payload_version,
          payload,
          occurred_at,
          processed_at,
          retry_count,
          available_at,
          created_at
        ) VALUES (
          :eventId,
          :aggregateId,
          :aggregateType,
          :eventType,
          :payloadVersion,
          :payload::jsonb,
          :occurredAt,
          NULL,
          0,
          :now,
          :now
        )
        """;
    final MapSqlParameterSource params =
        new MapSqlParameterSource()
            .addValue("eventId", eventId)
            .addValue("aggregateId", aggregateId)
            .addValue("aggregateType", aggregateType)
            .addValue("eventType", eventType)
            .addValue("payloadVersion", payloadVersion)
            .addValue("payload", payloadJson)
            .addValue("occurredAt", toTimestamp(occurredAt))
            .addValue("now", toTimestamp(now));
    return jdbcTemplate.update(sql, params);
  }

  /**
   * 配送可能な行を lease 付きで claim する。
   *
   * <p>同一集約に未処理の先行行が残っている行は対象外にし、集約内の順序を保つ。
   * 先行行が dead-letter の場合も後続は止まる。
   */
  public List<OutboxMessageRecord> claimBatch(
      int limit, Instant now, Instant claimedUntil, String claimedBy) {
    final String sql =
        """
        WITH cte AS (
          SELECT m.id
          FROM outbox_messages m
          WHERE m.processed_at IS NULL
            AND m.dead_lettered_at IS NULL
            AND m.available_at <= :now
            AND (m.claimed_until IS NULL OR m.claimed_until <= :now)
            AND NOT EXISTS (
              SELECT 1
              FROM outbox_messages p
              WHERE p.aggregate_type = m.aggregate_type
                AND p.aggregate_id = m.aggregate_id
                AND p.id < m.id
                AND p.processed_at IS NULL
            )
          ORDER BY m.id
          LIMIT :limit
          FOR UPDATE SKIP LOCKED
        )
        UPDATE outbox_messages m
        SET claimed_by = :claimedBy,
            claimed_until = :claimedUntil
        FROM cte
        WHERE m.id = cte.id
        RETURNING
        """
            + COLUMNS;
    final MapSqlParameterSource params =
        new MapSqlParameterSource()
            .addValue("now", toTimestamp(now))
            .addValue("claimedUntil", toTimestamp(claimedUntil))
            .addValue("claimedBy", claimedBy)
            .addValue("limit", limit);
    // RETURNING の順序は保証されないため id で並べ直す
    final List<OutboxMessageRecord> claimed =
        new ArrayList<>(jdbcTemplate.query(sql, params, this::mapRow));
    claimed.sort(Comparator.comparingLong(OutboxMessageRecord::id));
    return claimed;
  }

  public int markProcessed(long id, String claimedBy, Instant processedAt) {
    final String sql =
        """
        UPDATE outbox_messages
        SET processed_at = :processedAt,
            last_error = NULL,
            claimed_by = NULL,
            claimed_until = NULL
        WHERE id = :id
          AND claimed_by = :claimedBy
          AND processed_at IS NULL
        """;
    final MapSqlParameterSource params =
        new MapSqlParameterSource()
            .addValue("processedAt", toTimestamp(processedAt))
            .addValue("id", id)
            .addValue("claimedBy", claimedBy);
    return jdbcTemplate.update(sql, params);
  }

  public int markRetry(
      long id, String claimedBy, int retryCount, Instant availableAt, String lastError) {
    final String sql =
        """
        UPDATE outbox_messages
        SET retry_count = :retryCount,
            available_at = :availableAt,
            last_error = :lastError,
            claimed_by = NULL,
            claimed_until = NULL
        WHERE id = :id
          AND claimed_by = :claimedBy
          AND processed_at IS NULL
        """;
    final MapSqlParameterSource params =
        new MapSqlParameterSource()
            .addValue("retryCount", retryCount)
            .addValue("availableAt", toTimestamp(availableAt))
            .addValue("lastError", lastError)
            .addValue("id", id)
            .addValue("claimedBy", claimedBy);
    return jdbcTemplate.update(sql, params);
  }

  public int markDeadLettered(
      long id, String claimedBy, int retryCount, String lastError, Instant deadLetteredAt) {
    final String sql =
        """
        UPDATE outbox_messages
        SET retry_count = :retryCount,
            last_error = :lastError,
            dead_lettered_at = :deadLetteredAt,
            claimed_by = NULL,
            claimed_until = NULL
        WHERE id = :id
          AND claimed_by = :claimedBy
          AND processed_at IS NULL
        """;
    final MapSqlParameterSource params =
        new MapSqlParameterSource()
            .addValue("retryCount", retryCount)
            .addValue("lastError", lastError)
            .addValue("deadLetteredAt", toTimestamp(deadLetteredAt))
            .addValue("id", id)
            .addValue("claimedBy", claimedBy);
    return jdbcTemplate.update(sql, params);
  }

  /** 停止時に自分が保持している lease を手放す。 */
  public int releaseClaims(String claimedBy) {
    final String sql =
        """
        UPDATE outbox_messages
        SET claimed_by = NULL,
            claimed_until = NULL
        WHERE claimed_by = :claimedBy
          AND processed_at IS NULL
        """;
    return jdbcTemplate.update(sql, new MapSqlParameterSource("claimedBy", claimedBy));
  }

  /** 指定行の lease だけを手放す。retry_count と available_at は変えない。 */
  public int releaseClaims(String claimedBy, List<Long> ids) {
    if (ids.isEmpty()) {
      return 0;
    }
    final String sql =
        """
        UPDATE outbox_messages
        SET claimed_by = NULL,
            claimed_until = NULL
        WHERE id IN (:ids)
          AND claimed_by = :claimedBy
          AND processed_at IS NULL
        """;
    final MapSqlParameterSource params =
        new MapSqlParameterSource().addValue("ids", ids).addValue("claimedBy", claimedBy);
    return jdbcTemplate.update(sql, params);
  }

  public Optional<OutboxMessageRecord> findById(long id) {
    final String sql = "SELECT " + COLUMNS + " FROM outbox_messages m WHERE m.id = :id";
    return jdbcTemplate
        .query(sql, new MapSqlParameterSource("id", id), this::mapRow)
        .stream()
        .findFirst();
  }

  public List<OutboxMessageRecord> findByAggregate(String aggregateType, UUID aggregateId) {
    final String sql =
        "SELECT "
            + COLUMNS
            + """
            FROM outbox_messages m
            WHERE m.aggregate_type = :aggregateType
              AND m.aggregate_id = :aggregateId
            ORDER BY m.id
            """;
    final MapSqlParameterSource params =
        new MapSqlParameterSource()
            .addValue("aggregateType", aggregateType)
            .addValue("aggregateId", aggregateId);
    return jdbcTemplate.query(sql, params, this::mapRow);
  }

  public List<OutboxMessageRecord> findDeadLetters(DeadLetterQuery query) {
    // 指定された条件だけを WHERE に足す
    final StringBuilder sql =
        new StringBuilder("SELECT ")
            .append(COLUMNS)
            .append(" FROM outbox_messages m WHERE m.dead_lettered_at IS NOT NULL");
    final MapSqlParameterSource params = new MapSqlParameterSource();
    if (query.eventType() != null) {
      sql.append(" AND m.event_type = :eventType");
      params.addValue("eventType", query.eventType());
    }
    if (query.from() != null) {
      sql.append(" AND m.dead_lettered_at >= :from");
      params.addValue("from", toTimestamp(query.from()));
    }
    if (query.to() != null) {
      sql.append(" AND m.dead_lettered_at < :to");
      params.addValue("to", toTimestamp(query.to()));
    }
    if (query.errorContains() != null) {
      sql.append(" AND m.last_error ILIKE :errorPattern");
      params.addValue("errorPattern", "%" + escapeLike(query.errorContains()) + "%");
    }
    sql.append(" ORDER BY m.dead_lettered_at DESC, m.id DESC LIMIT :limit");
    params.addValue("limit", query.limit());
    return jdbcTemplate.query(sql.toString(), params, this::mapRow);
  }

  /** dead-letter 行を未処理状態に戻し、次回の claim 対象にする。 */
  public int resetDeadLetter(long id, Instant now) {
    final String sql =
        """
        UPDATE outbox_messages
        SET dead_lettered_at = NULL,
            processed_at = NULL,
            retry_count = 0,
            last_error = NULL,
            claimed_by = NULL,
            claimed_until = NULL,
            available_at = :now
        WHERE id = :id
          AND dead_lettered_at IS NOT NULL
        """;
    final MapSqlParameterSource params =
        new MapSqlParameterSource().addValue("now", toTimestamp(now)).addValue("id", id);
    return jdbcTemplate.update(sql, params);
  }

  public int countDeadLettered() {
    final String sql = "SELECT COUNT(*) FROM outbox_messages WHERE dead_lettered_at IS NOT NULL";
    final Integer count =
        jdbcTemplate.queryForObject(sql, new MapSqlParameterSource(), Integer.class);
    return count == null ? 0 : count;
  }

  public int deleteProcessedOlderThan(Instant threshold) {
    // 処理済みだけを対象にし、未処理/dead-letter は残す。
    final String sql =
        """
        DELETE FROM outbox_messages
        WHERE processed_at IS NOT NULL
          AND processed_at <= :threshold
        """;
    final MapSqlParameterSource params =
        new MapSqlParameterSource().addValue("threshold", toTimestamp(threshold));
    return jdbcTemplate.update(sql, params);
  }

  private static String escapeLike(String value) {
    return value.replace("\\", "\\\\").replace("%", "\\%").replace("_", "\\_");
  }

  private OutboxMessageRecord mapRow(ResultSet rs, int rowNum) throws SQLException {
    return new OutboxMessageRecord(
        rs.getLong("id"),
        rs.getObject("event_id", UUID.class),
        rs.getObject("aggregate_id", UUID.class),
        rs.getString("aggregate_type"),
        rs.getString("event_type"),
        rs.getInt("payload_version"),
        rs.getString("payload_text"),
        getInstant(rs, "occurred_at"),
        getInstant(rs, "processed_at"),
        rs.getInt("retry_count"),
        rs.getString("last_error"),
        rs.getString("claimed_by"),
        getInstant(rs, "claimed_until"),
        getInstant(rs, "available_at"),
        getInstant(rs, "dead_lettered_at"),
        getInstant(rs, "created_at"));
  }
}
