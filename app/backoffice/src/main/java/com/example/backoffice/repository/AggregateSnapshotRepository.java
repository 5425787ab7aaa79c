/*
 * どこで: Backoffice データアクセス
 * 何を: aggregate_snapshots の取得/登録/楽観ロック付き更新
 * なぜ: UnitOfWork から状態を outbox と同一トランザクションで書くため
 */
package com.example.backoffice.repository;

import static com.example.common.JdbcTimestampUtils.getInstant;
import static com.example.common.JdbcTimestampUtils.toTimestamp;

import com.example.backoffice.model.AggregateSnapshot;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.stereotype.Repository;

@Repository
public class AggregateSnapshotRepository {

  private final NamedParameterJdbcTemplate jdbcTemplate;

  public AggregateSnapshotRepository(NamedParameterJdbcTemplate jdbcTemplate) {
    // SpotBugs の EI_EXPOSE_REP2 対応: 外部参照を直接保持せず、ラッパを作り直す
    this.jdbcTemplate = new NamedParameterJdbcTemplate(jdbcTemplate.getJdbcTemplate());
  }

  public Optional<AggregateSnapshot> find(
      String aggregateType, UUID aggregateId, SoftDeleteFilter filter) {
    final String sql =
        """
        SELECT s.aggregate_type, s.aggregate_id, s.status, s.deleted, s.version,
               s.state::text AS state_text, s.created_at, s.updated_at
        FROM aggregate_snapshots s
        WHERE s.aggregate_type = :aggregateType
          AND s.aggregate_id = :aggregateId
          AND %s
        """
            .formatted(filter.predicate("s"));
    final MapSqlParameterSource params =
        new MapSqlParameterSource()
            .addValue("aggregateType", aggregateType)
            .addValue("aggregateId", aggregateId);
    return jdbcTemplate.query(sql, params, this::mapRow).stream().findFirst();
  }

  public List<AggregateSnapshot> findByStatus(
      String aggregateType, String status, SoftDeleteFilter filter, int limit) {
    final String sql =
        """
        SELECT s.aggregate_type, s.aggregate_id, s.status, s.deleted, s.version,
               s.state::text AS state_text, s.created_at, s.updated_at
        FROM aggregate_snapshots s
        WHERE s.aggregate_type = :aggregateType
          AND s.status = :status
          AND %s
        ORDER BY s.updated_at, s.aggregate_id
        LIMIT :limit
        """
            .formatted(filter.predicate("s"));
    final MapSqlParameterSource params =
        new MapSqlParameterSource()
            .addValue("aggregateType", aggregateType)
            .addValue("status", status)
            .addValue("limit", limit);
    return jdbcTemplate.query(sql, params, this::mapRow);
  }

  /** 新規集約を version=1 で登録する。主キー重複は DuplicateKeyException になる。 */
  public int insert(
      String aggregateType,
      UUID aggregateId,
      String status,
      boolean deleted,
      String stateJson,
      Instant createdAt,
      Instant updatedAt) {
    final String sql =
        """
        INSERT INTO aggregate_snapshots (
          aggregate_type,
          aggregate_id,
          status,
          deleted,
          version,
          state,
          created_at,
          updated_at
        ) VALUES (
          :aggregateType,
          :aggregateId,
          :status,
          :deleted,
          1,
          :state::jsonb,
          :createdAt,
          :updatedAt
        )
        """;
    final MapSqlParameterSource params =
        new MapSqlParameterSource()
            .addValue("aggregateType", aggregateType)
            .addValue("aggregateId", aggregateId)
            .addValue("status", status)
            .addValue("deleted", deleted)
            .addValue("state", stateJson)
            .addValue("createdAt", toTimestamp(createdAt))
            .addValue("updatedAt", toTimestamp(updatedAt));
    return jdbcTemplate.update(sql, params);
  }

  /** 期待バージョンが一致したときだけ更新する。0 件なら他者に先を越されている。 */
  public int update(
      String aggregateType,
      UUID aggregateId,
      long expectedVersion,
      String status,
      boolean deleted,
      String stateJson,
      Instant updatedAt) {
    final String sql =
        """
        UPDATE aggregate_snapshots
        SET status = :status,
            deleted = :deleted,
            version = version + 1,
            state = :state::jsonb,
            updated_at = :updatedAt
        WHERE aggregate_type = :aggregateType
          AND aggregate_id = :aggregateId
          AND version = :expectedVersion
        """;
    final MapSqlParameterSource params =
        new MapSqlParameterSource()
            .addValue("status", status)
            .addValue("deleted", deleted)
            .addValue("state", stateJson)
            .addValue("updatedAt", toTimestamp(updatedAt))
            .addValue("aggregateType", aggregateType)
            .addValue("aggregateId", aggregateId)
            .addValue("expectedVersion", expectedVersion);
    return jdbcTemplate.update(sql, params);
  }

  private AggregateSnapshot mapRow(ResultSet rs, int rowNum) throws SQLException {
    return new AggregateSnapshot(
        rs.getString("aggregate_type"),
        rs.getObject("aggregate_id", UUID.class),
        rs.getString("status"),
        rs.getBoolean("deleted"),
        rs.getLong("version"),
        rs.getString("state_text"),
        getInstant(rs, "created_at"),
        getInstant(rs, "updated_at"));
  }
}
