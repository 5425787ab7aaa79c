/*
 * どこで: Backoffice データアクセス
 * 何を: 在庫戻し依頼 (inventory_restock_requests) の登録と参照
 */
package com.example.backoffice.repository;

import static com.example.common.JdbcTimestampUtils.getInstant;
import static com.example.common.JdbcTimestampUtils.toTimestamp;

import com.example.backoffice.model.InventoryRestockRecord;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.time.Instant;
import java.util.List;
import java.util.UUID;
import lombok.RequiredArgsConstructor;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.stereotype.Repository;

@Repository
@RequiredArgsConstructor
public class InventoryRestockRepository {

  private final NamedParameterJdbcTemplate jdbcTemplate;

  public int insert(
      UUID sourceEventId,
      String sourceEventType,
      String aggregateType,
      UUID aggregateId,
      UUID orderId,
      String reason,
      Instant createdAt) {
    final String sql =
        """
        INSERT INTO inventory_restock_requests (
          source_event_id,
          source_event_type,
          aggregate_type,
          aggregate_id,
          order_id,
          reason,
          created_at
        ) VALUES (
          :sourceEventId,
          :sourceEventType,
          :aggregateType,
          :aggregateId,
          :orderId,
          :reason,
          :createdAt
        )
        """;
    final MapSqlParameterSource params =
        new MapSqlParameterSource()
            .addValue("sourceEventId", sourceEventId)
            .addValue("sourceEventType", sourceEventType)
            .addValue("aggregateType", aggregateType)
            .addValue("aggregateId", aggregateId)
            .addValue("orderId", orderId)
            .addValue("reason", reason)
            .addValue("createdAt", toTimestamp(createdAt));
    return jdbcTemplate.update(sql, params);
  }

  public List<InventoryRestockRecord> findByOrderId(UUID orderId) {
    final String sql =
        """
        SELECT id, source_event_id, source_event_type, aggregate_type, aggregate_id,
               order_id, reason, created_at
        FROM inventory_restock_requests
        WHERE order_id = :orderId
        ORDER BY id
        """;
    return jdbcTemplate.query(sql, new MapSqlParameterSource("orderId", orderId), this::mapRow);
  }

  private InventoryRestockRecord mapRow(ResultSet rs, int rowNum) throws SQLException {
    return new InventoryRestockRecord(
        rs.getLong("id"),
        rs.getObject("source_event_id", UUID.class),
        rs.getString("source_event_type"),
        rs.getString("aggregate_type"),
        rs.getObject("aggregate_id", UUID.class),
        rs.getObject("order_id", UUID.class),
        rs.getString("reason"),
        getInstant(rs, "created_at"));
  }
}
