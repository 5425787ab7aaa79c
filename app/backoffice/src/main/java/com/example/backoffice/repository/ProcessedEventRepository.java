/*
 * どこで: Backoffice データアクセス
 * 何を: handler ごとの processed_events 登録と期限切れ削除
 * なぜ: 再配送された同一イベントで副作用を重複させないため
 */
package com.example.backoffice.repository;

import static com.example.common.JdbcTimestampUtils.toTimestamp;

import java.time.Instant;
import java.util.UUID;
import lombok.RequiredArgsConstructor;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.stereotype.Repository;

@Repository
@RequiredArgsConstructor
public class ProcessedEventRepository {

  private final NamedParameterJdbcTemplate jdbcTemplate;

  /**
   * 未登録なら登録して true を返す。
   *
   * <p>handler の副作用と同じトランザクションで呼ぶため、一意制約違反で
   * トランザクションを壊さないよう ON CONFLICT で吸収する。
   */
  public boolean insertIfAbsent(UUID eventId, String handlerName, Instant processedAt) {
    final String sql =
        """
        INSERT INTO processed_events (event_id, handler_name, processed_at)
        VALUES (:eventId, :handlerName, :processedAt)
        ON CONFLICT (event_id, handler_name) DO NOTHING
        """;
    final MapSqlParameterSource params =
        new MapSqlParameterSource()
            .addValue("eventId", eventId)
            .addValue("handlerName", handlerName)
            .addValue("processedAt", toTimestamp(processedAt));
    return jdbcTemplate.update(sql, params) > 0;
  }

  public int deleteOlderThan(Instant threshold) {
    final String sql =
        """
        DELETE FROM processed_events
        WHERE processed_at < :threshold
        """;
    final MapSqlParameterSource params =
        new MapSqlParameterSource().addValue("threshold", toTimestamp(threshold));
    return jdbcTemplate.update(sql, params);
  }
}
