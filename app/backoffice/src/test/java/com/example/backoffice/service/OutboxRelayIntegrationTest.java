/*
 * どこで: outbox relay の統合テスト
 * 何を: 失敗時の retry/backoff、dead-letter と再投入、再配送時の冪等性、lease による排他を検証する
 * なぜ: handler 失敗やクラッシュがあっても集約内の順序を保って一度だけ反映されることを保証するため
 */
package com.example.backoffice.service;

import static com.example.common.JdbcTimestampUtils.toTimestamp;
import static org.assertj.core.api.Assertions.assertThat;

import com.example.backoffice.AbstractPostgresContainerTest;
import com.example.backoffice.model.OutboxMessageRecord;
import com.example.backoffice.model.order.Order;
import com.example.backoffice.repository.InventoryRestockRepository;
import com.example.backoffice.repository.OutboxMessageRepository;
import java.math.BigDecimal;
import java.time.Instant;
import java.util.List;
import java.util.UUID;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.test.context.ActiveProfiles;

@SpringBootTest(
    properties = {
      "backoffice.email.failure-injection.enabled=true",
      "backoffice.email.failure-injection.recipient-prefix=fail-",
      "backoffice.email.failure-injection.failures-per-message=1"
    })
@ActiveProfiles("test")
class OutboxRelayIntegrationTest extends AbstractPostgresContainerTest {

  @Autowired private OrderCommandService orderCommandService;

  @Autowired private OutboxDispatchRelay relay;

  @Autowired private DeadLetterService deadLetterService;

  @Autowired private OutboxMessageRepository outboxMessageRepository;

  @Autowired private InventoryRestockRepository inventoryRestockRepository;

  @Autowired private NamedParameterJdbcTemplate jdbcTemplate;

  @BeforeEach
  void cleanup() {
    final MapSqlParameterSource none = new MapSqlParameterSource();
    jdbcTemplate.update("DELETE FROM outbox_messages", none);
    jdbcTemplate.update("DELETE FROM processed_events", none);
    jdbcTemplate.update("DELETE FROM inventory_restock_requests", none);
    jdbcTemplate.update("DELETE FROM aggregate_snapshots", none);
  }

  @Test
  void failedDispatchIsRetriedAfterBackoffAndBlocksLaterEvents() {
    final Order order = createOrder("fail-buyer@example.com");
    orderCommandService.confirm(order.id(), "pay-1");

    assertThat(relay.dispatchPendingBatch()).isEqualTo(1);
    final Instant beforeFailure = Instant.now();
    assertThat(relay.dispatchPendingBatch()).isEqualTo(1);
    final Instant afterFailure = Instant.now();

    final OutboxMessageRecord confirmed = row(order.id(), Order.ORDER_CONFIRMED);
    assertThat(confirmed.isProcessed()).isFalse();
    assertThat(confirmed.retryCount()).isEqualTo(1);
    assertThat(confirmed.claimedBy()).isNull();
    assertThat(confirmed.lastError())
        .startsWith("IllegalStateException: email delivery failure injection");
    assertThat(confirmed.availableAt())
        .isBetween(
            beforeFailure.plusSeconds(2).minusMillis(1), afterFailure.plusSeconds(2).plusMillis(1));

    // backoff 中の行も後続イベントの配送を止める
    assertThat(relay.dispatchPendingBatch()).isZero();
    assertThat(row(order.id(), Order.ORDER_PAYMENT_STATUS_CHANGED).isProcessed()).isFalse();

    makeAvailableNow(confirmed.id());
    drain();

    final List<OutboxMessageRecord> rows = rows(order.id());
    assertThat(rows).allSatisfy(row -> assertThat(row.isProcessed()).isTrue());
    assertThat(rows)
        .extracting(OutboxMessageRecord::processedAt)
        .isSortedAccordingTo(Instant::compareTo);
    assertThat(processedHandlers(confirmed.eventId())).isEqualTo(2);
  }

  @Test
  void undecodableRowIsDeadLetteredAndDeliveredAfterReplay() {
    final Order order = createOrder("buyer@example.com");
    final OutboxMessageRecord created = row(order.id(), Order.ORDER_CREATED);
    setPayloadVersion(created.id(), 99);
    orderCommandService.confirm(order.id(), "pay-1");

    drain();

    final OutboxMessageRecord deadLettered = row(order.id(), Order.ORDER_CREATED);
    assertThat(deadLettered.isDeadLettered()).isTrue();
    assertThat(deadLettered.retryCount()).isEqualTo(1);
    assertThat(deadLettered.lastError()).contains("unsupported payload version: 99");
    assertThat(row(order.id(), Order.ORDER_CONFIRMED).isProcessed()).isFalse();

    setPayloadVersion(created.id(), 1);
    final OutboxMessageRecord replayed = deadLetterService.replay(created.id());
    assertThat(replayed.isDeadLettered()).isFalse();
    assertThat(replayed.retryCount()).isZero();
    assertThat(replayed.lastError()).isNull();

    drain();

    assertThat(rows(order.id())).allSatisfy(row -> assertThat(row.isProcessed()).isTrue());
  }

  @Test
  void redeliveredEventDoesNotRepeatSideEffects() {
    final Order order = createOrder("buyer@example.com");
    orderCommandService.cancel(order.id(), "out of stock");
    drain();
    final OutboxMessageRecord cancelled = row(order.id(), Order.ORDER_CANCELLED);
    assertThat(cancelled.isProcessed()).isTrue();
    assertThat(inventoryRestockRepository.findByOrderId(order.id())).hasSize(1);

    // handler 実行後、処理済み記録前にクラッシュした状態を再現する
    markUnprocessed(cancelled.id());
    drain();

    assertThat(row(order.id(), Order.ORDER_CANCELLED).isProcessed()).isTrue();
    assertThat(inventoryRestockRepository.findByOrderId(order.id()))
        .singleElement()
        .satisfies(
            restock -> {
              assertThat(restock.sourceEventId()).isEqualTo(cancelled.eventId());
              assertThat(restock.reason()).isEqualTo("out of stock");
            });
    assertThat(processedHandlers(cancelled.eventId())).isEqualTo(3);
  }

  @Test
  void rowLeasedByAnotherWorkerIsSkippedUntilLeaseExpires() {
    final Order order = createOrder("buyer@example.com");
    final OutboxMessageRecord created = row(order.id(), Order.ORDER_CREATED);
    setClaim(created.id(), "other-worker", Instant.now().plusSeconds(60));

    assertThat(relay.dispatchPendingBatch()).isZero();

    setClaim(created.id(), "other-worker", Instant.now().minusSeconds(1));

    assertThat(relay.dispatchPendingBatch()).isEqualTo(1);
    assertThat(row(order.id(), Order.ORDER_CREATED).isProcessed()).isTrue();
  }

  private Order createOrder(String customerEmail) {
    return orderCommandService.create(
        "ORD-" + UUID.randomUUID(), UUID.randomUUID(), customerEmail, new BigDecimal("19.99"));
  }

  private void drain() {
    for (int i = 0; i < 10; i++) {
      if (relay.dispatchPendingBatch() == 0) {
        return;
      }
    }
  }

  private List<OutboxMessageRecord> rows(UUID orderId) {
    return outboxMessageRepository.findByAggregate("Order", orderId);
  }

  private OutboxMessageRecord row(UUID orderId, String eventType) {
    return rows(orderId).stream()
        .filter(row -> row.eventType().equals(eventType))
        .findFirst()
        .orElseThrow();
  }

  private int processedHandlers(UUID eventId) {
    final Integer count =
        jdbcTemplate.queryForObject(
            "SELECT COUNT(*) FROM processed_events WHERE event_id = :eventId",
            new MapSqlParameterSource("eventId", eventId),
            Integer.class);
    return count == null ? 0 : count;
  }

  private void makeAvailableNow(long id) {
    jdbcTemplate.update(
        "UPDATE outbox_messages SET available_at = :availableAt WHERE id = :id",
        new MapSqlParameterSource()
            .addValue("id", id)
            .addValue("availableAt", toTimestamp(Instant.now().minusSeconds(1))));
  }

  private void setPayloadVersion(long id, int payloadVersion) {
    jdbcTemplate.update(
        "UPDATE outbox_messages SET payload_version = :payloadVersion WHERE id = :id",
        new MapSqlParameterSource().addValue("id", id).addValue("payloadVersion", payloadVersion));
  }

  private void markUnprocessed(long id) {
    jdbcTemplate.update(
        "UPDATE outbox_messages SET processed_at = NULL WHERE id = :id",
        new MapSqlParameterSource("id", id));
  }

  private void setClaim(long id, String claimedBy, Instant claimedUntil) {
    jdbcTemplate.update(
        """
        UPDATE outbox_messages
        SET claimed_by = :claimedBy, claimed_until = :claimedUntil
        WHERE id = :id
        """,
        new MapSqlParameterSource()
            .addValue("id", id)
            .addValue("claimedBy", claimedBy)
            .addValue("claimedUntil", toTimestamp(claimedUntil)));
  }
}
