/*
 * どこで: OutboxMessageRepository の統合テスト
 * 何を: claim の lease/集約内順序/SKIP LOCKED と結果更新の claimed_by 条件を検証する
 * なぜ: 複数 relay が同時に動いても同じ行を二重に処理しないことを保証するため
 */
package com.example.backoffice.repository;

import static com.example.common.JdbcTimestampUtils.toTimestamp;
import static org.assertj.core.api.Assertions.assertThat;

import com.example.backoffice.AbstractPostgresContainerTest;
import com.example.backoffice.model.DeadLetterQuery;
import com.example.backoffice.model.OutboxMessageRecord;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.stream.Collectors;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.test.context.ActiveProfiles;

@SpringBootTest
@ActiveProfiles("test")
class OutboxMessageRepositoryTest extends AbstractPostgresContainerTest {

  private static final Instant BASE_TIME = Instant.parse("2026-03-01T00:00:00Z");
  private static final String AGGREGATE_TYPE = "Order";

  @Autowired private OutboxMessageRepository outboxMessageRepository;

  @Autowired private NamedParameterJdbcTemplate jdbcTemplate;

  @BeforeEach
  void cleanup() {
    jdbcTemplate.update("DELETE FROM outbox_messages", new MapSqlParameterSource());
  }

  @Test
  void claimBatchSkipsFutureAndActiveLeaseAndTakesExpiredLease() {
    final Instant now = BASE_TIME;
    final long ready = insert(UUID.randomUUID(), now.minusSeconds(10));
    final long future = insert(UUID.randomUUID(), now.plusSeconds(60));
    final long activeLease = insert(UUID.randomUUID(), now.minusSeconds(10));
    final long expiredLease = insert(UUID.randomUUID(), now.minusSeconds(10));
    setClaim(activeLease, "worker-other", now.plusSeconds(600));
    setClaim(expiredLease, "worker-old", now.minusSeconds(1));

    final List<OutboxMessageRecord> claimed =
        outboxMessageRepository.claimBatch(10, now, now.plusSeconds(30), "worker-1");

    assertThat(claimed).extracting(OutboxMessageRecord::id).containsExactly(ready, expiredLease);
    assertThat(claimed).allSatisfy(record -> assertThat(record.claimedBy()).isEqualTo("worker-1"));
    assertThat(fetch(future).claimedBy()).isNull();
    assertThat(fetch(activeLease).claimedBy()).isEqualTo("worker-other");
    assertThat(fetch(expiredLease).claimedUntil()).isEqualTo(now.plusSeconds(30));
  }

  @Test
  void claimBatchReturnsOnlyHeadOfEachAggregate() {
    final UUID aggregateA = UUID.randomUUID();
    final UUID aggregateB = UUID.randomUUID();
    final long a1 = insert(aggregateA, BASE_TIME.minusSeconds(5));
    insert(aggregateA, BASE_TIME.minusSeconds(5));
    final long b1 = insert(aggregateB, BASE_TIME.minusSeconds(5));

    final List<OutboxMessageRecord> claimed =
        outboxMessageRepository.claimBatch(10, BASE_TIME, BASE_TIME.plusSeconds(30), "worker-1");

    assertThat(claimed).extracting(OutboxMessageRecord::id).containsExactly(a1, b1);
  }

  @Test
  void laterRowOfAggregateWaitsWhileEarlierRowIsBackingOff() {
    final UUID aggregateId = UUID.randomUUID();
    final long first = insert(aggregateId, BASE_TIME.plusSeconds(60));
    final long second = insert(aggregateId, BASE_TIME.minusSeconds(60));

    assertThat(
            outboxMessageRepository.claimBatch(
                10, BASE_TIME, BASE_TIME.plusSeconds(30), "worker-1"))
        .isEmpty();

    final Instant later = BASE_TIME.plusSeconds(61);
    final List<OutboxMessageRecord> claimed =
        outboxMessageRepository.claimBatch(10, later, later.plusSeconds(30), "worker-1");
    assertThat(claimed).extracting(OutboxMessageRecord::id).containsExactly(first);
    assertThat(outboxMessageRepository.markProcessed(first, "worker-1", later)).isEqualTo(1);

    final List<OutboxMessageRecord> next =
        outboxMessageRepository.claimBatch(10, later, later.plusSeconds(30), "worker-1");
    assertThat(next).extracting(OutboxMessageRecord::id).containsExactly(second);
  }

  @Test
  void deadLetteredRowBlocksLaterRowsOfSameAggregate() {
    final UUID aggregateId = UUID.randomUUID();
    final long first = insert(aggregateId, BASE_TIME.minusSeconds(10));
    insert(aggregateId, BASE_TIME.minusSeconds(10));
    outboxMessageRepository.claimBatch(10, BASE_TIME, BASE_TIME.plusSeconds(30), "worker-1");
    outboxMessageRepository.markDeadLettered(first, "worker-1", 5, "boom", BASE_TIME);

    assertThat(
            outboxMessageRepository.claimBatch(
                10, BASE_TIME, BASE_TIME.plusSeconds(30), "worker-1"))
        .isEmpty();
  }

  @Test
  void resultUpdatesRequireCurrentLeaseHolder() {
    final long id = insert(UUID.randomUUID(), BASE_TIME.minusSeconds(10));
    outboxMessageRepository.claimBatch(10, BASE_TIME, BASE_TIME.plusSeconds(30), "worker-1");

    assertThat(outboxMessageRepository.markProcessed(id, "worker-2", BASE_TIME)).isZero();
    assertThat(
            outboxMessageRepository.markRetry(
                id, "worker-2", 1, BASE_TIME.plusSeconds(2), "err"))
        .isZero();
    assertThat(fetch(id).processedAt()).isNull();

    assertThat(
            outboxMessageRepository.markRetry(
                id, "worker-1", 1, BASE_TIME.plusSeconds(2), "err"))
        .isEqualTo(1);
    final OutboxMessageRecord retried = fetch(id);
    assertThat(retried.retryCount()).isEqualTo(1);
    assertThat(retried.availableAt()).isEqualTo(BASE_TIME.plusSeconds(2));
    assertThat(retried.lastError()).isEqualTo("err");
    assertThat(retried.claimedBy()).isNull();
    assertThat(retried.claimedUntil()).isNull();
  }

  @Test
  void concurrentClaimsReturnDisjointRows() throws Exception {
    for (int i = 0; i < 40; i++) {
      insert(UUID.randomUUID(), BASE_TIME.minusSeconds(10));
    }
    final int workers = 4;
    final CountDownLatch ready = new CountDownLatch(workers);
    final CountDownLatch start = new CountDownLatch(1);
    final ExecutorService executor = Executors.newFixedThreadPool(workers);
    try {
      final List<Future<List<OutboxMessageRecord>>> futures = new ArrayList<>();
      for (int i = 0; i < workers; i++) {
        final String workerId = "worker-" + i;
        futures.add(
            executor.submit(
                () -> {
                  ready.countDown();
                  start.await(5, TimeUnit.SECONDS);
                  return outboxMessageRepository.claimBatch(
                      15, BASE_TIME, BASE_TIME.plusSeconds(30), workerId);
                }));
      }
      ready.await(5, TimeUnit.SECONDS);
      start.countDown();

      final List<Long> claimedIds = new ArrayList<>();
      for (Future<List<OutboxMessageRecord>> future : futures) {
        future.get(30, TimeUnit.SECONDS).forEach(record -> claimedIds.add(record.id()));
      }
      final Set<Long> unique = claimedIds.stream().collect(Collectors.toSet());
      assertThat(unique).hasSameSizeAs(claimedIds);
      assertThat(claimedIds).hasSizeLessThanOrEqualTo(40);
    } finally {
      executor.shutdownNow();
    }
  }

  @Test
  void releaseClaimsClearsOnlyOwnLeases() {
    final long own = insert(UUID.randomUUID(), BASE_TIME.minusSeconds(10));
    final long other = insert(UUID.randomUUID(), BASE_TIME.minusSeconds(10));
    setClaim(own, "worker-1", BASE_TIME.plusSeconds(30));
    setClaim(other, "worker-2", BASE_TIME.plusSeconds(30));

    final int released = outboxMessageRepository.releaseClaims("worker-1");

    assertThat(released).isEqualTo(1);
    assertThat(fetch(own).claimedBy()).isNull();
    assertThat(fetch(other).claimedBy()).isEqualTo("worker-2");
  }

  @Test
  void releaseClaimsByIdKeepsAttemptBookkeeping() {
    final long interrupted = insert(UUID.randomUUID(), BASE_TIME.minusSeconds(10));
    final long running = insert(UUID.randomUUID(), BASE_TIME.minusSeconds(10));
    final long foreign = insert(UUID.randomUUID(), BASE_TIME.minusSeconds(10));
    setClaim(interrupted, "worker-1", BASE_TIME.plusSeconds(30));
    setClaim(running, "worker-1", BASE_TIME.plusSeconds(30));
    setClaim(foreign, "worker-2", BASE_TIME.plusSeconds(30));
    final OutboxMessageRecord before = fetch(interrupted);

    final int released =
        outboxMessageRepository.releaseClaims("worker-1", List.of(interrupted, foreign));

    assertThat(released).isEqualTo(1);
    final OutboxMessageRecord after = fetch(interrupted);
    assertThat(after.claimedBy()).isNull();
    assertThat(after.claimedUntil()).isNull();
    assertThat(after.retryCount()).isEqualTo(before.retryCount());
    assertThat(after.availableAt()).isEqualTo(before.availableAt());
    assertThat(fetch(running).claimedBy()).isEqualTo("worker-1");
    assertThat(fetch(foreign).claimedBy()).isEqualTo("worker-2");
    assertThat(outboxMessageRepository.releaseClaims("worker-1", List.of())).isZero();
  }

  @Test
  void findDeadLettersFiltersByTypeAndErrorText() {
    final long timeout = insert(UUID.randomUUID(), BASE_TIME.minusSeconds(10));
    final long parse = insert(UUID.randomUUID(), BASE_TIME.minusSeconds(10));
    outboxMessageRepository.claimBatch(10, BASE_TIME, BASE_TIME.plusSeconds(30), "worker-1");
    outboxMessageRepository.markDeadLettered(
        timeout, "worker-1", 5, "IllegalStateException: SMTP timeout", BASE_TIME);
    outboxMessageRepository.markDeadLettered(
        parse, "worker-1", 1, "OutboxPayloadException: parse 100% failed", BASE_TIME);

    assertThat(
            outboxMessageRepository.findDeadLetters(
                new DeadLetterQuery("OrderConfirmed", null, null, "smtp", 10)))
        .extracting(OutboxMessageRecord::id)
        .containsExactly(timeout);
    assertThat(
            outboxMessageRepository.findDeadLetters(
                new DeadLetterQuery(null, null, null, "100%", 10)))
        .extracting(OutboxMessageRecord::id)
        .containsExactly(parse);
    assertThat(
            outboxMessageRepository.findDeadLetters(
                new DeadLetterQuery(null, BASE_TIME.plusSeconds(1), null, null, 10)))
        .isEmpty();
    assertThat(outboxMessageRepository.countDeadLettered()).isEqualTo(2);
  }

  @Test
  void resetDeadLetterMakesRowClaimableAgain() {
    final long id = insert(UUID.randomUUID(), BASE_TIME.minusSeconds(10));
    outboxMessageRepository.claimBatch(10, BASE_TIME, BASE_TIME.plusSeconds(30), "worker-1");
    outboxMessageRepository.markDeadLettered(id, "worker-1", 5, "boom", BASE_TIME);

    assertThat(outboxMessageRepository.resetDeadLetter(id, BASE_TIME.plusSeconds(5))).isEqualTo(1);
    assertThat(outboxMessageRepository.resetDeadLetter(id, BASE_TIME.plusSeconds(5))).isZero();

    final OutboxMessageRecord reset = fetch(id);
    assertThat(reset.isDeadLettered()).isFalse();
    assertThat(reset.retryCount()).isZero();
    assertThat(reset.lastError()).isNull();
    final Instant later = BASE_TIME.plusSeconds(5);
    assertThat(outboxMessageRepository.claimBatch(10, later, later.plusSeconds(30), "worker-1"))
        .extracting(OutboxMessageRecord::id)
        .containsExactly(id);
  }

  @Test
  void deleteProcessedOlderThanKeepsPendingAndDeadLettered() {
    final long oldProcessed = insert(UUID.randomUUID(), BASE_TIME.minusSeconds(10));
    final long newProcessed = insert(UUID.randomUUID(), BASE_TIME.minusSeconds(10));
    final long pending = insert(UUID.randomUUID(), BASE_TIME.plusSeconds(600));
    final long deadLettered = insert(UUID.randomUUID(), BASE_TIME.minusSeconds(10));
    outboxMessageRepository.claimBatch(10, BASE_TIME, BASE_TIME.plusSeconds(30), "worker-1");
    outboxMessageRepository.markProcessed(oldProcessed, "worker-1", BASE_TIME.minusSeconds(3600));
    outboxMessageRepository.markProcessed(newProcessed, "worker-1", BASE_TIME);
    outboxMessageRepository.markDeadLettered(
        deadLettered, "worker-1", 5, "boom", BASE_TIME.minusSeconds(3600));

    final int deleted = outboxMessageRepository.deleteProcessedOlderThan(BASE_TIME.minusSeconds(60));

    assertThat(deleted).isEqualTo(1);
    assertThat(outboxMessageRepository.findById(oldProcessed)).isEmpty();
    assertThat(outboxMessageRepository.findById(newProcessed)).isPresent();
    assertThat(outboxMessageRepository.findById(pending)).isPresent();
    assertThat(outboxMessageRepository.findById(deadLettered)).isPresent();
  }

  private long insert(UUID aggregateId, Instant availableAt) {
    final UUID eventId = UUID.randomUUID();
    outboxMessageRepository.insert(
        eventId,
        aggregateId,
        AGGREGATE_TYPE,
        "OrderConfirmed",
        1,
        "{}",
        BASE_TIME.minusSeconds(30),
        BASE_TIME.minusSeconds(30));
    // 初回配送可能時刻だけ個別に上書きする
    jdbcTemplate.update(
        "UPDATE outbox_messages SET available_at = :availableAt WHERE event_id = :eventId",
        new MapSqlParameterSource()
            .addValue("availableAt", toTimestamp(availableAt))
            .addValue("eventId", eventId));
    final Long id =
        jdbcTemplate.queryForObject(
            "SELECT id FROM outbox_messages WHERE event_id = :eventId",
            new MapSqlParameterSource("eventId", eventId),
            Long.class);
    return id == null ? -1L : id;
  }

  private void setClaim(long id, String claimedBy, Instant claimedUntil) {
    jdbcTemplate.update(
        "UPDATE outbox_messages SET claimed_by = :claimedBy, claimed_until = :claimedUntil"
            + " WHERE id = :id",
        new MapSqlParameterSource()
            .addValue("claimedBy", claimedBy)
            .addValue("claimedUntil", toTimestamp(claimedUntil))
            .addValue("id", id));
  }

  private OutboxMessageRecord fetch(long id) {
    final Optional<OutboxMessageRecord> record = outboxMessageRepository.findById(id);
    assertThat(record).isPresent();
    return record.get();
  }
}
