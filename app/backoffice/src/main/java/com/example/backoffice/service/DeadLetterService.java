/*
 * どこで: Backoffice 運用操作
 * 何を: dead-letter 行の検索と手動再投入
 * なぜ: 自動では再処理しない行を運用者が確認してから戻せるようにするため
 */
package com.example.backoffice.service;

import com.example.backoffice.model.DeadLetterQuery;
import com.example.backoffice.model.OutboxMessageRecord;
import com.example.backoffice.repository.OutboxMessageRepository;
import java.time.Clock;
import java.time.Instant;
import java.util.List;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

@Service
@RequiredArgsConstructor
public class DeadLetterService {

  static final int DEFAULT_LIMIT = 100;
  static final int MAX_LIMIT = 500;

  private static final Logger logger = LoggerFactory.getLogger(DeadLetterService.class);

  private final OutboxMessageRepository outboxMessageRepository;
  private final OutboxMetrics metrics;
  private final Clock clock;

  public List<OutboxMessageRecord> find(DeadLetterQuery query) {
    if (query.from() != null && query.to() != null && !query.from().isBefore(query.to())) {
      throw new IllegalArgumentException("from must be before to");
    }
    final int limit = query.limit() <= 0 ? DEFAULT_LIMIT : Math.min(query.limit(), MAX_LIMIT);
    return outboxMessageRepository.findDeadLetters(
        new DeadLetterQuery(
            blankToNull(query.eventType()),
            query.from(),
            query.to(),
            blankToNull(query.errorContains()),
            limit));
  }

  /** retry 情報を初期化し、次回の claim から配送をやり直す。 */
  public OutboxMessageRecord replay(long id) {
    final int updated = outboxMessageRepository.resetDeadLetter(id, Instant.now(clock));
    if (updated == 0) {
      final OutboxMessageRecord existing =
          outboxMessageRepository
              .findById(id)
              .orElseThrow(() -> new OutboxMessageNotFoundException(id));
      throw new DeadLetterStateException(
          "outbox message is not dead-lettered id=" + existing.id());
    }
    logger.info("outbox dead-letter replay requested id={}", id);
    metrics.updateDeadLetterCurrent(outboxMessageRepository.countDeadLettered());
    return outboxMessageRepository
        .findById(id)
        .orElseThrow(() -> new OutboxMessageNotFoundException(id));
  }

  private static String blankToNull(String value) {
    return value == null || value.isBlank() ? null : value;
  }
}
