/*
 * どこで: Backoffice outbox 保守
 * 何を: 処理済み outbox 行と期限切れ processed_events を削除する
 * なぜ: テーブル肥大を防ぐため。未処理/dead-letter 行は対象外
 */
package com.example.backoffice.service;

import com.example.backoffice.config.OutboxRetentionProperties;
import com.example.backoffice.repository.OutboxMessageRepository;
import com.example.backoffice.repository.ProcessedEventRepository;
import java.time.Clock;
import java.time.Instant;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

@Service
@RequiredArgsConstructor
public class OutboxRetentionService {

  private static final Logger logger = LoggerFactory.getLogger(OutboxRetentionService.class);

  private final OutboxMessageRepository outboxMessageRepository;
  private final ProcessedEventRepository processedEventRepository;
  private final OutboxRetentionProperties properties;
  private final Clock clock;

  public RetentionResult cleanup() {
    final Instant now = Instant.now(clock);
    final int outboxDeleted =
        outboxMessageRepository.deleteProcessedOlderThan(now.minus(properties.processedTtl()));
    final int processedEventsDeleted =
        processedEventRepository.deleteOlderThan(now.minus(properties.processedEventTtl()));
    if (outboxDeleted > 0 || processedEventsDeleted > 0) {
      logger.info(
          "outbox retention cleanup outboxDeleted={} processedEventsDeleted={}",
          outboxDeleted,
          processedEventsDeleted);
    }
    return new RetentionResult(outboxDeleted, processedEventsDeleted);
  }

  public record RetentionResult(int outboxMessagesDeleted, int processedEventsDeleted) {}
}
