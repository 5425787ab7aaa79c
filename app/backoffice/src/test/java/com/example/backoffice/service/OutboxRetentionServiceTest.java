package com.example.backoffice.service;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.when;

import com.example.backoffice.config.OutboxRetentionProperties;
import com.example.backoffice.repository.OutboxMessageRepository;
import com.example.backoffice.repository.ProcessedEventRepository;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
class OutboxRetentionServiceTest {

  private static final Instant NOW = Instant.parse("2026-03-31T00:00:00Z");

  @Mock private OutboxMessageRepository outboxMessageRepository;

  @Mock private ProcessedEventRepository processedEventRepository;

  @Test
  void cleanupUsesSeparateTtlPerTable() {
    final OutboxRetentionService service =
        new OutboxRetentionService(
            outboxMessageRepository,
            processedEventRepository,
            new OutboxRetentionProperties(
                true, Duration.ofHours(1), Duration.ofDays(7), Duration.ofDays(30)),
            Clock.fixed(NOW, ZoneOffset.UTC));
    when(outboxMessageRepository.deleteProcessedOlderThan(NOW.minus(Duration.ofDays(7))))
        .thenReturn(4);
    when(processedEventRepository.deleteOlderThan(NOW.minus(Duration.ofDays(30)))).thenReturn(9);

    final OutboxRetentionService.RetentionResult result = service.cleanup();

    assertThat(result.outboxMessagesDeleted()).isEqualTo(4);
    assertThat(result.processedEventsDeleted()).isEqualTo(9);
  }
}
