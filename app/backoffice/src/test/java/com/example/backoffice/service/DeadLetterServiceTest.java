package com.example.backoffice.service;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.example.backoffice.model.DeadLetterQuery;
import com.example.backoffice.model.OutboxMessageRecord;
import com.example.backoffice.repository.OutboxMessageRepository;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
class DeadLetterServiceTest {

  private static final Instant NOW = Instant.parse("2026-03-01T10:00:00Z");

  @Mock private OutboxMessageRepository outboxMessageRepository;

  private SimpleMeterRegistry meterRegistry;
  private DeadLetterService service;

  @BeforeEach
  void setUp() {
    meterRegistry = new SimpleMeterRegistry();
    service =
        new DeadLetterService(
            outboxMessageRepository,
            new OutboxMetrics(meterRegistry),
            Clock.fixed(NOW, ZoneOffset.UTC));
  }

  @Test
  void findNormalizesBlankFiltersAndDefaultLimit() {
    when(outboxMessageRepository.findDeadLetters(any(DeadLetterQuery.class)))
        .thenReturn(List.of());

    service.find(new DeadLetterQuery(" ", null, null, "", 0));

    verify(outboxMessageRepository)
        .findDeadLetters(
            new DeadLetterQuery(null, null, null, null, DeadLetterService.DEFAULT_LIMIT));
  }

  @Test
  void findCapsLimit() {
    when(outboxMessageRepository.findDeadLetters(any(DeadLetterQuery.class)))
        .thenReturn(List.of());

    service.find(new DeadLetterQuery("OrderConfirmed", null, null, "smtp", 10_000));

    verify(outboxMessageRepository)
        .findDeadLetters(
            new DeadLetterQuery(
                "OrderConfirmed", null, null, "smtp", DeadLetterService.MAX_LIMIT));
  }

  @Test
  void findRejectsEmptyRange() {
    assertThatThrownBy(() -> service.find(new DeadLetterQuery(null, NOW, NOW, null, 10)))
        .isInstanceOf(IllegalArgumentException.class)
        .hasMessage("from must be before to");
    verify(outboxMessageRepository, never()).findDeadLetters(any(DeadLetterQuery.class));
  }

  @Test
  void replayResetsRowAndRefreshesGauge() {
    final OutboxMessageRecord reset = record(5L, null);
    when(outboxMessageRepository.resetDeadLetter(5L, NOW)).thenReturn(1);
    when(outboxMessageRepository.countDeadLettered()).thenReturn(2);
    when(outboxMessageRepository.findById(5L)).thenReturn(Optional.of(reset));

    assertThat(service.replay(5L)).isEqualTo(reset);
    assertThat(meterRegistry.get(OutboxMetrics.METRIC_DEAD_LETTER_CURRENT).gauge().value())
        .isEqualTo(2.0);
  }

  @Test
  void replayOfLiveRowIsRejected() {
    when(outboxMessageRepository.resetDeadLetter(6L, NOW)).thenReturn(0);
    when(outboxMessageRepository.findById(6L)).thenReturn(Optional.of(record(6L, null)));

    assertThatThrownBy(() -> service.replay(6L))
        .isInstanceOf(DeadLetterStateException.class)
        .hasMessageContaining("not dead-lettered");
  }

  @Test
  void replayOfUnknownRowIsNotFound() {
    when(outboxMessageRepository.resetDeadLetter(7L, NOW)).thenReturn(0);
    when(outboxMessageRepository.findById(7L)).thenReturn(Optional.empty());

    assertThatThrownBy(() -> service.replay(7L))
        .isInstanceOf(OutboxMessageNotFoundException.class);
  }

  private OutboxMessageRecord record(long id, Instant deadLetteredAt) {
    return new OutboxMessageRecord(
        id,
        UUID.randomUUID(),
        UUID.randomUUID(),
        "Order",
        "OrderConfirmed",
        1,
        "{}",
        NOW.minusSeconds(60),
        null,
        0,
        null,
        null,
        null,
        NOW,
        deadLetteredAt,
        NOW.minusSeconds(60));
  }
}
