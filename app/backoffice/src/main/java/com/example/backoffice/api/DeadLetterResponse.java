/*
 * どこで: Backoffice 運用 API
 * 何を: dead-letter 行の表示用レスポンス
 */
package com.example.backoffice.api;

import com.example.backoffice.model.OutboxMessageRecord;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import java.time.Instant;
import java.util.UUID;

@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record DeadLetterResponse(
    long id,
    UUID eventId,
    UUID aggregateId,
    String aggregateType,
    String eventType,
    Instant occurredAt,
    int retryCount,
    String lastError,
    Instant availableAt,
    Instant deadLetteredAt) {

  static DeadLetterResponse from(OutboxMessageRecord record) {
    return new DeadLetterResponse(
        record.id(),
        record.eventId(),
        record.aggregateId(),
        record.aggregateType(),
        record.eventType(),
        record.occurredAt(),
        record.retryCount(),
        record.lastError(),
        record.availableAt(),
        record.deadLetteredAt());
  }
}
