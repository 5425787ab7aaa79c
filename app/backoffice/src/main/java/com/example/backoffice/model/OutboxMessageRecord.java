/*
 * どこで: Backoffice outbox
 * 何を: outbox_messages の 1 行
 */
package com.example.backoffice.model;

import java.time.Instant;
import java.util.UUID;

public record OutboxMessageRecord(
    long id,
    UUID eventId,
    UUID aggregateId,
    String aggregateType,
    String eventType,
    int payloadVersion,
    String payloadJson,
    Instant occurredAt,
    Instant processedAt,
    int retryCount,
    String lastError,
    String claimedBy,
    Instant claimedUntil,
    Instant availableAt,
    Instant deadLetteredAt,
    Instant createdAt) {

  public boolean isDeadLettered() {
    return deadLetteredAt != null;
  }

  public boolean isProcessed() {
    return processedAt != null;
  }
}
