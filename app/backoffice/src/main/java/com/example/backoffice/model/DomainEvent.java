/*
 * どこで: Backoffice ドメイン層
 * 何を: 集約の状態変化を表す不変イベント
 * なぜ: outbox に保存し relay から型付きで handler に渡すため
 */
package com.example.backoffice.model;

import java.time.Instant;
import java.util.Objects;
import java.util.UUID;

public record DomainEvent(
    UUID eventId,
    UUID aggregateId,
    String aggregateType,
    String eventType,
    int payloadVersion,
    Instant occurredAt,
    EventPayload payload) {

  public static final int CURRENT_PAYLOAD_VERSION = 1;

  public DomainEvent {
    Objects.requireNonNull(eventId, "eventId");
    Objects.requireNonNull(aggregateId, "aggregateId");
    Objects.requireNonNull(aggregateType, "aggregateType");
    Objects.requireNonNull(eventType, "eventType");
    Objects.requireNonNull(occurredAt, "occurredAt");
    Objects.requireNonNull(payload, "payload");
  }

  public <P extends EventPayload> P payloadAs(Class<P> type) {
    if (!type.isInstance(payload)) {
      throw new IllegalStateException(
          "payload type mismatch eventType=" + eventType + " expected=" + type.getSimpleName());
    }
    return type.cast(payload);
  }

  // 同一性は eventId のみで判定する
  @Override
  public boolean equals(Object other) {
    if (this == other) {
      return true;
    }
    if (!(other instanceof DomainEvent that)) {
      return false;
    }
    return eventId.equals(that.eventId);
  }

  @Override
  public int hashCode() {
    return eventId.hashCode();
  }
}
