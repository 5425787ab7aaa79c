/*
 * どこで: Backoffice outbox
 * 何を: DomainEvent のペイロードを JSON にし、outbox 行から型付きイベントに戻す
 * なぜ: 書き込み側と relay で同じ型対応表 (AggregateType) を使うため
 */
package com.example.backoffice.service;

import com.example.backoffice.model.AggregateType;
import com.example.backoffice.model.DomainEvent;
import com.example.backoffice.model.EventPayload;
import com.example.backoffice.model.OutboxMessageRecord;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

@Component
@RequiredArgsConstructor
public class DomainEventSerializer {

  private final ObjectMapper objectMapper;

  public String serializePayload(DomainEvent event) {
    try {
      return objectMapper.writeValueAsString(event.payload());
    } catch (JsonProcessingException ex) {
      throw new IllegalStateException(
          "failed to serialize event payload eventType=" + event.eventType(), ex);
    }
  }

  /** 復元できない行は {@link OutboxPayloadException} にする。 */
  public DomainEvent deserialize(OutboxMessageRecord record) {
    final AggregateType aggregateType =
        AggregateType.fromTypeName(record.aggregateType())
            .orElseThrow(
                () ->
                    new OutboxPayloadException(
                        "unknown aggregate type: " + record.aggregateType()));
    if (!aggregateType.supportsEventType(record.eventType())) {
      throw new OutboxPayloadException(
          "unknown event type: " + record.eventType() + " for " + record.aggregateType());
    }
    if (record.payloadVersion() < 1
        || record.payloadVersion() > DomainEvent.CURRENT_PAYLOAD_VERSION) {
      throw new OutboxPayloadException(
          "unsupported payload version: " + record.payloadVersion() + " for " + record.eventType());
    }
    final EventPayload payload;
    try {
      payload = objectMapper.readValue(record.payloadJson(), aggregateType.payloadClass());
    } catch (JsonProcessingException ex) {
      throw new OutboxPayloadException("outbox payload parse failure id=" + record.id(), ex);
    }
    if (payload == null) {
      throw new OutboxPayloadException("outbox payload is empty id=" + record.id());
    }
    return new DomainEvent(
        record.eventId(),
        record.aggregateId(),
        record.aggregateType(),
        record.eventType(),
        record.payloadVersion(),
        record.occurredAt(),
        payload);
  }
}
