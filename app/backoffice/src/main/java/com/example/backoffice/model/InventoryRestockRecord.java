package com.example.backoffice.model;

import java.time.Instant;
import java.util.UUID;

public record InventoryRestockRecord(
    long id,
    UUID sourceEventId,
    String sourceEventType,
    String aggregateType,
    UUID aggregateId,
    UUID orderId,
    String reason,
    Instant createdAt) {}
