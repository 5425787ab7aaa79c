package com.example.backoffice.model.subscription;

import com.example.backoffice.model.EventPayload;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import java.time.Instant;
import java.util.UUID;

@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record SubscriptionEventPayload(
    UUID userId,
    UUID planId,
    String fromStatus,
    String toStatus,
    Instant endDate,
    Integer renewalCount,
    String reason)
    implements EventPayload {}
