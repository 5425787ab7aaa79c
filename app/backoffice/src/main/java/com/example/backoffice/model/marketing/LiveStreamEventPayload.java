package com.example.backoffice.model.marketing;

import com.example.backoffice.model.EventPayload;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import java.time.Instant;
import java.util.UUID;

@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record LiveStreamEventPayload(
    UUID sellerId,
    String title,
    String fromStatus,
    String toStatus,
    Instant scheduledStartAt,
    Integer peakViewerCount)
    implements EventPayload {}
