package com.example.backoffice.model.returns;

import com.example.backoffice.model.EventPayload;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import java.math.BigDecimal;
import java.util.UUID;

@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record ReturnRequestEventPayload(
    UUID orderId,
    UUID userId,
    String fromStatus,
    String toStatus,
    BigDecimal refundAmount,
    String reason,
    String trackingNumber)
    implements EventPayload {}
