package com.example.backoffice.model.logistics;

import com.example.backoffice.model.EventPayload;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import java.math.BigDecimal;
import java.util.UUID;

@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record PickPackEventPayload(
    UUID orderId,
    UUID warehouseId,
    String packNumber,
    String fromStatus,
    String toStatus,
    UUID actorUserId,
    BigDecimal weight,
    Integer packageCount,
    String reason)
    implements EventPayload {}
