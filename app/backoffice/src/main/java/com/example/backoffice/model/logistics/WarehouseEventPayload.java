package com.example.backoffice.model.logistics;

import com.example.backoffice.model.EventPayload;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;

@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record WarehouseEventPayload(
    String code, String name, String city, Integer capacity, String fromStatus, String toStatus)
    implements EventPayload {}
