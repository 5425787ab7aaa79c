package com.example.backoffice.model.support;

import com.example.backoffice.model.EventPayload;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import java.util.UUID;

@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record SupportTicketEventPayload(
    String ticketNumber,
    UUID userId,
    String subject,
    String fromStatus,
    String toStatus,
    UUID assignedTo,
    String note)
    implements EventPayload {}
