package com.example.backoffice.model.marketing;

import com.example.backoffice.model.EventPayload;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import java.time.Instant;

@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record EmailCampaignEventPayload(
    String name,
    String subject,
    String fromStatus,
    String toStatus,
    Instant scheduledAt,
    Integer totalRecipients,
    Integer sentCount,
    String reason)
    implements EventPayload {}
