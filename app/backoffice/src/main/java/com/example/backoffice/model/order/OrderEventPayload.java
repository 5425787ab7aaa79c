/*
 * どこで: Order 集約のイベント
 * 何を: Order 系イベント共通のペイロード
 * なぜ: outbox に JSON で保存し handler 側で型付きで読むため
 */
package com.example.backoffice.model.order;

import com.example.backoffice.model.EventPayload;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import java.math.BigDecimal;
import java.util.UUID;

@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record OrderEventPayload(
    String orderNumber,
    UUID userId,
    String customerEmail,
    BigDecimal totalAmount,
    String fromStatus,
    String toStatus,
    String fromPaymentStatus,
    String toPaymentStatus,
    String paymentReference,
    String trackingNumber,
    String reason)
    implements EventPayload {}
