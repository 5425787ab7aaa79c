/*
 * どこで: Backoffice API
 * 何を: 注文コマンドの結果を表す
 */
package com.example.backoffice.api;

import com.example.backoffice.model.order.Order;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import java.math.BigDecimal;
import java.time.Instant;
import java.util.UUID;

@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record OrderResponse(
    UUID orderId,
    String orderNumber,
    UUID userId,
    String status,
    String paymentStatus,
    BigDecimal totalAmount,
    String trackingNumber,
    boolean deleted,
    long version,
    Instant updatedAt) {

  static OrderResponse from(Order order) {
    return new OrderResponse(
        order.id(),
        order.orderNumber(),
        order.userId(),
        order.status().name(),
        order.paymentStatus().name(),
        order.totalAmount(),
        order.trackingNumber(),
        order.isDeleted(),
        order.version(),
        order.updatedAt());
  }
}
