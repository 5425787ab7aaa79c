/*
 * どこで: Backoffice API
 * 何を: 注文作成リクエスト
 */
package com.example.backoffice.api;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import jakarta.validation.constraints.Email;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import java.math.BigDecimal;
import java.util.UUID;

@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record CreateOrderRequest(
    @NotBlank(message = "order_number is required") String orderNumber,
    @NotNull(message = "user_id is required") UUID userId,
    @NotBlank(message = "customer_email is required")
        @Email(message = "customer_email is invalid")
        String customerEmail,
    @NotNull(message = "total_amount is required")
        @Positive(message = "total_amount must be positive")
        BigDecimal totalAmount) {}
