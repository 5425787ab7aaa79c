/*
 * どこで: Backoffice API
 * 何を: 保留/キャンセル/返品の理由
 */
package com.example.backoffice.api;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import jakarta.validation.constraints.NotBlank;

@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record OrderReasonRequest(@NotBlank(message = "reason is required") String reason) {}
