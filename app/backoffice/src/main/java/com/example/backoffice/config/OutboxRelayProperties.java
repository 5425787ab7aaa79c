/*
 * どこで: Backoffice アプリの設定バインド
 * 何を: outbox relay のポーリング/並列度/リトライ/lease 設定を保持する
 * なぜ: 運用パラメータを外部化するため
 */
package com.example.backoffice.config;

import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotNull;
import java.time.Duration;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

@Validated
@ConfigurationProperties(prefix = "backoffice.outbox")
public record OutboxRelayProperties(
    boolean enabled,
    @NotNull Duration pollInterval,
    @Min(1) int batchSize,
    @Min(1) int concurrency,
    @Min(1) int maxAttempts,
    @NotNull Duration backoffBase,
    @NotNull Duration backoffMax,
    double backoffExponentBase,
    double backoffJitterMin,
    double backoffJitterMax,
    @NotNull Duration backoffMin,
    @Min(1) int errorMessageMaxLength,
    @NotNull Duration lease,
    @NotNull Duration shutdownTimeout) {}
