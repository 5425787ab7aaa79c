/*
 * どこで: Backoffice アプリの設定バインド
 * 何を: 処理済み outbox 行と processed_events の保持期間を保持する
 * なぜ: 削除間隔と保持期間を運用で調整できるようにするため
 */
package com.example.backoffice.config;

import java.time.Duration;
import org.springframework.boot.context.properties.ConfigurationProperties;

@ConfigurationProperties(prefix = "backoffice.retention")
public record OutboxRetentionProperties(
    boolean enabled, Duration cleanupInterval, Duration processedTtl, Duration processedEventTtl) {}
