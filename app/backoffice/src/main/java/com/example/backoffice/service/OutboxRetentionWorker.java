/*
 * どこで: Backoffice outbox 保守ワーカー
 * 何を: retention cleanup を定期実行する
 */
package com.example.backoffice.service;

import lombok.RequiredArgsConstructor;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

@Component
@ConditionalOnProperty(name = "backoffice.retention.enabled", havingValue = "true", matchIfMissing = true)
@RequiredArgsConstructor
public class OutboxRetentionWorker {

  private final OutboxRetentionService retentionService;

  @Scheduled(fixedDelayString = "${backoffice.retention.cleanup-interval}")
  public void run() {
    retentionService.cleanup();
  }
}
