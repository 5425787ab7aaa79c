/*
 * どこで: Backoffice outbox ワーカー
 * 何を: スケジュールで outbox relay を起動する
 * なぜ: リクエスト処理とは独立に未配送イベントを処理するため
 */
package com.example.backoffice.service;

import lombok.RequiredArgsConstructor;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

@Component
@ConditionalOnProperty(name = "backoffice.outbox.enabled", havingValue = "true", matchIfMissing = true)
@RequiredArgsConstructor
public class OutboxRelayWorker {

  private final OutboxDispatchRelay relay;

  @Scheduled(fixedDelayString = "${backoffice.outbox.poll-interval}")
  public void run() {
    relay.dispatchPendingBatch();
  }
}
