/*
 * どこで: Backoffice イベント配送
 * 何を: relay から呼ばれるイベント購読者の契約
 * なぜ: 再配送 (at-least-once) 前提で handler を差し替え可能にするため
 */
package com.example.backoffice.handler;

import com.example.backoffice.model.DomainEvent;
import java.util.Set;

public interface DomainEventHandler {

  /** processed_events の重複判定キーにも使うため、一度公開したら変えないこと。 */
  String name();

  Set<String> eventTypes();

  void handle(DomainEvent event) throws Exception;
}
