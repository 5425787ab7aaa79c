/*
 * どこで: Backoffice イベント配送
 * 何を: イベント種別ごとの handler 一覧を登録順で返す
 */
package com.example.backoffice.handler;

import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import org.springframework.stereotype.Component;

@Component
public class DomainEventHandlerRegistry {

  private final List<DomainEventHandler> handlers;
  private final Map<String, List<DomainEventHandler>> byEventType = new ConcurrentHashMap<>();

  // Spring は @Order の順で List を渡す
  public DomainEventHandlerRegistry(List<DomainEventHandler> handlers) {
    final Set<String> names = new HashSet<>();
    for (DomainEventHandler handler : handlers) {
      if (!names.add(handler.name())) {
        throw new IllegalStateException("duplicate event handler name: " + handler.name());
      }
    }
    this.handlers = List.copyOf(handlers);
  }

  public List<DomainEventHandler> handlersFor(String eventType) {
    return byEventType.computeIfAbsent(
        eventType,
        type -> handlers.stream().filter(handler -> handler.eventTypes().contains(type)).toList());
  }
}
