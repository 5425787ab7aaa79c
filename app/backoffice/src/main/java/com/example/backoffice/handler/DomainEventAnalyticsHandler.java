/*
 * どこで: Backoffice イベント購読者
 * 何を: 全ドメインイベントを種別ごとに数える
 */
package com.example.backoffice.handler;

import com.example.backoffice.model.AggregateType;
import com.example.backoffice.model.DomainEvent;
import com.example.backoffice.repository.ProcessedEventRepository;
import com.example.backoffice.service.OutboxMetrics;
import java.time.Clock;
import java.util.Arrays;
import java.util.Set;
import java.util.stream.Collectors;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;
import org.springframework.transaction.PlatformTransactionManager;

@Component
@Order(30)
public class DomainEventAnalyticsHandler extends IdempotentDomainEventHandler {

  public static final String NAME = "domain-event-analytics";

  private static final Set<String> EVENT_TYPES =
      Arrays.stream(AggregateType.values())
          .flatMap(type -> type.eventTypes().stream())
          .collect(Collectors.toUnmodifiableSet());

  private final OutboxMetrics metrics;

  public DomainEventAnalyticsHandler(
      OutboxMetrics metrics,
      ProcessedEventRepository processedEventRepository,
      PlatformTransactionManager transactionManager,
      Clock clock) {
    super(processedEventRepository, transactionManager, clock);
    this.metrics = metrics;
  }

  @Override
  public String name() {
    return NAME;
  }

  @Override
  public Set<String> eventTypes() {
    return EVENT_TYPES;
  }

  @Override
  protected void handleOnce(DomainEvent event) {
    metrics.recordDomainEvent(event.eventType());
  }
}
