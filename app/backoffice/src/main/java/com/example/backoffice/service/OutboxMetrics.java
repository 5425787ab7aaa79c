/*
 * どこで: Backoffice サービス層
 * 何を: outbox 配送の結果/遅延/滞留と dead-letter 件数、ドメインイベント件数を記録する
 * なぜ: 配送失敗は元の呼び出し元に見えないため、運用で継続監視できるようにするため
 */
package com.example.backoffice.service;

import edu.umd.cs.findbugs.annotations.SuppressFBWarnings;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Tags;
import io.micrometer.core.instrument.Timer;
import java.time.Duration;
import java.time.Instant;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.atomic.AtomicInteger;
import org.springframework.stereotype.Component;

@Component
@SuppressFBWarnings(
    value = "EI_EXPOSE_REP2",
    justification = "MeterRegistry は Spring 管理の共有コンポーネントで防御的コピーが不可能なため")
public class OutboxMetrics {

  static final String METRIC_DISPATCH_TOTAL = "backoffice.outbox.dispatch.total";
  static final String METRIC_DISPATCH_DELAY = "backoffice.outbox.dispatch.delay";
  static final String METRIC_BACKLOG_AGE = "backoffice.outbox.backlog.age";
  static final String METRIC_DEAD_LETTER_CURRENT = "backoffice.outbox.dead_letter.current";
  static final String METRIC_DOMAIN_EVENT_TOTAL = "backoffice.domain_event.total";

  public static final String RESULT_PROCESSED = "processed";
  public static final String RESULT_RETRY = "retry";
  public static final String RESULT_DEAD_LETTERED = "dead_lettered";
  public static final String RESULT_LEASE_LOST = "lease_lost";
  public static final String RESULT_RELEASED = "released";

  private final MeterRegistry meterRegistry;
  private final AtomicInteger deadLetterCurrent = new AtomicInteger(0);
  private final ConcurrentMap<String, Counter> dispatchCounters = new ConcurrentHashMap<>();
  private final ConcurrentMap<String, Counter> domainEventCounters = new ConcurrentHashMap<>();
  private final Timer dispatchDelayTimer;
  private final Timer backlogAgeTimer;

  public OutboxMetrics(MeterRegistry meterRegistry) {
    this.meterRegistry = meterRegistry;
    Gauge.builder(METRIC_DEAD_LETTER_CURRENT, deadLetterCurrent, AtomicInteger::get)
        .description("Current number of dead-lettered outbox messages")
        .register(meterRegistry);
    this.dispatchDelayTimer =
        Timer.builder(METRIC_DISPATCH_DELAY)
            .description("Delay from event occurrence to successful dispatch")
            .register(meterRegistry);
    this.backlogAgeTimer =
        Timer.builder(METRIC_BACKLOG_AGE)
            .description("Outbox backlog age when a message is claimed by the relay")
            .register(meterRegistry);
  }

  public void recordDispatch(String result) {
    dispatchCounters
        .computeIfAbsent(
            result,
            ignored ->
                Counter.builder(METRIC_DISPATCH_TOTAL)
                    .description("Outbox dispatch attempts by result")
                    .tags(Tags.of("result", result))
                    .register(meterRegistry))
        .increment();
  }

  public void recordDomainEvent(String eventType) {
    domainEventCounters
        .computeIfAbsent(
            eventType,
            ignored ->
                Counter.builder(METRIC_DOMAIN_EVENT_TOTAL)
                    .description("Delivered domain events by type")
                    .tags(Tags.of("event_type", eventType))
                    .register(meterRegistry))
        .increment();
  }

  public void recordDispatchDelay(Instant occurredAt, Instant processedAt) {
    if (occurredAt == null || processedAt == null || processedAt.isBefore(occurredAt)) {
      return;
    }
    dispatchDelayTimer.record(Duration.between(occurredAt, processedAt));
  }

  public void recordBacklogAge(Instant occurredAt, Instant claimedAt) {
    if (occurredAt == null || claimedAt == null || claimedAt.isBefore(occurredAt)) {
      return;
    }
    backlogAgeTimer.record(Duration.between(occurredAt, claimedAt));
  }

  public void updateDeadLetterCurrent(int count) {
    deadLetterCurrent.set(Math.max(count, 0));
  }
}
