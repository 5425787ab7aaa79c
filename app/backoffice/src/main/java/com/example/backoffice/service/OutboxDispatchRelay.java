/*
 * どこで: Backoffice outbox relay
 * 何を: outbox 行を lease 付きで claim し、登録 handler へ配送して結果を記録する
 * なぜ: 書き込み経路を止めずに、コミット済みイベントを少なくとも一回配送するため
 */
package com.example.backoffice.service;

import com.example.backoffice.config.OutboxRelayProperties;
import com.example.backoffice.handler.DomainEventHandler;
import com.example.backoffice.handler.DomainEventHandlerRegistry;
import com.example.backoffice.model.DomainEvent;
import com.example.backoffice.model.OutboxMessageRecord;
import com.example.backoffice.repository.OutboxMessageRepository;
import com.example.common.TraceIds;
import com.example.common.WorkerIds;
import com.google.common.annotations.VisibleForTesting;
import com.google.common.util.concurrent.ThreadFactoryBuilder;
import jakarta.annotation.PreDestroy;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ThreadLocalRandom;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Service;

@Service
public class OutboxDispatchRelay {

  private static final Logger logger = LoggerFactory.getLogger(OutboxDispatchRelay.class);
  private static final String MDC_OUTBOX_ID = "outbox_id";
  private static final String MDC_EVENT_ID = "event_id";
  private static final String MDC_EVENT_TYPE = "event_type";

  private final OutboxMessageRepository outboxMessageRepository;
  private final DomainEventSerializer serializer;
  private final DomainEventHandlerRegistry handlerRegistry;
  private final OutboxRelayProperties properties;
  private final OutboxMetrics metrics;
  private final Clock clock;
  private final String workerId;
  private final ExecutorService executor;
  private final AtomicBoolean stopping = new AtomicBoolean(false);

  public OutboxDispatchRelay(
      OutboxMessageRepository outboxMessageRepository,
      DomainEventSerializer serializer,
      DomainEventHandlerRegistry handlerRegistry,
      OutboxRelayProperties properties,
      OutboxMetrics metrics,
      Clock clock) {
    this.outboxMessageRepository = outboxMessageRepository;
    this.serializer = serializer;
    this.handlerRegistry = handlerRegistry;
    this.properties = properties;
    this.metrics = metrics;
    this.clock = clock;
    this.workerId = WorkerIds.newWorkerId();
    this.executor =
        Executors.newFixedThreadPool(
            properties.concurrency(),
            new ThreadFactoryBuilder().setNameFormat("outbox-relay-%d").setDaemon(true).build());
  }

  public String workerId() {
    return workerId;
  }

  @VisibleForTesting
  boolean isStopping() {
    return stopping.get();
  }

  /**
   * 1 バッチ分を claim して配送し、全行の結果記録を待ってから戻る。
   *
   * <p>claim は同一集約につき先頭 1 行しか返さないため、バッチ内の並列処理でも集約内の順序は崩れない。
   *
   * @return claim した行数
   */
  public int dispatchPendingBatch() {
    if (stopping.get()) {
      return 0;
    }
    final Instant now = Instant.now(clock);
    final List<OutboxMessageRecord> claimed =
        outboxMessageRepository.claimBatch(
            properties.batchSize(), now, now.plus(properties.lease()), workerId);
    if (!claimed.isEmpty()) {
      if (stopping.get()) {
        // 停止処理の lease 解放と入れ違いで claim した行は配送せずに戻す
        releaseClaims(claimed);
        return 0;
      }
      logger.debug("outbox batch claimed workerId={} count={}", workerId, claimed.size());
      awaitAll(submitAll(claimed, now));
    }
    metrics.updateDeadLetterCurrent(outboxMessageRepository.countDeadLettered());
    return claimed.size();
  }

  private List<Future<?>> submitAll(List<OutboxMessageRecord> claimed, Instant claimedAt) {
    final List<Future<?>> futures = new ArrayList<>(claimed.size());
    final List<OutboxMessageRecord> rejected = new ArrayList<>();
    final String traceId = TraceIds.newTraceId();
    for (OutboxMessageRecord record : claimed) {
      try {
        futures.add(executor.submit(() -> dispatchOne(record, claimedAt, traceId)));
      } catch (RejectedExecutionException ex) {
        rejected.add(record);
      }
    }
    if (!rejected.isEmpty()) {
      logger.warn(
          "outbox dispatch rejected during shutdown workerId={} count={}",
          workerId,
          rejected.size());
      releaseClaims(rejected);
    }
    return futures;
  }

  private void awaitAll(List<Future<?>> futures) {
    for (Future<?> future : futures) {
      try {
        future.get();
      } catch (InterruptedException ex) {
        Thread.currentThread().interrupt();
        logger.warn("outbox batch wait interrupted workerId={}", workerId);
        return;
      } catch (ExecutionException ex) {
        logger.error("outbox dispatch task failed unexpectedly workerId={}", workerId, ex.getCause());
      }
    }
  }

  @VisibleForTesting
  void dispatchOne(OutboxMessageRecord record, Instant claimedAt, String traceId) {
    MDC.put(TraceIds.MDC_KEY, traceId);
    MDC.put(MDC_OUTBOX_ID, Long.toString(record.id()));
    MDC.put(MDC_EVENT_ID, String.valueOf(record.eventId()));
    MDC.put(MDC_EVENT_TYPE, record.eventType());
    try {
      metrics.recordBacklogAge(record.occurredAt(), claimedAt);
      final DomainEvent event = serializer.deserialize(record);
      // 登録順に直列で呼び、一つでも失敗したら行全体を失敗扱いにする
      for (DomainEventHandler handler : handlerRegistry.handlersFor(event.eventType())) {
        handler.handle(event);
      }
      final Instant processedAt = Instant.now(clock);
      final int updated = outboxMessageRepository.markProcessed(record.id(), workerId, processedAt);
      if (updated == 0) {
        logger.warn(
            "outbox dispatch succeeded but lease was lost id={} eventId={}",
            record.id(),
            record.eventId());
        metrics.recordDispatch(OutboxMetrics.RESULT_LEASE_LOST);
        return;
      }
      metrics.recordDispatch(OutboxMetrics.RESULT_PROCESSED);
      metrics.recordDispatchDelay(record.occurredAt(), processedAt);
    } catch (Exception ex) {
      // 結果の記録を先に済ませるため中断フラグは一旦落とし、最後に戻す
      final boolean interrupted = Thread.interrupted() || ex instanceof InterruptedException;
      try {
        if (interrupted && stopping.get()) {
          // 停止による中断はハンドラの失敗ではないので試行回数を消費しない
          logger.info(
              "outbox dispatch interrupted by shutdown id={} eventType={} retryCount={}",
              record.id(),
              record.eventType(),
              record.retryCount());
          metrics.recordDispatch(OutboxMetrics.RESULT_RELEASED);
          releaseClaims(List.of(record));
        } else {
          handleFailure(record, ex);
        }
      } finally {
        if (interrupted) {
          Thread.currentThread().interrupt();
        }
      }
    } finally {
      MDC.remove(MDC_EVENT_TYPE);
      MDC.remove(MDC_EVENT_ID);
      MDC.remove(MDC_OUTBOX_ID);
      MDC.remove(TraceIds.MDC_KEY);
    }
  }

  @VisibleForTesting
  void handleFailure(OutboxMessageRecord record, Exception ex) {
    final Instant now = Instant.now(clock);
    final boolean nonRetryable = ex instanceof OutboxPayloadException;
    final int nextAttempt = record.retryCount() + 1;
    final String lastError = truncateError(ex);
    if (nonRetryable || nextAttempt >= properties.maxAttempts()) {
      final int updated =
          outboxMessageRepository.markDeadLettered(
              record.id(), workerId, nextAttempt, lastError, now);
      if (updated == 0) {
        logger.warn(
            "outbox dead-letter skipped because lease was lost id={} attempt={}",
            record.id(),
            nextAttempt);
        metrics.recordDispatch(OutboxMetrics.RESULT_LEASE_LOST);
        return;
      }
      metrics.recordDispatch(OutboxMetrics.RESULT_DEAD_LETTERED);
      if (nonRetryable) {
        // 運用アラート向けに error レベルで即時 dead-letter を通知する
        logger.error(
            "outbox payload undecodable and dead-lettered id={} eventType={}",
            record.id(),
            record.eventType(),
            ex);
      } else {
        logger.error(
            "outbox message dead-lettered id={} eventType={} attempts={}",
            record.id(),
            record.eventType(),
            nextAttempt,
            ex);
      }
      return;
    }
    final Instant availableAt = now.plus(computeBackoffDuration(nextAttempt));
    final int updated =
        outboxMessageRepository.markRetry(record.id(), workerId, nextAttempt, availableAt, lastError);
    if (updated == 0) {
      logger.warn(
          "outbox retry skipped because lease was lost id={} attempt={}", record.id(), nextAttempt);
      metrics.recordDispatch(OutboxMetrics.RESULT_LEASE_LOST);
      return;
    }
    metrics.recordDispatch(OutboxMetrics.RESULT_RETRY);
    logger.warn(
        "outbox dispatch retry scheduled id={} eventType={} attempt={} availableAt={}",
        record.id(),
        record.eventType(),
        nextAttempt,
        availableAt,
        ex);
  }

  private void releaseClaims(List<OutboxMessageRecord> records) {
    final List<Long> ids = records.stream().map(OutboxMessageRecord::id).toList();
    try {
      final int released = outboxMessageRepository.releaseClaims(workerId, ids);
      logger.info("outbox claims released workerId={} ids={} released={}", workerId, ids, released);
    } catch (DataAccessException ex) {
      // 解放できなかった lease は claimed_until 経過後に再 claim される
      logger.warn("outbox claim release failed workerId={} ids={}", workerId, ids, ex);
    }
  }

  @VisibleForTesting
  Duration computeBackoffDuration(int attempt) {
    final double baseMillis = properties.backoffBase().toMillis();
    final double exp = baseMillis * Math.pow(properties.backoffExponentBase(), (attempt - 1));
    final double capped = Math.min(exp, properties.backoffMax().toMillis());
    final double jitterMin = properties.backoffJitterMin();
    final double jitterMax = properties.backoffJitterMax();
    final double jitter =
        jitterMin + ThreadLocalRandom.current().nextDouble() * (jitterMax - jitterMin);
    final long backoffMillis = (long) Math.ceil(capped * jitter);
    final long minMillis = properties.backoffMin().toMillis();
    return Duration.ofMillis(Math.max(minMillis, backoffMillis));
  }

  private String truncateError(Exception ex) {
    final String message =
        ex.getMessage() == null
            ? ex.getClass().getSimpleName()
            : ex.getClass().getSimpleName() + ": " + ex.getMessage();
    final int maxLength = properties.errorMessageMaxLength();
    if (message.length() <= maxLength) {
      return message;
    }
    return message.substring(0, maxLength);
  }

  /** 新規 claim を止め、処理中の配送を待ってから自分の lease を解放する。 */
  @PreDestroy
  public void shutdown() {
    if (!stopping.compareAndSet(false, true)) {
      return;
    }
    executor.shutdown();
    try {
      final long timeoutMillis = properties.shutdownTimeout().toMillis();
      if (!executor.awaitTermination(timeoutMillis, TimeUnit.MILLISECONDS)) {
        logger.warn(
            "outbox relay in-flight dispatch did not finish within {} workerId={}",
            properties.shutdownTimeout(),
            workerId);
        executor.shutdownNow();
        // 中断された配送が自分の行を戻し終えるのを待つ
        if (!executor.awaitTermination(timeoutMillis, TimeUnit.MILLISECONDS)) {
          logger.warn("outbox relay workers still running after interrupt workerId={}", workerId);
        }
      }
    } catch (InterruptedException ex) {
      executor.shutdownNow();
      Thread.currentThread().interrupt();
    }
    try {
      final int released = outboxMessageRepository.releaseClaims(workerId);
      logger.info("outbox relay stopped workerId={} releasedClaims={}", workerId, released);
    } catch (DataAccessException ex) {
      // 解放できなかった lease は claimed_until 経過後に再 claim される
      logger.warn("outbox relay failed to release claims workerId={}", workerId, ex);
    }
  }
}
