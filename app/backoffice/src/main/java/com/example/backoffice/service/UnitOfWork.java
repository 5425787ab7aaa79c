/*
 * どこで: Backoffice サービス層
 * 何を: 一つの業務操作で触れた集約の状態と未配送イベントを同一トランザクションで保存する
 * なぜ: 状態変更とその通知 (outbox 行) が食い違わないようにするため
 */
package com.example.backoffice.service;

import com.example.backoffice.model.AggregateRoot;
import com.example.backoffice.model.AggregateType;
import com.example.backoffice.model.DomainEvent;
import com.example.backoffice.repository.OutboxMessageRepository;
import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.UUID;
import java.util.concurrent.atomic.AtomicBoolean;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.ConcurrencyFailureException;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.transaction.support.TransactionSynchronization;
import org.springframework.transaction.support.TransactionSynchronizationManager;
import org.springframework.transaction.support.TransactionTemplate;

/**
 * 1 業務操作 = 1 インスタンス。スレッド間で共有しない ({@link #cancel()} を除く)。
 *
 * <p>保存失敗時は集約の未配送イベントを残したまま例外を投げる。呼び出し側は
 * このインスタンスを捨て、読み込みからやり直すこと。
 */
public class UnitOfWork {

  private static final Logger logger = LoggerFactory.getLogger(UnitOfWork.class);

  private final AggregateStore aggregateStore;
  private final OutboxMessageRepository outboxMessageRepository;
  private final DomainEventSerializer serializer;
  private final TransactionTemplate transactionTemplate;
  private final Clock clock;
  // 登録順 = outbox への書き込み順
  private final Map<AggregateKey, AggregateRoot<?, ?>> tracked = new LinkedHashMap<>();
  private final AtomicBoolean cancelled = new AtomicBoolean(false);

  UnitOfWork(
      AggregateStore aggregateStore,
      OutboxMessageRepository outboxMessageRepository,
      DomainEventSerializer serializer,
      TransactionTemplate transactionTemplate,
      Clock clock) {
    this.aggregateStore = aggregateStore;
    this.outboxMessageRepository = outboxMessageRepository;
    this.serializer = serializer;
    this.transactionTemplate = transactionTemplate;
    this.clock = clock;
  }

  /** 論理削除されていない集約を読み込み、保存対象として追跡する。 */
  public <A extends AggregateRoot<?, ?>> A load(Class<A> aggregateClass, UUID aggregateId) {
    final AggregateKey key = new AggregateKey(AggregateType.of(aggregateClass), aggregateId);
    final AggregateRoot<?, ?> existing = tracked.get(key);
    if (existing != null) {
      return aggregateClass.cast(existing);
    }
    final A aggregate = aggregateStore.load(aggregateClass, aggregateId);
    tracked.put(key, aggregate);
    return aggregate;
  }

  /** 新規作成した集約を追跡する。 */
  public <A extends AggregateRoot<?, ?>> A register(A aggregate) {
    Objects.requireNonNull(aggregate, "aggregate");
    final AggregateKey key = new AggregateKey(aggregate.aggregateType(), aggregate.id());
    final AggregateRoot<?, ?> existing = tracked.putIfAbsent(key, aggregate);
    if (existing != null && existing != aggregate) {
      throw new IllegalStateException("another instance is already tracked for " + key);
    }
    return aggregate;
  }

  public void cancel() {
    cancelled.set(true);
  }

  public boolean isCancelled() {
    return cancelled.get() || Thread.currentThread().isInterrupted();
  }

  public CommitResult saveChanges() {
    ensureNotCancelled();
    final List<AggregateRoot<?, ?>> dirty = new ArrayList<>();
    for (AggregateRoot<?, ?> aggregate : tracked.values()) {
      if (aggregate.isNew() || aggregate.isModified() || !aggregate.pendingEvents().isEmpty()) {
        dirty.add(aggregate);
      }
    }
    if (dirty.isEmpty()) {
      return CommitResult.empty();
    }
    final Instant now = Instant.now(clock);
    try {
      final CommitResult result =
          transactionTemplate.execute(status -> writeAll(dirty, now));
      logger.debug(
          "unit of work committed aggregates={} outboxMessages={}",
          result.aggregatesWritten(),
          result.outboxMessagesWritten());
      return result;
    } catch (DataIntegrityViolationException | ConcurrencyFailureException ex) {
      throw new PersistenceConflictException("commit conflict: " + ex.getMessage(), ex);
    }
  }

  private CommitResult writeAll(List<AggregateRoot<?, ?>> dirty, Instant now) {
    final List<Long> versions = new ArrayList<>(dirty.size());
    int messages = 0;
    for (AggregateRoot<?, ?> aggregate : dirty) {
      versions.add(aggregateStore.write(aggregate, now));
      for (DomainEvent event : aggregate.pendingEvents()) {
        outboxMessageRepository.insert(
            event.eventId(),
            event.aggregateId(),
            event.aggregateType(),
            event.eventType(),
            event.payloadVersion(),
            serializer.serializePayload(event),
            event.occurredAt(),
            now);
        messages++;
      }
    }
    // コミット直前にもう一度確認し、取消ならロールバックさせる
    ensureNotCancelled();
    // 未配送イベントの破棄は実コミット後に限る (外側トランザクションに参加した場合も同様)
    TransactionSynchronizationManager.registerSynchronization(
        new TransactionSynchronization() {
          @Override
          public void afterCommit() {
            for (int i = 0; i < dirty.size(); i++) {
              dirty.get(i).markCommitted(versions.get(i));
            }
          }
        });
    return new CommitResult(dirty.size(), messages);
  }

  private void ensureNotCancelled() {
    if (isCancelled()) {
      throw new OperationCancelledException("unit of work cancelled before commit");
    }
  }

  private record AggregateKey(AggregateType type, UUID id) {}
}
