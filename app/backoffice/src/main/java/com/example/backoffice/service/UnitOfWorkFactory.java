/*
 * どこで: Backoffice サービス層
 * 何を: 業務操作ごとに新しい UnitOfWork を作る
 */
package com.example.backoffice.service;

import com.example.backoffice.repository.OutboxMessageRepository;
import java.time.Clock;
import org.springframework.stereotype.Component;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.support.TransactionTemplate;

@Component
public class UnitOfWorkFactory {

  private final AggregateStore aggregateStore;
  private final OutboxMessageRepository outboxMessageRepository;
  private final DomainEventSerializer serializer;
  private final TransactionTemplate transactionTemplate;
  private final Clock clock;

  public UnitOfWorkFactory(
      AggregateStore aggregateStore,
      OutboxMessageRepository outboxMessageRepository,
      DomainEventSerializer serializer,
      PlatformTransactionManager transactionManager,
      Clock clock) {
    this.aggregateStore = aggregateStore;
    this.outboxMessageRepository = outboxMessageRepository;
    this.serializer = serializer;
    this.transactionTemplate = new TransactionTemplate(transactionManager);
    this.clock = clock;
  }

  public UnitOfWork begin() {
    return new UnitOfWork(
        aggregateStore, outboxMessageRepository, serializer, transactionTemplate, clock);
  }
}
