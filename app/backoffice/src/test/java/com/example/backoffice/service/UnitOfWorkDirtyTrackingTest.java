package com.example.backoffice.service;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

import com.example.backoffice.model.DoorAggregate;
import com.example.backoffice.repository.OutboxMessageRepository;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.UUID;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.transaction.TransactionStatus;
import org.springframework.transaction.support.TransactionCallback;
import org.springframework.transaction.support.TransactionSynchronizationManager;
import org.springframework.transaction.support.TransactionTemplate;

@ExtendWith(MockitoExtension.class)
class UnitOfWorkDirtyTrackingTest {

  private static final Instant NOW = Instant.parse("2026-03-01T10:00:00Z");

  @Mock private AggregateStore aggregateStore;

  @Mock private OutboxMessageRepository outboxMessageRepository;

  @Mock private DomainEventSerializer serializer;

  @Mock private TransactionTemplate transactionTemplate;

  private UnitOfWork newUnitOfWork() {
    return new UnitOfWork(
        aggregateStore,
        outboxMessageRepository,
        serializer,
        transactionTemplate,
        Clock.fixed(NOW, ZoneOffset.UTC));
  }

  @Test
  void transitionWithoutEventsIsStillWritten() {
    final DoorAggregate door = DoorAggregate.persisted(UUID.randomUUID(), NOW, 2);
    when(transactionTemplate.execute(any()))
        .thenAnswer(
            invocation -> {
              final TransactionCallback<?> callback = invocation.getArgument(0);
              TransactionSynchronizationManager.initSynchronization();
              try {
                return callback.doInTransaction(mock(TransactionStatus.class));
              } finally {
                TransactionSynchronizationManager.clearSynchronization();
              }
            });
    when(aggregateStore.write(door, NOW)).thenReturn(3L);
    final UnitOfWork unitOfWork = newUnitOfWork();
    unitOfWork.register(door);
    door.open(NOW);

    final CommitResult result = unitOfWork.saveChanges();

    assertThat(result).isEqualTo(new CommitResult(1, 0));
    verify(aggregateStore).write(door, NOW);
    verifyNoInteractions(outboxMessageRepository);
  }

  @Test
  void untouchedAggregateSkipsTransaction() {
    final DoorAggregate door = DoorAggregate.persisted(UUID.randomUUID(), NOW, 2);
    final UnitOfWork unitOfWork = newUnitOfWork();
    unitOfWork.register(door);

    final CommitResult result = unitOfWork.saveChanges();

    assertThat(result).isEqualTo(CommitResult.empty());
    verifyNoInteractions(transactionTemplate, aggregateStore);
  }
}
