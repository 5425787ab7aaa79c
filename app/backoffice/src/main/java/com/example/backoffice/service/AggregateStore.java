/*
 * どこで: Backoffice サービス層
 * 何を: 集約を JSON スナップショットとして読み書きする
 * なぜ: 集約ごとのテーブルを持たずに楽観ロック付きで状態を保存するため
 */
package com.example.backoffice.service;

import com.example.backoffice.model.AggregateRoot;
import com.example.backoffice.model.AggregateSnapshot;
import com.example.backoffice.model.AggregateType;
import com.example.backoffice.repository.AggregateSnapshotRepository;
import com.example.backoffice.repository.SoftDeleteFilter;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.time.Instant;
import java.util.Optional;
import java.util.UUID;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

@Component
@RequiredArgsConstructor
public class AggregateStore {

  private final AggregateSnapshotRepository snapshotRepository;
  private final ObjectMapper objectMapper;

  public <A extends AggregateRoot<?, ?>> Optional<A> find(
      Class<A> aggregateClass, UUID aggregateId, SoftDeleteFilter filter) {
    final AggregateType aggregateType = AggregateType.of(aggregateClass);
    return snapshotRepository
        .find(aggregateType.typeName(), aggregateId, filter)
        .map(snapshot -> restore(aggregateClass, snapshot));
  }

  public <A extends AggregateRoot<?, ?>> A load(Class<A> aggregateClass, UUID aggregateId) {
    return find(aggregateClass, aggregateId, SoftDeleteFilter.EXCLUDE_DELETED)
        .orElseThrow(
            () ->
                new AggregateNotFoundException(
                    AggregateType.of(aggregateClass).typeName(), aggregateId));
  }

  /** 書き込み後のバージョンを返す。呼び出しはトランザクション内で行うこと。 */
  long write(AggregateRoot<?, ?> aggregate, Instant now) {
    final String typeName = aggregate.aggregateType().typeName();
    final String stateJson = serialize(aggregate);
    if (aggregate.isNew()) {
      snapshotRepository.insert(
          typeName,
          aggregate.id(),
          aggregate.status().name(),
          aggregate.isDeleted(),
          stateJson,
          aggregate.createdAt(),
          now);
      return 1L;
    }
    final int updated =
        snapshotRepository.update(
            typeName,
            aggregate.id(),
            aggregate.version(),
            aggregate.status().name(),
            aggregate.isDeleted(),
            stateJson,
            now);
    if (updated == 0) {
      throw new PersistenceConflictException(
          typeName + " was modified concurrently id=" + aggregate.id()
              + " expectedVersion=" + aggregate.version());
    }
    return aggregate.version() + 1;
  }

  private String serialize(AggregateRoot<?, ?> aggregate) {
    try {
      return objectMapper.writeValueAsString(aggregate);
    } catch (JsonProcessingException ex) {
      throw new IllegalStateException(
          "failed to serialize aggregate id=" + aggregate.id(), ex);
    }
  }

  private <A extends AggregateRoot<?, ?>> A restore(
      Class<A> aggregateClass, AggregateSnapshot snapshot) {
    try {
      final A aggregate = objectMapper.readValue(snapshot.stateJson(), aggregateClass);
      aggregate.restoreVersion(snapshot.version());
      return aggregate;
    } catch (JsonProcessingException ex) {
      throw new IllegalStateException(
          "failed to restore aggregate type=" + snapshot.aggregateType()
              + " id=" + snapshot.aggregateId(), ex);
    }
  }
}
