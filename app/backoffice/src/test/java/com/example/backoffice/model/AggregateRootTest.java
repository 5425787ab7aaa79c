package com.example.backoffice.model;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.time.Instant;
import java.util.UUID;
import org.junit.jupiter.api.Test;

class AggregateRootTest {

  private static final Instant NOW = Instant.parse("2026-03-01T10:00:00Z");

  @Test
  void transitionWithoutEventsStillMarksModified() {
    final DoorAggregate door = DoorAggregate.persisted(UUID.randomUUID(), NOW, 4);
    assertThat(door.isModified()).isFalse();

    door.open(NOW.plusSeconds(1));

    assertThat(door.status()).isEqualTo(DoorAggregate.State.OPEN);
    assertThat(door.pendingEvents()).isEmpty();
    assertThat(door.isModified()).isTrue();
    assertThat(door.updatedAt()).isEqualTo(NOW.plusSeconds(1));
  }

  @Test
  void markCommittedClearsModified() {
    final DoorAggregate door = DoorAggregate.persisted(UUID.randomUUID(), NOW, 4);
    door.open(NOW);

    door.markCommitted(5);

    assertThat(door.isModified()).isFalse();
    assertThat(door.version()).isEqualTo(5);
  }

  @Test
  void rejectedTransitionLeavesAggregateUnmodified() {
    final DoorAggregate door = DoorAggregate.persisted(UUID.randomUUID(), NOW, 4);
    door.open(NOW);
    door.markCommitted(5);

    assertThatThrownBy(() -> door.open(NOW)).isInstanceOf(InvalidTransitionException.class);

    assertThat(door.isModified()).isFalse();
  }
}
