package com.example.backoffice.model;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import org.junit.jupiter.api.Test;

class TransitionTableTest {

  enum DoorState {
    OPEN,
    CLOSED,
    LOCKED,
    REMOVED
  }

  enum DoorOperation {
    OPEN,
    CLOSE,
    LOCK,
    REMOVE
  }

  private final TransitionTable<DoorState, DoorOperation> table =
      TransitionTable.builder("Door", DoorState.class, DoorOperation.class)
          .permit(DoorState.CLOSED, DoorOperation.OPEN, DoorState.OPEN)
          .permit(DoorState.OPEN, DoorOperation.CLOSE, DoorState.CLOSED)
          .permit(DoorState.CLOSED, DoorOperation.LOCK, DoorState.LOCKED)
          .permitFromAllExcept(DoorOperation.REMOVE, DoorState.REMOVED, DoorState.LOCKED)
          .deletedState(DoorState.REMOVED)
          .build();

  @Test
  void resolveReturnsTargetForPermittedPair() {
    assertThat(table.resolve(DoorState.CLOSED, DoorOperation.OPEN)).isEqualTo(DoorState.OPEN);
    assertThat(table.resolve(DoorState.OPEN, DoorOperation.REMOVE)).isEqualTo(DoorState.REMOVED);
  }

  @Test
  void resolveRejectsUnknownPairWithStateAndOperation() {
    assertThatThrownBy(() -> table.resolve(DoorState.LOCKED, DoorOperation.OPEN))
        .isInstanceOfSatisfying(
            InvalidTransitionException.class,
            ex -> {
              assertThat(ex.aggregateType()).isEqualTo("Door");
              assertThat(ex.currentState()).isEqualTo("LOCKED");
              assertThat(ex.operation()).isEqualTo("OPEN");
            });
  }

  @Test
  void resolveRejectsAnyOperationOnDeletedState() {
    assertThatThrownBy(() -> table.resolve(DoorState.REMOVED, DoorOperation.OPEN))
        .isInstanceOf(AlreadyDeletedException.class)
        .hasMessageContaining("already deleted");
  }

  @Test
  void permitFromAllExceptSkipsExcludedAndTargetStates() {
    assertThat(table.permits(DoorState.LOCKED, DoorOperation.REMOVE)).isFalse();
    assertThat(table.permits(DoorState.REMOVED, DoorOperation.REMOVE)).isFalse();
    assertThat(table.allowedOperations(DoorState.CLOSED))
        .containsExactlyInAnyOrder(DoorOperation.OPEN, DoorOperation.LOCK, DoorOperation.REMOVE);
    assertThat(table.allowedOperations(DoorState.REMOVED)).isEmpty();
  }

  @Test
  void buildRejectsDuplicateTransition() {
    assertThatThrownBy(
            () ->
                TransitionTable.builder("Door", DoorState.class, DoorOperation.class)
                    .permit(DoorState.CLOSED, DoorOperation.OPEN, DoorState.OPEN)
                    .permit(DoorState.CLOSED, DoorOperation.OPEN, DoorState.LOCKED))
        .isInstanceOf(IllegalStateException.class)
        .hasMessageContaining("duplicate transition");
  }

  @Test
  void buildRejectsDeletedStateWithOutgoingTransition() {
    assertThatThrownBy(
            () ->
                TransitionTable.builder("Door", DoorState.class, DoorOperation.class)
                    .permit(DoorState.REMOVED, DoorOperation.OPEN, DoorState.OPEN)
                    .deletedState(DoorState.REMOVED)
                    .build())
        .isInstanceOf(IllegalStateException.class)
        .hasMessageContaining("terminal");
  }
}
