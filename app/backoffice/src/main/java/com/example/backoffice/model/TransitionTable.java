/*
 * どこで: Backoffice ドメイン層
 * 何を: (現在状態, 操作) -> 次状態 の遷移表
 * なぜ: 集約ごとの状態機械を同じ制御フローで検証するため
 */
package com.example.backoffice.model;

import java.util.Collections;
import java.util.EnumMap;
import java.util.EnumSet;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

public final class TransitionTable<S extends Enum<S>, O extends Enum<O>> {

  private final String name;
  private final Class<O> operationType;
  private final S deletedState;
  private final Map<S, Map<O, S>> transitions;

  private TransitionTable(
      String name, Class<O> operationType, S deletedState, Map<S, Map<O, S>> transitions) {
    this.name = name;
    this.operationType = operationType;
    this.deletedState = deletedState;
    this.transitions = transitions;
  }

  public static <S extends Enum<S>, O extends Enum<O>> Builder<S, O> builder(
      String name, Class<S> stateType, Class<O> operationType) {
    return new Builder<>(name, stateType, operationType);
  }

  public String name() {
    return name;
  }

  public Optional<S> deletedState() {
    return Optional.ofNullable(deletedState);
  }

  public boolean isDeletedState(S state) {
    return deletedState != null && deletedState == state;
  }

  public Optional<S> target(S current, O operation) {
    final Map<O, S> row = transitions.get(current);
    return row == null ? Optional.empty() : Optional.ofNullable(row.get(operation));
  }

  public boolean permits(S current, O operation) {
    return target(current, operation).isPresent();
  }

  public Set<O> allowedOperations(S current) {
    final Map<O, S> row = transitions.get(current);
    if (row == null || row.isEmpty()) {
      return Collections.unmodifiableSet(EnumSet.noneOf(operationType));
    }
    return Collections.unmodifiableSet(EnumSet.copyOf(row.keySet()));
  }

  /**
   * 次状態を返す。削除済みなら {@link AlreadyDeletedException}、表に無ければ
   * {@link InvalidTransitionException} を投げる。
   */
  public S resolve(S current, O operation) {
    Objects.requireNonNull(current, "current");
    Objects.requireNonNull(operation, "operation");
    if (isDeletedState(current)) {
      throw new AlreadyDeletedException(name, operation.name());
    }
    return target(current, operation)
        .orElseThrow(() -> new InvalidTransitionException(name, current.name(), operation.name()));
  }

  public static final class Builder<S extends Enum<S>, O extends Enum<O>> {

    private final String name;
    private final Class<S> stateType;
    private final Class<O> operationType;
    private final Map<S, Map<O, S>> transitions;
    private S deletedState;

    private Builder(String name, Class<S> stateType, Class<O> operationType) {
      this.name = Objects.requireNonNull(name, "name");
      this.stateType = stateType;
      this.operationType = operationType;
      this.transitions = new EnumMap<>(stateType);
    }

    public Builder<S, O> permit(S from, O operation, S to) {
      final S previous =
          transitions.computeIfAbsent(from, key -> new EnumMap<>(operationType)).put(operation, to);
      if (previous != null) {
        throw new IllegalStateException(
            "duplicate transition " + name + " " + from + " " + operation);
      }
      return this;
    }

    @SafeVarargs
    public final Builder<S, O> permitFrom(O operation, S to, S... froms) {
      for (S from : froms) {
        permit(from, operation, to);
      }
      return this;
    }

    /** {@code excluded} 以外の全状態から {@code to} への遷移を許可する。 */
    @SafeVarargs
    public final Builder<S, O> permitFromAllExcept(O operation, S to, S... excluded) {
      final Set<S> skip = EnumSet.noneOf(stateType);
      Collections.addAll(skip, excluded);
      for (S from : stateType.getEnumConstants()) {
        if (from != to && !skip.contains(from)) {
          permit(from, operation, to);
        }
      }
      return this;
    }

    public Builder<S, O> deletedState(S state) {
      this.deletedState = state;
      return this;
    }

    public TransitionTable<S, O> build() {
      if (deletedState != null) {
        final Map<O, S> outgoing = transitions.get(deletedState);
        if (outgoing != null && !outgoing.isEmpty()) {
          throw new IllegalStateException("deleted state must be terminal: " + name);
        }
      }
      final Map<S, Map<O, S>> copy = new EnumMap<>(stateType);
      transitions.forEach((from, row) -> copy.put(from, Collections.unmodifiableMap(new EnumMap<>(row))));
      return new TransitionTable<>(name, operationType, deletedState, Collections.unmodifiableMap(copy));
    }
  }
}
