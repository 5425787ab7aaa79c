/*
 * どこで: Backoffice ドメイン層
 * 何を: 状態・論理削除フラグ・未配送イベントを持つ集約の基底
 * なぜ: 遷移の検証とイベント生成を一箇所に集め、集約が直接 publish しないようにするため
 */
package com.example.backoffice.model;

import com.fasterxml.jackson.annotation.JsonAutoDetect;
import com.fasterxml.jackson.annotation.JsonIgnore;
import java.math.BigDecimal;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.UUID;
import java.util.function.BiFunction;

@JsonAutoDetect(
    fieldVisibility = JsonAutoDetect.Visibility.ANY,
    getterVisibility = JsonAutoDetect.Visibility.NONE,
    isGetterVisibility = JsonAutoDetect.Visibility.NONE,
    setterVisibility = JsonAutoDetect.Visibility.NONE)
public abstract class AggregateRoot<S extends Enum<S>, O extends Enum<O>> {

  private UUID id;
  private S status;
  private boolean deleted;
  private Instant createdAt;
  private Instant updatedAt;

  // 永続化済みバージョン。0 は未保存を表す
  @JsonIgnore
  private long version;

  @JsonIgnore
  private final List<DomainEvent> pendingEvents = new ArrayList<>();

  // イベントを出さない遷移でも保存対象にする
  @JsonIgnore
  private boolean modified;

  protected AggregateRoot() {}

  public abstract AggregateType aggregateType();

  protected abstract TransitionTable<S, O> transitions();

  public UUID id() {
    return id;
  }

  public S status() {
    return status;
  }

  public boolean isDeleted() {
    return deleted;
  }

  public Instant createdAt() {
    return createdAt;
  }

  public Instant updatedAt() {
    return updatedAt;
  }

  public long version() {
    return version;
  }

  public boolean isNew() {
    return version == 0;
  }

  public boolean isModified() {
    return modified;
  }

  public List<DomainEvent> pendingEvents() {
    return Collections.unmodifiableList(pendingEvents);
  }

  /** 保存完了後に UnitOfWork からのみ呼ばれる。 */
  public void markCommitted(long committedVersion) {
    this.version = committedVersion;
    this.modified = false;
    pendingEvents.clear();
  }

  /** スナップショットから復元した直後にバージョンを設定する。 */
  public void restoreVersion(long persistedVersion) {
    if (!pendingEvents.isEmpty()) {
      throw new IllegalStateException("cannot restore version with pending events id=" + id);
    }
    this.version = persistedVersion;
  }

  protected final void initialize(UUID newId, S initialStatus, Instant at) {
    if (this.id != null) {
      throw new IllegalStateException("aggregate already initialized id=" + this.id);
    }
    this.id = Objects.requireNonNull(newId, "id");
    this.status = Objects.requireNonNull(initialStatus, "status");
    this.createdAt = Objects.requireNonNull(at, "at");
    this.updatedAt = at;
  }

  protected final void raise(String eventType, EventPayload payload, Instant at) {
    pendingEvents.add(newEvent(eventType, payload, at));
  }

  protected final Transition transition(O operation) {
    return new Transition(operation);
  }

  private DomainEvent newEvent(String eventType, EventPayload payload, Instant at) {
    return new DomainEvent(
        UUID.randomUUID(),
        id,
        aggregateType().typeName(),
        eventType,
        DomainEvent.CURRENT_PAYLOAD_VERSION,
        at,
        payload);
  }

  protected static String requireText(String value, String field) {
    if (value == null || value.isBlank()) {
      throw new DomainRuleViolationException(field + " is required");
    }
    return value;
  }

  protected static <T> T requirePresent(T value, String field) {
    if (value == null) {
      throw new DomainRuleViolationException(field + " is required");
    }
    return value;
  }

  protected static BigDecimal requirePositive(BigDecimal value, String field) {
    if (value == null || value.signum() <= 0) {
      throw new DomainRuleViolationException(field + " must be positive");
    }
    return value;
  }

  protected static int requirePositive(int value, String field) {
    if (value <= 0) {
      throw new DomainRuleViolationException(field + " must be positive");
    }
    return value;
  }

  /**
   * 一回の遷移。適用順は 遷移表の検証 → guard → イベント生成 → effect → 状態更新。
   * effect は例外を投げない単純代入だけにすること。
   */
  protected final class Transition {

    private final O operation;
    private final List<Runnable> guards = new ArrayList<>();
    private final List<PendingEmit<S>> emits = new ArrayList<>();
    private Runnable effect = () -> {};

    private Transition(O operation) {
      this.operation = Objects.requireNonNull(operation, "operation");
    }

    public Transition guard(Runnable check) {
      guards.add(check);
      return this;
    }

    public Transition effect(Runnable mutation) {
      this.effect = mutation;
      return this;
    }

    public Transition emit(String eventType, BiFunction<S, S, EventPayload> payloadFactory) {
      emits.add(new PendingEmit<>(eventType, payloadFactory));
      return this;
    }

    public S apply(Instant at) {
      Objects.requireNonNull(at, "at");
      final S from = status;
      final S to = transitions().resolve(from, operation);
      guards.forEach(Runnable::run);
      // ペイロードは変更前のフィールドから組み立てる
      final List<DomainEvent> events = new ArrayList<>(emits.size());
      for (PendingEmit<S> emit : emits) {
        events.add(newEvent(emit.eventType(), emit.payloadFactory().apply(from, to), at));
      }
      effect.run();
      status = to;
      if (transitions().isDeletedState(to)) {
        deleted = true;
      }
      updatedAt = at;
      modified = true;
      pendingEvents.addAll(events);
      return to;
    }
  }

  private record PendingEmit<S>(String eventType, BiFunction<S, S, EventPayload> payloadFactory) {}
}
