/*
 * どこで: 物流 (倉庫) 集約
 * 何を: 倉庫の稼働/停止と削除を管理する
 * なぜ: 稼働中の倉庫が削除されないようにするため
 */
package com.example.backoffice.model.logistics;

import com.example.backoffice.model.AggregateRoot;
import com.example.backoffice.model.AggregateType;
import com.example.backoffice.model.TransitionTable;
import java.time.Instant;
import java.util.Set;
import java.util.UUID;

public class Warehouse extends AggregateRoot<WarehouseStatus, WarehouseOperation> {

  public static final String WAREHOUSE_CREATED = "WarehouseCreated";
  public static final String WAREHOUSE_ACTIVATED = "WarehouseActivated";
  public static final String WAREHOUSE_DEACTIVATED = "WarehouseDeactivated";
  public static final String WAREHOUSE_DELETED = "WarehouseDeleted";

  public static final Set<String> EVENT_TYPES =
      Set.of(WAREHOUSE_CREATED, WAREHOUSE_ACTIVATED, WAREHOUSE_DEACTIVATED, WAREHOUSE_DELETED);

  static final TransitionTable<WarehouseStatus, WarehouseOperation> TRANSITIONS =
      TransitionTable.builder("Warehouse", WarehouseStatus.class, WarehouseOperation.class)
          .permit(WarehouseStatus.INACTIVE, WarehouseOperation.ACTIVATE, WarehouseStatus.ACTIVE)
          .permit(WarehouseStatus.ACTIVE, WarehouseOperation.DEACTIVATE, WarehouseStatus.INACTIVE)
          .permit(WarehouseStatus.INACTIVE, WarehouseOperation.DELETE, WarehouseStatus.DELETED)
          .deletedState(WarehouseStatus.DELETED)
          .build();

  private String code;
  private String name;
  private String city;
  private int capacity;

  private Warehouse() {}

  public static Warehouse create(
      UUID id, String code, String name, String city, int capacity, Instant at) {
    final Warehouse warehouse = new Warehouse();
    warehouse.code = requireText(code, "code");
    warehouse.name = requireText(name, "name");
    warehouse.city = city;
    warehouse.capacity = requirePositive(capacity, "capacity");
    warehouse.initialize(id, WarehouseStatus.ACTIVE, at);
    warehouse.raise(WAREHOUSE_CREATED, warehouse.payload(null, WarehouseStatus.ACTIVE), at);
    return warehouse;
  }

  @Override
  public AggregateType aggregateType() {
    return AggregateType.WAREHOUSE;
  }

  @Override
  protected TransitionTable<WarehouseStatus, WarehouseOperation> transitions() {
    return TRANSITIONS;
  }

  public void activate(Instant at) {
    transition(WarehouseOperation.ACTIVATE)
        .emit(WAREHOUSE_ACTIVATED, this::payload)
        .apply(at);
  }

  public void deactivate(Instant at) {
    transition(WarehouseOperation.DEACTIVATE)
        .emit(WAREHOUSE_DEACTIVATED, this::payload)
        .apply(at);
  }

  public void markAsDeleted(Instant at) {
    transition(WarehouseOperation.DELETE)
        .emit(WAREHOUSE_DELETED, this::payload)
        .apply(at);
  }

  private WarehouseEventPayload payload(WarehouseStatus from, WarehouseStatus to) {
    return new WarehouseEventPayload(
        code, name, city, capacity, from == null ? null : from.name(), to.name());
  }

  public String code() {
    return code;
  }

  public String name() {
    return name;
  }

  public String city() {
    return city;
  }

  public int capacity() {
    return capacity;
  }
}
