/*
 * どこで: 物流 (ピッキング/梱包) 集約
 * 何を: 倉庫作業の進捗を順番通りにしか進めない状態機械
 * なぜ: 梱包前の出荷など工程の飛び越しを防ぐため
 */
package com.example.backoffice.model.logistics;

import com.example.backoffice.model.AggregateRoot;
import com.example.backoffice.model.AggregateType;
import com.example.backoffice.model.TransitionTable;
import java.math.BigDecimal;
import java.time.Instant;
import java.util.Set;
import java.util.UUID;

public class PickPack extends AggregateRoot<PickPackStatus, PickPackOperation> {

  public static final String PICK_PACK_CREATED = "PickPackCreated";
  public static final String PICK_PACK_STATUS_CHANGED = "PickPackStatusChanged";
  public static final String PICK_PACK_DELETED = "PickPackDeleted";

  public static final Set<String> EVENT_TYPES =
      Set.of(PICK_PACK_CREATED, PICK_PACK_STATUS_CHANGED, PICK_PACK_DELETED);

  static final TransitionTable<PickPackStatus, PickPackOperation> TRANSITIONS =
      TransitionTable.builder("PickPack", PickPackStatus.class, PickPackOperation.class)
          .permit(PickPackStatus.PENDING, PickPackOperation.START_PICKING, PickPackStatus.PICKING)
          .permit(PickPackStatus.PICKING, PickPackOperation.COMPLETE_PICKING, PickPackStatus.PICKED)
          .permit(PickPackStatus.PICKED, PickPackOperation.START_PACKING, PickPackStatus.PACKING)
          .permit(PickPackStatus.PACKING, PickPackOperation.COMPLETE_PACKING, PickPackStatus.PACKED)
          .permit(PickPackStatus.PACKED, PickPackOperation.SHIP, PickPackStatus.SHIPPED)
          .permitFromAllExcept(
              PickPackOperation.CANCEL,
              PickPackStatus.CANCELLED,
              PickPackStatus.SHIPPED,
              PickPackStatus.DELETED)
          .permitFromAllExcept(
              PickPackOperation.DELETE, PickPackStatus.DELETED, PickPackStatus.SHIPPED)
          .deletedState(PickPackStatus.DELETED)
          .build();

  private UUID orderId;
  private UUID warehouseId;
  private String packNumber;
  private UUID pickerId;
  private UUID packerId;
  private Instant pickedAt;
  private Instant packedAt;
  private Instant shippedAt;
  private BigDecimal weight;
  private String dimensions;
  private int packageCount;
  private String cancellationReason;

  private PickPack() {}

  public static PickPack create(
      UUID id, UUID orderId, UUID warehouseId, String packNumber, Instant at) {
    final PickPack pickPack = new PickPack();
    pickPack.orderId = requirePresent(orderId, "orderId");
    pickPack.warehouseId = requirePresent(warehouseId, "warehouseId");
    pickPack.packNumber = requireText(packNumber, "packNumber");
    pickPack.initialize(id, PickPackStatus.PENDING, at);
    pickPack.raise(
        PICK_PACK_CREATED, pickPack.payload(null, PickPackStatus.PENDING, null, null), at);
    return pickPack;
  }

  @Override
  public AggregateType aggregateType() {
    return AggregateType.PICK_PACK;
  }

  @Override
  protected TransitionTable<PickPackStatus, PickPackOperation> transitions() {
    return TRANSITIONS;
  }

  public void startPicking(UUID picker, Instant at) {
    transition(PickPackOperation.START_PICKING)
        .guard(() -> requirePresent(picker, "pickerId"))
        .emit(PICK_PACK_STATUS_CHANGED, (from, to) -> payload(from, to, picker, null))
        .effect(() -> pickerId = picker)
        .apply(at);
  }

  public void completePicking(Instant at) {
    transition(PickPackOperation.COMPLETE_PICKING)
        .emit(PICK_PACK_STATUS_CHANGED, (from, to) -> payload(from, to, pickerId, null))
        .effect(() -> pickedAt = at)
        .apply(at);
  }

  public void startPacking(UUID packer, Instant at) {
    transition(PickPackOperation.START_PACKING)
        .guard(() -> requirePresent(packer, "packerId"))
        .emit(PICK_PACK_STATUS_CHANGED, (from, to) -> payload(from, to, packer, null))
        .effect(() -> packerId = packer)
        .apply(at);
  }

  public void completePacking(BigDecimal packedWeight, String packedDimensions, int packages, Instant at) {
    transition(PickPackOperation.COMPLETE_PACKING)
        .guard(() -> requirePositive(packedWeight, "weight"))
        .guard(() -> requirePositive(packages, "packageCount"))
        .emit(
            PICK_PACK_STATUS_CHANGED,
            (from, to) ->
                new PickPackEventPayload(
                    orderId,
                    warehouseId,
                    packNumber,
                    from.name(),
                    to.name(),
                    packerId,
                    packedWeight,
                    packages,
                    null))
        .effect(
            () -> {
              weight = packedWeight;
              dimensions = packedDimensions;
              packageCount = packages;
              packedAt = at;
            })
        .apply(at);
  }

  public void ship(Instant at) {
    transition(PickPackOperation.SHIP)
        .emit(PICK_PACK_STATUS_CHANGED, (from, to) -> payload(from, to, packerId, null))
        .effect(() -> shippedAt = at)
        .apply(at);
  }

  public void cancel(String reason, Instant at) {
    transition(PickPackOperation.CANCEL)
        .guard(() -> requireText(reason, "reason"))
        .emit(PICK_PACK_STATUS_CHANGED, (from, to) -> payload(from, to, null, reason))
        .effect(() -> cancellationReason = reason)
        .apply(at);
  }

  public void markAsDeleted(Instant at) {
    transition(PickPackOperation.DELETE)
        .emit(PICK_PACK_DELETED, (from, to) -> payload(from, to, null, null))
        .apply(at);
  }

  private PickPackEventPayload payload(
      PickPackStatus from, PickPackStatus to, UUID actor, String reason) {
    return new PickPackEventPayload(
        orderId,
        warehouseId,
        packNumber,
        from == null ? null : from.name(),
        to.name(),
        actor,
        weight,
        packageCount == 0 ? null : packageCount,
        reason);
  }

  public UUID orderId() {
    return orderId;
  }

  public UUID warehouseId() {
    return warehouseId;
  }

  public String packNumber() {
    return packNumber;
  }

  public BigDecimal weight() {
    return weight;
  }

  public String dimensions() {
    return dimensions;
  }

  public int packageCount() {
    return packageCount;
  }

  public Instant pickedAt() {
    return pickedAt;
  }

  public Instant packedAt() {
    return packedAt;
  }

  public Instant shippedAt() {
    return shippedAt;
  }
}
