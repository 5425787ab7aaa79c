/*
 * どこで: 返品申請集約
 * 何を: 申請 -> 承認/却下 -> 完了 の流れを管理する
 * なぜ: 返送追跡番号なしで返品完了とされないようにするため
 */
package com.example.backoffice.model.returns;

import com.example.backoffice.model.AggregateRoot;
import com.example.backoffice.model.AggregateType;
import com.example.backoffice.model.TransitionTable;
import java.math.BigDecimal;
import java.time.Instant;
import java.util.Set;
import java.util.UUID;

public class ReturnRequest extends AggregateRoot<ReturnRequestStatus, ReturnRequestOperation> {

  public static final String RETURN_REQUEST_CREATED = "ReturnRequestCreated";
  public static final String RETURN_REQUEST_APPROVED = "ReturnRequestApproved";
  public static final String RETURN_REQUEST_REJECTED = "ReturnRequestRejected";
  public static final String RETURN_REQUEST_COMPLETED = "ReturnRequestCompleted";
  public static final String RETURN_REQUEST_DELETED = "ReturnRequestDeleted";

  public static final Set<String> EVENT_TYPES =
      Set.of(
          RETURN_REQUEST_CREATED,
          RETURN_REQUEST_APPROVED,
          RETURN_REQUEST_REJECTED,
          RETURN_REQUEST_COMPLETED,
          RETURN_REQUEST_DELETED);

  static final TransitionTable<ReturnRequestStatus, ReturnRequestOperation> TRANSITIONS =
      TransitionTable.builder(
              "ReturnRequest", ReturnRequestStatus.class, ReturnRequestOperation.class)
          .permit(
              ReturnRequestStatus.REQUESTED,
              ReturnRequestOperation.APPROVE,
              ReturnRequestStatus.APPROVED)
          .permit(
              ReturnRequestStatus.REQUESTED,
              ReturnRequestOperation.REJECT,
              ReturnRequestStatus.REJECTED)
          .permit(
              ReturnRequestStatus.APPROVED,
              ReturnRequestOperation.COMPLETE,
              ReturnRequestStatus.COMPLETED)
          .permitFrom(
              ReturnRequestOperation.DELETE,
              ReturnRequestStatus.DELETED,
              ReturnRequestStatus.REQUESTED,
              ReturnRequestStatus.REJECTED,
              ReturnRequestStatus.COMPLETED)
          .deletedState(ReturnRequestStatus.DELETED)
          .build();

  private UUID orderId;
  private UUID userId;
  private String reason;
  private BigDecimal refundAmount;
  private String rejectionReason;
  private String trackingNumber;
  private Instant approvedAt;
  private Instant rejectedAt;
  private Instant completedAt;

  private ReturnRequest() {}

  public static ReturnRequest create(
      UUID id, UUID orderId, UUID userId, String reason, BigDecimal refundAmount, Instant at) {
    final ReturnRequest request = new ReturnRequest();
    request.orderId = requirePresent(orderId, "orderId");
    request.userId = requirePresent(userId, "userId");
    request.reason = requireText(reason, "reason");
    request.refundAmount = requirePositive(refundAmount, "refundAmount");
    request.initialize(id, ReturnRequestStatus.REQUESTED, at);
    request.raise(
        RETURN_REQUEST_CREATED,
        request.payload(null, ReturnRequestStatus.REQUESTED, reason, null),
        at);
    return request;
  }

  @Override
  public AggregateType aggregateType() {
    return AggregateType.RETURN_REQUEST;
  }

  @Override
  protected TransitionTable<ReturnRequestStatus, ReturnRequestOperation> transitions() {
    return TRANSITIONS;
  }

  public void approve(Instant at) {
    transition(ReturnRequestOperation.APPROVE)
        .emit(RETURN_REQUEST_APPROVED, (from, to) -> payload(from, to, reason, null))
        .effect(() -> approvedAt = at)
        .apply(at);
  }

  public void reject(String rejection, Instant at) {
    transition(ReturnRequestOperation.REJECT)
        .guard(() -> requireText(rejection, "rejectionReason"))
        .emit(RETURN_REQUEST_REJECTED, (from, to) -> payload(from, to, rejection, null))
        .effect(
            () -> {
              rejectionReason = rejection;
              rejectedAt = at;
            })
        .apply(at);
  }

  public void complete(String returnTrackingNumber, Instant at) {
    transition(ReturnRequestOperation.COMPLETE)
        .guard(() -> requireText(returnTrackingNumber, "trackingNumber"))
        .emit(
            RETURN_REQUEST_COMPLETED,
            (from, to) -> payload(from, to, reason, returnTrackingNumber))
        .effect(
            () -> {
              trackingNumber = returnTrackingNumber;
              completedAt = at;
            })
        .apply(at);
  }

  public void markAsDeleted(Instant at) {
    transition(ReturnRequestOperation.DELETE)
        .emit(RETURN_REQUEST_DELETED, (from, to) -> payload(from, to, null, trackingNumber))
        .apply(at);
  }

  private ReturnRequestEventPayload payload(
      ReturnRequestStatus from, ReturnRequestStatus to, String eventReason, String tracking) {
    return new ReturnRequestEventPayload(
        orderId,
        userId,
        from == null ? null : from.name(),
        to.name(),
        refundAmount,
        eventReason,
        tracking);
  }

  public UUID orderId() {
    return orderId;
  }

  public UUID userId() {
    return userId;
  }

  public String reason() {
    return reason;
  }

  public BigDecimal refundAmount() {
    return refundAmount;
  }

  public String rejectionReason() {
    return rejectionReason;
  }

  public String trackingNumber() {
    return trackingNumber;
  }

  public Instant approvedAt() {
    return approvedAt;
  }

  public Instant rejectedAt() {
    return rejectedAt;
  }

  public Instant completedAt() {
    return completedAt;
  }
}
