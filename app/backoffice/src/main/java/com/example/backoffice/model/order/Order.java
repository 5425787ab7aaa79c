/*
 * どこで: Order 集約
 * 何を: 注文状態と支払状態の二つの状態機械をまとめて遷移させる
 * なぜ: 注文と支払の片方だけが進む部分適用を防ぐため
 */
package com.example.backoffice.model.order;

import com.example.backoffice.model.AggregateRoot;
import com.example.backoffice.model.AggregateType;
import com.example.backoffice.model.TransitionTable;
import java.math.BigDecimal;
import java.time.Instant;
import java.util.Set;
import java.util.UUID;

public class Order extends AggregateRoot<OrderStatus, OrderOperation> {

  public static final String ORDER_CREATED = "OrderCreated";
  public static final String ORDER_CONFIRMED = "OrderConfirmed";
  public static final String ORDER_PUT_ON_HOLD = "OrderPutOnHold";
  public static final String ORDER_RELEASED_FROM_HOLD = "OrderReleasedFromHold";
  public static final String ORDER_SHIPPED = "OrderShipped";
  public static final String ORDER_DELIVERED = "OrderDelivered";
  public static final String ORDER_CANCELLED = "OrderCancelled";
  public static final String ORDER_RETURNED = "OrderReturned";
  public static final String ORDER_DELETED = "OrderDeleted";
  public static final String ORDER_PAYMENT_STATUS_CHANGED = "OrderPaymentStatusChanged";

  public static final Set<String> EVENT_TYPES =
      Set.of(
          ORDER_CREATED,
          ORDER_CONFIRMED,
          ORDER_PUT_ON_HOLD,
          ORDER_RELEASED_FROM_HOLD,
          ORDER_SHIPPED,
          ORDER_DELIVERED,
          ORDER_CANCELLED,
          ORDER_RETURNED,
          ORDER_DELETED,
          ORDER_PAYMENT_STATUS_CHANGED);

  static final TransitionTable<OrderStatus, OrderOperation> TRANSITIONS =
      TransitionTable.builder("Order", OrderStatus.class, OrderOperation.class)
          .permit(OrderStatus.CREATED, OrderOperation.CONFIRM, OrderStatus.CONFIRMED)
          .permit(OrderStatus.CREATED, OrderOperation.PUT_ON_HOLD, OrderStatus.ON_HOLD)
          .permit(OrderStatus.ON_HOLD, OrderOperation.RELEASE_HOLD, OrderStatus.CREATED)
          .permit(OrderStatus.CONFIRMED, OrderOperation.SHIP, OrderStatus.SHIPPED)
          .permit(OrderStatus.SHIPPED, OrderOperation.DELIVER, OrderStatus.DELIVERED)
          .permitFrom(
              OrderOperation.CANCEL,
              OrderStatus.CANCELLED,
              OrderStatus.CREATED,
              OrderStatus.ON_HOLD,
              OrderStatus.CONFIRMED)
          .permit(OrderStatus.DELIVERED, OrderOperation.RETURN, OrderStatus.RETURNED)
          .permitFrom(
              OrderOperation.DELETE,
              OrderStatus.DELETED,
              OrderStatus.CREATED,
              OrderStatus.CANCELLED,
              OrderStatus.RETURNED)
          .deletedState(OrderStatus.DELETED)
          .build();

  static final TransitionTable<PaymentStatus, PaymentOperation> PAYMENT_TRANSITIONS =
      TransitionTable.builder("OrderPayment", PaymentStatus.class, PaymentOperation.class)
          .permit(PaymentStatus.PENDING, PaymentOperation.CAPTURE, PaymentStatus.PAID)
          .permit(PaymentStatus.PENDING, PaymentOperation.VOID, PaymentStatus.VOIDED)
          .permit(PaymentStatus.PAID, PaymentOperation.REFUND, PaymentStatus.REFUNDED)
          .build();

  private String orderNumber;
  private UUID userId;
  private String customerEmail;
  private BigDecimal totalAmount;
  private PaymentStatus paymentStatus;
  private String paymentReference;
  private String trackingNumber;
  private String holdReason;
  private String cancellationReason;
  private String returnReason;
  private Instant confirmedAt;
  private Instant shippedAt;
  private Instant deliveredAt;
  private Instant cancelledAt;
  private Instant returnedAt;

  private Order() {}

  public static Order create(
      UUID id,
      String orderNumber,
      UUID userId,
      String customerEmail,
      BigDecimal totalAmount,
      Instant at) {
    final Order order = new Order();
    order.orderNumber = requireText(orderNumber, "orderNumber");
    order.userId = requirePresent(userId, "userId");
    order.customerEmail = requireText(customerEmail, "customerEmail");
    order.totalAmount = requirePositive(totalAmount, "totalAmount");
    order.paymentStatus = PaymentStatus.PENDING;
    order.initialize(id, OrderStatus.CREATED, at);
    order.raise(
        ORDER_CREATED,
        order.payload(null, OrderStatus.CREATED, null, PaymentStatus.PENDING, null),
        at);
    return order;
  }

  @Override
  public AggregateType aggregateType() {
    return AggregateType.ORDER;
  }

  @Override
  protected TransitionTable<OrderStatus, OrderOperation> transitions() {
    return TRANSITIONS;
  }

  public void confirm(String reference, Instant at) {
    final PaymentStatus paymentFrom = paymentStatus;
    transition(OrderOperation.CONFIRM)
        .guard(() -> requireText(reference, "paymentReference"))
        .guard(() -> PAYMENT_TRANSITIONS.resolve(paymentFrom, PaymentOperation.CAPTURE))
        .emit(
            ORDER_CONFIRMED,
            (from, to) ->
                payload(from, to, paymentFrom, PaymentStatus.PAID, reference, trackingNumber, null))
        .emit(
            ORDER_PAYMENT_STATUS_CHANGED,
            (from, to) ->
                payload(from, to, paymentFrom, PaymentStatus.PAID, reference, trackingNumber, null))
        .effect(
            () -> {
              paymentStatus = PaymentStatus.PAID;
              paymentReference = reference;
              confirmedAt = at;
            })
        .apply(at);
  }

  /** 支払前の注文だけを保留にできる。保留中は確定できず、解除かキャンセルのみ。 */
  public void putOnHold(String reason, Instant at) {
    transition(OrderOperation.PUT_ON_HOLD)
        .guard(() -> requireText(reason, "reason"))
        .emit(
            ORDER_PUT_ON_HOLD, (from, to) -> payload(from, to, paymentStatus, paymentStatus, reason))
        .effect(() -> holdReason = reason)
        .apply(at);
  }

  public void releaseHold(Instant at) {
    transition(OrderOperation.RELEASE_HOLD)
        .emit(
            ORDER_RELEASED_FROM_HOLD,
            (from, to) -> payload(from, to, paymentStatus, paymentStatus, null))
        .effect(() -> holdReason = null)
        .apply(at);
  }

  public void ship(String tracking, Instant at) {
    transition(OrderOperation.SHIP)
        .guard(() -> requireText(tracking, "trackingNumber"))
        .emit(
            ORDER_SHIPPED,
            (from, to) ->
                payload(from, to, paymentStatus, paymentStatus, paymentReference, tracking, null))
        .effect(
            () -> {
              trackingNumber = tracking;
              shippedAt = at;
            })
        .apply(at);
  }

  public void deliver(Instant at) {
    transition(OrderOperation.DELIVER)
        .emit(ORDER_DELIVERED, (from, to) -> payload(from, to, paymentStatus, paymentStatus, null))
        .effect(() -> deliveredAt = at)
        .apply(at);
  }

  /** 支払前なら VOID、支払済みなら REFUND を同時に適用する。 */
  public void cancel(String reason, Instant at) {
    final PaymentStatus paymentFrom = paymentStatus;
    final PaymentOperation paymentOperation =
        paymentFrom == PaymentStatus.PAID ? PaymentOperation.REFUND : PaymentOperation.VOID;
    final PaymentStatus paymentTo =
        PAYMENT_TRANSITIONS.target(paymentFrom, paymentOperation).orElse(paymentFrom);
    transition(OrderOperation.CANCEL)
        .guard(() -> requireText(reason, "reason"))
        .guard(() -> PAYMENT_TRANSITIONS.resolve(paymentFrom, paymentOperation))
        .emit(ORDER_CANCELLED, (from, to) -> payload(from, to, paymentFrom, paymentTo, reason))
        .emit(
            ORDER_PAYMENT_STATUS_CHANGED,
            (from, to) -> payload(from, to, paymentFrom, paymentTo, reason))
        .effect(
            () -> {
              paymentStatus = paymentTo;
              cancellationReason = reason;
              cancelledAt = at;
            })
        .apply(at);
  }

  public void returnOrder(String reason, Instant at) {
    final PaymentStatus paymentFrom = paymentStatus;
    transition(OrderOperation.RETURN)
        .guard(() -> requireText(reason, "reason"))
        .guard(() -> PAYMENT_TRANSITIONS.resolve(paymentFrom, PaymentOperation.REFUND))
        .emit(
            ORDER_RETURNED,
            (from, to) -> payload(from, to, paymentFrom, PaymentStatus.REFUNDED, reason))
        .emit(
            ORDER_PAYMENT_STATUS_CHANGED,
            (from, to) -> payload(from, to, paymentFrom, PaymentStatus.REFUNDED, reason))
        .effect(
            () -> {
              paymentStatus = PaymentStatus.REFUNDED;
              returnReason = reason;
              returnedAt = at;
            })
        .apply(at);
  }

  public void markAsDeleted(Instant at) {
    transition(OrderOperation.DELETE)
        .emit(ORDER_DELETED, (from, to) -> payload(from, to, paymentStatus, paymentStatus, null))
        .apply(at);
  }

  private OrderEventPayload payload(
      OrderStatus from,
      OrderStatus to,
      PaymentStatus paymentFrom,
      PaymentStatus paymentTo,
      String reason) {
    return payload(from, to, paymentFrom, paymentTo, paymentReference, trackingNumber, reason);
  }

  private OrderEventPayload payload(
      OrderStatus from,
      OrderStatus to,
      PaymentStatus paymentFrom,
      PaymentStatus paymentTo,
      String reference,
      String tracking,
      String reason) {
    return new OrderEventPayload(
        orderNumber,
        userId,
        customerEmail,
        totalAmount,
        from == null ? null : from.name(),
        to.name(),
        paymentFrom == null ? null : paymentFrom.name(),
        paymentTo.name(),
        reference,
        tracking,
        reason);
  }

  public String orderNumber() {
    return orderNumber;
  }

  public UUID userId() {
    return userId;
  }

  public String customerEmail() {
    return customerEmail;
  }

  public BigDecimal totalAmount() {
    return totalAmount;
  }

  public PaymentStatus paymentStatus() {
    return paymentStatus;
  }

  public String paymentReference() {
    return paymentReference;
  }

  public String trackingNumber() {
    return trackingNumber;
  }

  public String holdReason() {
    return holdReason;
  }

  public String cancellationReason() {
    return cancellationReason;
  }

  public Instant confirmedAt() {
    return confirmedAt;
  }

  public Instant shippedAt() {
    return shippedAt;
  }

  public Instant deliveredAt() {
    return deliveredAt;
  }

  public Instant cancelledAt() {
    return cancelledAt;
  }

  public Instant returnedAt() {
    return returnedAt;
  }
}
