/*
 * どこで: Backoffice サービス層
 * 何を: 注文の作成と状態遷移コマンド
 * なぜ: API から集約操作と保存を一箇所で行うため
 */
package com.example.backoffice.service;

import com.example.backoffice.model.order.Order;
import java.math.BigDecimal;
import java.time.Clock;
import java.time.Instant;
import java.util.UUID;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

@Service
@RequiredArgsConstructor
public class OrderCommandService {

  private static final Logger logger = LoggerFactory.getLogger(OrderCommandService.class);

  private final CommandExecutor commandExecutor;
  private final Clock clock;

  public Order create(String orderNumber, UUID userId, String customerEmail, BigDecimal totalAmount) {
    final UUID orderId = UUID.randomUUID();
    final Order order =
        commandExecutor.execute(
            "order.create",
            unitOfWork ->
                unitOfWork.register(
                    Order.create(orderId, orderNumber, userId, customerEmail, totalAmount, now())));
    logger.info("order created orderId={} orderNumber={}", order.id(), order.orderNumber());
    return order;
  }

  public Order confirm(UUID orderId, String paymentReference) {
    return apply("order.confirm", orderId, order -> order.confirm(paymentReference, now()));
  }

  public Order putOnHold(UUID orderId, String reason) {
    return apply("order.hold", orderId, order -> order.putOnHold(reason, now()));
  }

  public Order releaseHold(UUID orderId) {
    return apply("order.release-hold", orderId, order -> order.releaseHold(now()));
  }

  public Order ship(UUID orderId, String trackingNumber) {
    return apply("order.ship", orderId, order -> order.ship(trackingNumber, now()));
  }

  public Order deliver(UUID orderId) {
    return apply("order.deliver", orderId, order -> order.deliver(now()));
  }

  public Order cancel(UUID orderId, String reason) {
    return apply("order.cancel", orderId, order -> order.cancel(reason, now()));
  }

  public Order returnOrder(UUID orderId, String reason) {
    return apply("order.return", orderId, order -> order.returnOrder(reason, now()));
  }

  public Order delete(UUID orderId) {
    return apply("order.delete", orderId, order -> order.markAsDeleted(now()));
  }

  private Order apply(String commandName, UUID orderId, OrderMutation mutation) {
    final Order order =
        commandExecutor.execute(
            commandName,
            unitOfWork -> {
              final Order loaded = unitOfWork.load(Order.class, orderId);
              mutation.apply(loaded);
              return loaded;
            });
    logger.info(
        "order command applied command={} orderId={} status={}",
        commandName,
        orderId,
        order.status());
    return order;
  }

  private Instant now() {
    return Instant.now(clock);
  }

  @FunctionalInterface
  private interface OrderMutation {
    void apply(Order order);
  }
}
