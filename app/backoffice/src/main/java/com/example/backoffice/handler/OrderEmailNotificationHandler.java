/*
 * どこで: Backoffice イベント購読者
 * 何を: 注文の確定/出荷/配達/取消を顧客へメール通知する
 */
package com.example.backoffice.handler;

import com.example.backoffice.model.DomainEvent;
import com.example.backoffice.model.order.Order;
import com.example.backoffice.model.order.OrderEventPayload;
import com.example.backoffice.repository.ProcessedEventRepository;
import java.time.Clock;
import java.util.Set;
import org.springframework.stereotype.Component;
import org.springframework.transaction.PlatformTransactionManager;

@Component
@org.springframework.core.annotation.Order(10)
public class OrderEmailNotificationHandler extends IdempotentDomainEventHandler {

  public static final String NAME = "order-email-notification";

  private static final Set<String> EVENT_TYPES =
      Set.of(
          Order.ORDER_CONFIRMED,
          Order.ORDER_SHIPPED,
          Order.ORDER_DELIVERED,
          Order.ORDER_CANCELLED);

  private final EmailSender emailSender;

  public OrderEmailNotificationHandler(
      EmailSender emailSender,
      ProcessedEventRepository processedEventRepository,
      PlatformTransactionManager transactionManager,
      Clock clock) {
    super(processedEventRepository, transactionManager, clock);
    this.emailSender = emailSender;
  }

  @Override
  public String name() {
    return NAME;
  }

  @Override
  public Set<String> eventTypes() {
    return EVENT_TYPES;
  }

  @Override
  protected void handleOnce(DomainEvent event) {
    final OrderEventPayload payload = event.payloadAs(OrderEventPayload.class);
    emailSender.send(
        new EmailMessage(
            event.eventId(),
            payload.customerEmail(),
            subject(event.eventType(), payload.orderNumber()),
            body(event.eventType(), payload)));
  }

  private String subject(String eventType, String orderNumber) {
    return switch (eventType) {
      case Order.ORDER_CONFIRMED -> "Your order " + orderNumber + " is confirmed";
      case Order.ORDER_SHIPPED -> "Your order " + orderNumber + " has shipped";
      case Order.ORDER_DELIVERED -> "Your order " + orderNumber + " was delivered";
      case Order.ORDER_CANCELLED -> "Your order " + orderNumber + " was cancelled";
      default -> throw new IllegalArgumentException("unsupported event type: " + eventType);
    };
  }

  private String body(String eventType, OrderEventPayload payload) {
    if (Order.ORDER_SHIPPED.equals(eventType)) {
      return "Tracking number: " + payload.trackingNumber();
    }
    if (Order.ORDER_CANCELLED.equals(eventType)) {
      return "Reason: " + payload.reason() + ". Payment status: " + payload.toPaymentStatus();
    }
    return "Order total: " + payload.totalAmount();
  }
}
