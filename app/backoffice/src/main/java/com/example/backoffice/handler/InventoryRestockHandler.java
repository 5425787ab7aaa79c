/*
 * どこで: Backoffice イベント購読者
 * 何を: 注文取消・返品・返品完了時に在庫戻し依頼を登録する
 * なぜ: 在庫戻しを processed_events と同じトランザクションで一度だけ反映するため
 */
package com.example.backoffice.handler;

import com.example.backoffice.model.DomainEvent;
import com.example.backoffice.model.order.Order;
import com.example.backoffice.model.order.OrderEventPayload;
import com.example.backoffice.model.returns.ReturnRequest;
import com.example.backoffice.model.returns.ReturnRequestEventPayload;
import com.example.backoffice.repository.InventoryRestockRepository;
import com.example.backoffice.repository.ProcessedEventRepository;
import java.time.Clock;
import java.time.Instant;
import java.util.Set;
import java.util.UUID;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;
import org.springframework.transaction.PlatformTransactionManager;

@Component
@org.springframework.core.annotation.Order(20)
public class InventoryRestockHandler extends IdempotentDomainEventHandler {

  public static final String NAME = "inventory-restock";

  private static final Logger logger = LoggerFactory.getLogger(InventoryRestockHandler.class);
  private static final Set<String> EVENT_TYPES =
      Set.of(
          Order.ORDER_CANCELLED, Order.ORDER_RETURNED, ReturnRequest.RETURN_REQUEST_COMPLETED);

  private final InventoryRestockRepository inventoryRestockRepository;
  private final Clock clock;

  public InventoryRestockHandler(
      InventoryRestockRepository inventoryRestockRepository,
      ProcessedEventRepository processedEventRepository,
      PlatformTransactionManager transactionManager,
      Clock clock) {
    super(processedEventRepository, transactionManager, clock);
    this.inventoryRestockRepository = inventoryRestockRepository;
    this.clock = clock;
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
    final UUID orderId;
    final String reason;
    if (ReturnRequest.RETURN_REQUEST_COMPLETED.equals(event.eventType())) {
      final ReturnRequestEventPayload payload = event.payloadAs(ReturnRequestEventPayload.class);
      orderId = payload.orderId();
      reason = payload.reason();
    } else {
      orderId = event.aggregateId();
      reason = event.payloadAs(OrderEventPayload.class).reason();
    }
    inventoryRestockRepository.insert(
        event.eventId(),
        event.eventType(),
        event.aggregateType(),
        event.aggregateId(),
        orderId,
        reason,
        Instant.now(clock));
    logger.info(
        "inventory restock requested orderId={} eventType={} eventId={}",
        orderId,
        event.eventType(),
        event.eventId());
  }
}
