/*
 * どこで: Backoffice ドメイン層
 * 何を: 集約種別ごとのクラス・ペイロード型・イベント種別の対応
 * なぜ: outbox 行とスナップショットを型付きで復元するため
 */
package com.example.backoffice.model;

import com.example.backoffice.model.logistics.PickPack;
import com.example.backoffice.model.logistics.PickPackEventPayload;
import com.example.backoffice.model.logistics.Warehouse;
import com.example.backoffice.model.logistics.WarehouseEventPayload;
import com.example.backoffice.model.marketing.EmailCampaign;
import com.example.backoffice.model.marketing.EmailCampaignEventPayload;
import com.example.backoffice.model.marketing.LiveStream;
import com.example.backoffice.model.marketing.LiveStreamEventPayload;
import com.example.backoffice.model.order.Order;
import com.example.backoffice.model.order.OrderEventPayload;
import com.example.backoffice.model.returns.ReturnRequest;
import com.example.backoffice.model.returns.ReturnRequestEventPayload;
import com.example.backoffice.model.subscription.Subscription;
import com.example.backoffice.model.subscription.SubscriptionEventPayload;
import com.example.backoffice.model.support.SupportTicket;
import com.example.backoffice.model.support.SupportTicketEventPayload;
import java.util.Arrays;
import java.util.Optional;
import java.util.Set;

public enum AggregateType {
  ORDER("Order", Order.class, OrderEventPayload.class, Order.EVENT_TYPES),
  PICK_PACK("PickPack", PickPack.class, PickPackEventPayload.class, PickPack.EVENT_TYPES),
  RETURN_REQUEST(
      "ReturnRequest", ReturnRequest.class, ReturnRequestEventPayload.class, ReturnRequest.EVENT_TYPES),
  WAREHOUSE("Warehouse", Warehouse.class, WarehouseEventPayload.class, Warehouse.EVENT_TYPES),
  EMAIL_CAMPAIGN(
      "EmailCampaign", EmailCampaign.class, EmailCampaignEventPayload.class, EmailCampaign.EVENT_TYPES),
  SUBSCRIPTION(
      "Subscription", Subscription.class, SubscriptionEventPayload.class, Subscription.EVENT_TYPES),
  LIVE_STREAM("LiveStream", LiveStream.class, LiveStreamEventPayload.class, LiveStream.EVENT_TYPES),
  SUPPORT_TICKET(
      "SupportTicket", SupportTicket.class, SupportTicketEventPayload.class, SupportTicket.EVENT_TYPES);

  private final String typeName;
  private final Class<? extends AggregateRoot<?, ?>> aggregateClass;
  private final Class<? extends EventPayload> payloadClass;
  private final Set<String> eventTypes;

  AggregateType(
      String typeName,
      Class<? extends AggregateRoot<?, ?>> aggregateClass,
      Class<? extends EventPayload> payloadClass,
      Set<String> eventTypes) {
    this.typeName = typeName;
    this.aggregateClass = aggregateClass;
    this.payloadClass = payloadClass;
    this.eventTypes = eventTypes;
  }

  public String typeName() {
    return typeName;
  }

  public Class<? extends AggregateRoot<?, ?>> aggregateClass() {
    return aggregateClass;
  }

  public Class<? extends EventPayload> payloadClass() {
    return payloadClass;
  }

  public Set<String> eventTypes() {
    return eventTypes;
  }

  public boolean supportsEventType(String eventType) {
    return eventTypes.contains(eventType);
  }

  public static Optional<AggregateType> fromTypeName(String typeName) {
    return Arrays.stream(values()).filter(type -> type.typeName.equals(typeName)).findFirst();
  }

  public static AggregateType of(Class<?> aggregateClass) {
    return Arrays.stream(values())
        .filter(type -> type.aggregateClass.equals(aggregateClass))
        .findFirst()
        .orElseThrow(
            () -> new IllegalArgumentException("unknown aggregate class: " + aggregateClass.getName()));
  }

  public static Optional<AggregateType> fromEventType(String eventType) {
    return Arrays.stream(values()).filter(type -> type.supportsEventType(eventType)).findFirst();
  }
}
