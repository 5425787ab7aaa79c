/*
 * どこで: Backoffice API
 * 何を: 注文の作成と状態遷移のエンドポイントを提供する
 * なぜ: 集約操作を HTTP から呼べる唯一のコマンド面とするため
 */
package com.example.backoffice.api;

import com.example.backoffice.service.OrderCommandService;
import jakarta.validation.Valid;
import java.util.UUID;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/v1/orders")
@RequiredArgsConstructor
public class OrderController {

  private final OrderCommandService orderCommandService;

  @PostMapping
  public ResponseEntity<OrderResponse> create(@Valid @RequestBody CreateOrderRequest request) {
    final OrderResponse response =
        OrderResponse.from(
            orderCommandService.create(
                request.orderNumber(),
                request.userId(),
                request.customerEmail(),
                request.totalAmount()));
    return ResponseEntity.status(HttpStatus.CREATED).body(response);
  }

  @PostMapping("/{id}/confirm")
  public OrderResponse confirm(
      @PathVariable("id") UUID id, @Valid @RequestBody ConfirmOrderRequest request) {
    return OrderResponse.from(orderCommandService.confirm(id, request.paymentReference()));
  }

  @PostMapping("/{id}/hold")
  public OrderResponse putOnHold(
      @PathVariable("id") UUID id, @Valid @RequestBody OrderReasonRequest request) {
    return OrderResponse.from(orderCommandService.putOnHold(id, request.reason()));
  }

  @PostMapping("/{id}/release-hold")
  public OrderResponse releaseHold(@PathVariable("id") UUID id) {
    return OrderResponse.from(orderCommandService.releaseHold(id));
  }

  @PostMapping("/{id}/ship")
  public OrderResponse ship(
      @PathVariable("id") UUID id, @Valid @RequestBody ShipOrderRequest request) {
    return OrderResponse.from(orderCommandService.ship(id, request.trackingNumber()));
  }

  @PostMapping("/{id}/deliver")
  public OrderResponse deliver(@PathVariable("id") UUID id) {
    return OrderResponse.from(orderCommandService.deliver(id));
  }

  @PostMapping("/{id}/cancel")
  public OrderResponse cancel(
      @PathVariable("id") UUID id, @Valid @RequestBody OrderReasonRequest request) {
    return OrderResponse.from(orderCommandService.cancel(id, request.reason()));
  }

  @PostMapping("/{id}/return")
  public OrderResponse returnOrder(
      @PathVariable("id") UUID id, @Valid @RequestBody OrderReasonRequest request) {
    return OrderResponse.from(orderCommandService.returnOrder(id, request.reason()));
  }

  @DeleteMapping("/{id}")
  public OrderResponse delete(@PathVariable("id") UUID id) {
    return OrderResponse.from(orderCommandService.delete(id));
  }
}
