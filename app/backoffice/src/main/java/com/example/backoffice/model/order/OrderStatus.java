package com.example.backoffice.model.order;

public enum OrderStatus {
  CREATED,
  ON_HOLD,
  CONFIRMED,
  SHIPPED,
  DELIVERED,
  CANCELLED,
  RETURNED,
  DELETED
}
