package com.example.backoffice.model.order;

public enum PaymentStatus {
  PENDING,
  PAID,
  VOIDED,
  REFUNDED
}
