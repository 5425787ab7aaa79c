package com.example.backoffice.model.order;

public enum PaymentOperation {
  CAPTURE,
  VOID,
  REFUND
}
