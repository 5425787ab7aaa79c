package com.example.backoffice.model.logistics;

public enum PickPackStatus {
  PENDING,
  PICKING,
  PICKED,
  PACKING,
  PACKED,
  SHIPPED,
  CANCELLED,
  DELETED
}
