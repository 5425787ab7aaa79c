package com.example.backoffice.model.logistics;

public enum WarehouseStatus {
  ACTIVE,
  INACTIVE,
  DELETED
}
