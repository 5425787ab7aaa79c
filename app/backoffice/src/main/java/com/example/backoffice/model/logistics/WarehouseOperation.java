package com.example.backoffice.model.logistics;

public enum WarehouseOperation {
  ACTIVATE,
  DEACTIVATE,
  DELETE
}
