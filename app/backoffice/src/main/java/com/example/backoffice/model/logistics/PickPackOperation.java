package com.example.backoffice.model.logistics;

public enum PickPackOperation {
  START_PICKING,
  COMPLETE_PICKING,
  START_PACKING,
  COMPLETE_PACKING,
  SHIP,
  CANCEL,
  DELETE
}
