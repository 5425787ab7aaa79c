package com.example.backoffice.model.order;

public enum OrderOperation {
  CONFIRM,
  PUT_ON_HOLD,
  RELEASE_HOLD,
  SHIP,
  DELIVER,
  CANCEL,
  RETURN,
  DELETE
}
