package com.example.backoffice.model.returns;

public enum ReturnRequestOperation {
  APPROVE,
  REJECT,
  COMPLETE,
  DELETE
}
