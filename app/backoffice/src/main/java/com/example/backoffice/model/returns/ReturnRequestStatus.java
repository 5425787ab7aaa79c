package com.example.backoffice.model.returns;

public enum ReturnRequestStatus {
  REQUESTED,
  APPROVED,
  REJECTED,
  COMPLETED,
  DELETED
}
