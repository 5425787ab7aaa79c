package com.example.backoffice.model.subscription;

public enum SubscriptionOperation {
  ACTIVATE,
  SUSPEND,
  CANCEL,
  EXPIRE,
  RENEW,
  DELETE
}
