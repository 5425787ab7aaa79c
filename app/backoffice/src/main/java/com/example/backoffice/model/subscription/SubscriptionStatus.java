package com.example.backoffice.model.subscription;

public enum SubscriptionStatus {
  TRIAL,
  ACTIVE,
  SUSPENDED,
  CANCELLED,
  EXPIRED,
  DELETED
}
