package com.example.backoffice.model.marketing;

public enum LiveStreamStatus {
  SCHEDULED,
  LIVE,
  PAUSED,
  ENDED,
  CANCELLED,
  DELETED
}
