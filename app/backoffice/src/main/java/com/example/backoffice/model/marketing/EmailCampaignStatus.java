package com.example.backoffice.model.marketing;

public enum EmailCampaignStatus {
  DRAFT,
  SCHEDULED,
  SENDING,
  PAUSED,
  SENT,
  FAILED,
  CANCELLED,
  DELETED
}
