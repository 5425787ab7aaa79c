package com.example.backoffice.model.marketing;

public enum EmailCampaignOperation {
  SCHEDULE,
  START_SENDING,
  PAUSE,
  RESUME,
  MARK_SENT,
  MARK_FAILED,
  CANCEL,
  DELETE
}
