package com.example.backoffice.model.marketing;

public enum LiveStreamOperation {
  START,
  PAUSE,
  RESUME,
  END,
  CANCEL,
  DELETE
}
