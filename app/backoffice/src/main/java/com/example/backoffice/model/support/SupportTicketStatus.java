package com.example.backoffice.model.support;

public enum SupportTicketStatus {
  OPEN,
  IN_PROGRESS,
  WAITING,
  RESOLVED,
  CLOSED,
  DELETED
}
