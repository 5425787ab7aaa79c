package com.example.backoffice.model.support;

public enum SupportTicketOperation {
  ASSIGN,
  AWAIT_CUSTOMER,
  RESUME,
  RESOLVE,
  CLOSE,
  REOPEN,
  DELETE
}
