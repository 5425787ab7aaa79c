package com.example.backoffice.service;

public class OutboxMessageNotFoundException extends RuntimeException {

  public OutboxMessageNotFoundException(long id) {
    super("outbox message not found id=" + id);
  }
}
