package com.example.backoffice.service;

public record CommitResult(int aggregatesWritten, int outboxMessagesWritten) {

  public static CommitResult empty() {
    return new CommitResult(0, 0);
  }
}
