/*
 * どこで: Backoffice 通知
 * 何を: CI/Test 専用でメール送信失敗を注入する Sender
 * なぜ: 実コード経路を汚さずに retry -> dead-letter を再現するため
 */
package com.example.backoffice.handler;

import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.atomic.AtomicInteger;
import lombok.RequiredArgsConstructor;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Primary;
import org.springframework.context.annotation.Profile;
import org.springframework.stereotype.Component;

@Component
@Primary
@RequiredArgsConstructor
@Profile({"ci", "test"})
@ConditionalOnProperty(
    prefix = "backoffice.email.failure-injection",
    name = "enabled",
    havingValue = "true")
public class FailureInjectingEmailSender implements EmailSender {

  private final LocalEmailSender delegate;
  private final ConcurrentMap<UUID, AtomicInteger> failuresByMessage = new ConcurrentHashMap<>();

  @Value("${backoffice.email.failure-injection.recipient-prefix:}")
  private String recipientPrefix;

  // 負数は常に失敗させる
  @Value("${backoffice.email.failure-injection.failures-per-message:-1}")
  private int failuresPerMessage;

  @Override
  public void send(EmailMessage message) {
    if (shouldInjectFailure(message)) {
      throw new IllegalStateException(
          "email delivery failure injection matched to=" + message.to());
    }
    delegate.send(message);
  }

  private boolean shouldInjectFailure(EmailMessage message) {
    if (recipientPrefix == null || recipientPrefix.isBlank()) {
      return false;
    }
    if (message.to() == null || !message.to().startsWith(recipientPrefix)) {
      return false;
    }
    if (failuresPerMessage < 0) {
      return true;
    }
    final int failed =
        failuresByMessage
            .computeIfAbsent(message.messageKey(), ignored -> new AtomicInteger())
            .getAndIncrement();
    return failed < failuresPerMessage;
  }
}
