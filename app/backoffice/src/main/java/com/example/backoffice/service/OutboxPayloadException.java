/*
 * どこで: Backoffice outbox relay
 * 何を: outbox 行をイベントに復元できない (未知の種別/未対応バージョン/壊れた JSON)
 * なぜ: リトライしても回復しないため、即時 dead-letter に振り分けるため
 */
package com.example.backoffice.service;

public class OutboxPayloadException extends RuntimeException {

  public OutboxPayloadException(String message) {
    super(message);
  }

  public OutboxPayloadException(String message, Throwable cause) {
    super(message, cause);
  }
}
