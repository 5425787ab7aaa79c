/*
 * どこで: Backoffice 通知
 * 何を: メール送信の抽象化インターフェース
 * なぜ: 実送信/テスト差し替えを容易にするため
 */
package com.example.backoffice.handler;

public interface EmailSender {
  void send(EmailMessage message);
}
