/*
 * どこで: Backoffice 通知
 * 何を: メール送信を模擬する実装
 * なぜ: 外部送信を伴わずに配送経路を確認するため
 */
package com.example.backoffice.handler;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

@Component
public class LocalEmailSender implements EmailSender {

  private static final Logger logger = LoggerFactory.getLogger(LocalEmailSender.class);

  @Override
  public void send(EmailMessage message) {
    // 実送信は行わず、ログに残すだけとする
    logger.info(
        "email simulated send messageKey={} to={} subject={}",
        message.messageKey(),
        message.to(),
        message.subject());
  }
}
