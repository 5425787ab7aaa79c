/*
 * どこで: Common 共通設定
 * 何を: UTC 固定の Clock を DI 可能にする
 * なぜ: 集約の遷移時刻と outbox の時刻を同じ時計で揃え、テストで固定できるようにするため
 */
package com.example.common.config;

import java.time.Clock;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration(proxyBeanMethods = false)
public class TimeConfig {

  @Bean
  public Clock clock() {
    return Clock.systemUTC();
  }
}
