/*
 * どこで: Common 共通設定
 * 何を: UTC 固定の Clock を DI 可能にする
 * なぜ: 期限判定やスケジュール計算をテストで固定時刻に差し替えるため
 */
package com.example.common.config;

import java.time.Clock;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class TimeConfig {

  @Bean
  public Clock clock() {
    return Clock.systemUTC();
  }
}
