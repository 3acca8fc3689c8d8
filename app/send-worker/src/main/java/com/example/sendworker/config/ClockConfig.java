/*
 * どこで: Send Worker の共通設定
 * 何を: UTC の Clock を Bean として公開する
 * なぜ: スロットル期限や遅延時刻の計算をテストで固定できるようにするため
 */
package com.example.sendworker.config;

import java.time.Clock;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class ClockConfig {

  @Bean
  public Clock clock() {
    return Clock.systemUTC();
  }
}
