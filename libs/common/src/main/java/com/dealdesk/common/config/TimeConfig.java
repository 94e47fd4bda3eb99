/*
 * どこで: Common 共通設定
 * 何を: Clock を DI 可能にする
 * なぜ: キャッシュ期限と冪等性 TTL の時刻判定をテストで固定できるようにするため
 */
package com.dealdesk.common.config;

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
