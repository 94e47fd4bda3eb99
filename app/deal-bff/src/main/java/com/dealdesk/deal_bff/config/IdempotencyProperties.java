/*
 * どこで: Deal-BFF 設定
 * 何を: アクション冪等性台帳の TTL を保持する
 * なぜ: 再送を同一結果で返す期間を環境ごとに調整できるようにするため
 */
package com.dealdesk.deal_bff.config;

import java.time.Duration;
import org.springframework.boot.context.properties.ConfigurationProperties;

@ConfigurationProperties(prefix = "bff.idempotency")
public record IdempotencyProperties(Duration ttl) {

  public IdempotencyProperties {
    ttl = ttl == null ? Duration.ofSeconds(60) : ttl;
    if (ttl.isNegative() || ttl.isZero()) {
      throw new IllegalArgumentException("bff.idempotency.ttl must be positive");
    }
  }
}
