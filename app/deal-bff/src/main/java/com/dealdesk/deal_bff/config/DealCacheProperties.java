/*
 * どこで: Deal-BFF 設定
 * 何を: authority 読み取りキャッシュの TTL を保持する
 * なぜ: 更新直後以外の読み取りを短時間だけ再利用するため
 */
package com.dealdesk.deal_bff.config;

import java.time.Duration;
import org.springframework.boot.context.properties.ConfigurationProperties;

@ConfigurationProperties(prefix = "bff.cache")
public record DealCacheProperties(Duration snapshotTtl, Duration eventsTtl) {

  public DealCacheProperties {
    snapshotTtl = snapshotTtl == null ? Duration.ofSeconds(5) : snapshotTtl;
    eventsTtl = eventsTtl == null ? Duration.ofSeconds(4) : eventsTtl;
  }
}
