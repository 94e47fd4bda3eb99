/*
 * どこで: Deal-BFF 設定
 * 何を: ハッシュ・キャッシュ・coalescer を Bean として組み立てる
 * なぜ: 共有状態をグローバルに持たず、インスタンスとして注入・差し替えできるようにするため
 */
package com.dealdesk.deal_bff.config;

import com.dealdesk.common.cache.TtlCache;
import com.dealdesk.common.concurrent.InFlightCoalescer;
import com.dealdesk.common.hash.CanonicalHasher;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.time.Clock;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class CoreComponentsConfig {

  @Bean
  CanonicalHasher canonicalHasher(ObjectMapper objectMapper) {
    return new CanonicalHasher(objectMapper);
  }

  @Bean
  TtlCache<JsonNode> dealReadCache(Clock clock) {
    return new TtlCache<>(clock);
  }

  @Bean
  InFlightCoalescer inFlightCoalescer() {
    return new InFlightCoalescer();
  }
}
