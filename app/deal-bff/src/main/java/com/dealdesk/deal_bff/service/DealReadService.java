/*
 * どこで: Deal-BFF サービス層
 * 何を: authority のスナップショットとイベント一覧を短 TTL キャッシュ越しに返す
 * なぜ: 画面の連続読み取りで authority を毎回叩かないため
 */
package com.dealdesk.deal_bff.service;

import com.dealdesk.common.cache.TtlCache;
import com.dealdesk.deal_bff.config.DealCacheProperties;
import com.dealdesk.deal_bff.service.dto.AuthorityEvent;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import edu.umd.cs.findbugs.annotations.SuppressFBWarnings;
import java.time.Duration;
import java.util.List;
import java.util.Optional;
import java.util.function.Supplier;
import org.springframework.stereotype.Service;

@Service
public class DealReadService {

  private final AuthorityClient authorityClient;
  private final TtlCache<JsonNode> dealReadCache;
  private final DealCacheProperties properties;
  private final ObjectMapper objectMapper;
  private final BffMetrics bffMetrics;

  @SuppressFBWarnings(
      value = "EI_EXPOSE_REP2",
      justification = "注入されるコンポーネントは Spring 管理の共有インスタンスで防御的コピーが不可能なため")
  public DealReadService(
      AuthorityClient authorityClient,
      TtlCache<JsonNode> dealReadCache,
      DealCacheProperties properties,
      ObjectMapper objectMapper,
      BffMetrics bffMetrics) {
    this.authorityClient = authorityClient;
    this.dealReadCache = dealReadCache;
    this.properties = properties;
    this.objectMapper = objectMapper;
    this.bffMetrics = bffMetrics;
  }

  public JsonNode getSnapshot(String dealId) {
    return cached(
        DealCacheKeys.snapshot(dealId),
        properties.snapshotTtl(),
        () -> authorityClient.getSnapshot(dealId));
  }

  public JsonNode getAuthorityEvents(String dealId) {
    return cached(
        DealCacheKeys.authorityEvents(dealId),
        properties.eventsTtl(),
        () -> {
          final List<AuthorityEvent> events = authorityClient.listEvents(dealId);
          return objectMapper.valueToTree(events);
        });
  }

  private JsonNode cached(String key, Duration ttl, Supplier<JsonNode> loader) {
    final Optional<JsonNode> hit = dealReadCache.get(key);
    if (hit.isPresent()) {
      bffMetrics.recordCacheLookup("hit");
      return hit.get().deepCopy();
    }
    bffMetrics.recordCacheLookup("miss");
    final JsonNode loaded = loader.get();
    dealReadCache.set(key, loaded.deepCopy(), ttl);
    return loaded;
  }
}
