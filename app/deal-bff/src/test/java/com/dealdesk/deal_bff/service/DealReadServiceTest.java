/*
 * どこで: Deal-BFF サービス層テスト
 * 何を: スナップショット/イベント一覧の TTL キャッシュとアクション後の prefix 破棄を検証する
 * なぜ: キャッシュ期間内は authority を再呼び出しせず、更新後は必ず取り直すことを保証するため
 */
package com.dealdesk.deal_bff.service;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.dealdesk.common.cache.TtlCache;
import com.dealdesk.deal_bff.config.DealCacheProperties;
import com.dealdesk.deal_bff.service.dto.AuthorityEvent;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.json.JsonMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneId;
import java.time.ZoneOffset;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.Mockito;

class DealReadServiceTest {

  private final ObjectMapper objectMapper =
      JsonMapper.builder().addModule(new JavaTimeModule()).build();
  private final MutableClock clock = new MutableClock(Instant.parse("2026-01-17T00:00:00Z"));
  private AuthorityClient authorityClient;
  private TtlCache<JsonNode> cache;
  private SimpleMeterRegistry meterRegistry;
  private DealReadService service;
  private DealCacheInvalidator invalidator;

  @BeforeEach
  void setUp() {
    authorityClient = Mockito.mock(AuthorityClient.class);
    cache = new TtlCache<>(clock);
    meterRegistry = new SimpleMeterRegistry();
    service =
        new DealReadService(
            authorityClient,
            cache,
            new DealCacheProperties(Duration.ofSeconds(5), Duration.ofSeconds(4)),
            objectMapper,
            new BffMetrics(meterRegistry));
    invalidator = new DealCacheInvalidator(cache);
  }

  @Test
  void snapshotIsServedFromCacheWithinTtl() {
    when(authorityClient.getSnapshot("D1")).thenReturn(snapshot("Review"));

    service.getSnapshot("D1");
    clock.advance(Duration.ofSeconds(4));
    final JsonNode cached = service.getSnapshot("D1");

    assertThat(cached.get("stage").asText()).isEqualTo("Review");
    verify(authorityClient, times(1)).getSnapshot("D1");
    assertThat(meterRegistry.get("bff.cache.lookup.total").tag("result", "hit").counter().count())
        .isEqualTo(1.0d);
  }

  @Test
  void snapshotIsReloadedAfterTtl() {
    when(authorityClient.getSnapshot("D1")).thenReturn(snapshot("Review"), snapshot("Approved"));

    service.getSnapshot("D1");
    clock.advance(Duration.ofSeconds(5));
    final JsonNode reloaded = service.getSnapshot("D1");

    assertThat(reloaded.get("stage").asText()).isEqualTo("Approved");
    verify(authorityClient, times(2)).getSnapshot("D1");
  }

  @Test
  void invalidationDropsEveryEntryOfTheDealOnly() {
    when(authorityClient.getSnapshot("D1")).thenReturn(snapshot("Review"));
    when(authorityClient.getSnapshot("D10")).thenReturn(snapshot("Draft"));
    when(authorityClient.listEvents("D1")).thenReturn(List.of(event()));
    service.getSnapshot("D1");
    service.getAuthorityEvents("D1");
    service.getSnapshot("D10");

    final int removed = invalidator.invalidateDeal("D1");
    service.getSnapshot("D1");
    service.getSnapshot("D10");

    assertThat(removed).isEqualTo(2);
    verify(authorityClient, times(2)).getSnapshot("D1");
    verify(authorityClient, times(1)).getSnapshot("D10");
  }

  @Test
  void callerMutationDoesNotLeakIntoCache() {
    when(authorityClient.getSnapshot("D1")).thenReturn(snapshot("Review"));

    final ObjectNode first = (ObjectNode) service.getSnapshot("D1");
    first.put("stage", "Mutated");

    assertThat(service.getSnapshot("D1").get("stage").asText()).isEqualTo("Review");
  }

  @Test
  void authorityEventsAreSerializedIntoCache() {
    when(authorityClient.listEvents("D1")).thenReturn(List.of(event()));

    final JsonNode events = service.getAuthorityEvents("D1");

    assertThat(events.isArray()).isTrue();
    assertThat(events.get(0).get("id").asText()).isEqualTo("e1");
    assertThat(cache.get(DealCacheKeys.authorityEvents("D1"))).isPresent();
  }

  @Test
  void loaderFailureIsNotCached() {
    when(authorityClient.getSnapshot("D1"))
        .thenThrow(
            new AuthorityIntegrationException(
                AuthorityIntegrationException.Reason.UNAVAILABLE, "down", null));

    assertThatThrownBy(() -> service.getSnapshot("D1"))
        .isInstanceOf(AuthorityIntegrationException.class);
    assertThat(cache.size()).isZero();
  }

  private JsonNode snapshot(String stage) {
    return objectMapper.createObjectNode().put("dealId", "D1").put("stage", stage);
  }

  private AuthorityEvent event() {
    return new AuthorityEvent(
        "e1",
        "D1",
        "DealCreated",
        "A1",
        objectMapper.createObjectNode(),
        Instant.parse("2026-01-17T00:00:00Z"),
        1L,
        "h1",
        null);
  }

  private static final class MutableClock extends Clock {

    private Instant now;

    private MutableClock(Instant now) {
      this.now = now;
    }

    void advance(Duration duration) {
      now = now.plus(duration);
    }

    @Override
    public ZoneId getZone() {
      return ZoneOffset.UTC;
    }

    @Override
    public Clock withZone(ZoneId zone) {
      return this;
    }

    @Override
    public Instant instant() {
      return now;
    }
  }
}
