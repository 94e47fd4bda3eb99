/*
 * どこで: Deal-BFF サービス層
 * 何を: アクション結果・authority 呼び出し・キャッシュ参照のメトリクスを記録する
 * なぜ: BLOCKED 増加や authority 障害、キャッシュ効き具合を Prometheus から直接観測できるようにするため
 */
package com.dealdesk.deal_bff.service;

import edu.umd.cs.findbugs.annotations.SuppressFBWarnings;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Tags;
import io.micrometer.core.instrument.Timer;
import java.time.Duration;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import org.springframework.stereotype.Component;

@Component
@SuppressFBWarnings(
    value = "EI_EXPOSE_REP2",
    justification = "MeterRegistry は Spring 管理の共有コンポーネントで防御的コピーが不可能なため")
public class BffMetrics {

  private static final String METRIC_ACTION_TOTAL = "bff.action.total";
  private static final String METRIC_AUTHORITY_ERROR_TOTAL = "bff.authority.error.total";
  private static final String METRIC_AUTHORITY_REQUEST_DURATION = "bff.authority.request.duration";
  private static final String METRIC_CACHE_LOOKUP_TOTAL = "bff.cache.lookup.total";

  private final MeterRegistry meterRegistry;
  private final ConcurrentMap<String, Counter> actionCounters = new ConcurrentHashMap<>();
  private final ConcurrentMap<String, Counter> authorityErrorCounters = new ConcurrentHashMap<>();
  private final ConcurrentMap<String, Timer> authorityTimers = new ConcurrentHashMap<>();
  private final ConcurrentMap<String, Counter> cacheCounters = new ConcurrentHashMap<>();

  public BffMetrics(MeterRegistry meterRegistry) {
    this.meterRegistry = meterRegistry;
  }

  public void recordActionOutcome(String outcome) {
    actionCounters
        .computeIfAbsent(
            outcome,
            ignored ->
                Counter.builder(METRIC_ACTION_TOTAL)
                    .description("Deal action outcomes")
                    .tags(Tags.of("outcome", outcome))
                    .register(meterRegistry))
        .increment();
  }

  public void recordAuthorityError(String operation, String reason) {
    final String key = operation + "|" + reason;
    authorityErrorCounters
        .computeIfAbsent(
            key,
            ignored ->
                Counter.builder(METRIC_AUTHORITY_ERROR_TOTAL)
                    .description("Authority integration errors by operation and reason")
                    .tags(Tags.of("operation", operation, "reason", reason))
                    .register(meterRegistry))
        .increment();
  }

  public void recordAuthorityDuration(String operation, String result, Duration duration) {
    final String key = operation + "|" + result;
    authorityTimers
        .computeIfAbsent(
            key,
            ignored ->
                Timer.builder(METRIC_AUTHORITY_REQUEST_DURATION)
                    .description("Authority request duration")
                    .tags(Tags.of("operation", operation, "result", result))
                    .register(meterRegistry))
        .record(duration);
  }

  public void recordCacheLookup(String result) {
    cacheCounters
        .computeIfAbsent(
            result,
            ignored ->
                Counter.builder(METRIC_CACHE_LOOKUP_TOTAL)
                    .description("Deal read cache lookups")
                    .tags(Tags.of("result", result))
                    .register(meterRegistry))
        .increment();
  }
}
