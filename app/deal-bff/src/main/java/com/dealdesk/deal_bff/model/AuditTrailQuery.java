/*
 * どこで: Deal-BFF モデル
 * 何を: 監査タイムライン取得時の絞り込み・ページング条件を表す
 * なぜ: 既定値と上限をコントローラから切り離して 1 か所で決めるため
 */
package com.dealdesk.deal_bff.model;

import java.time.Instant;
import java.util.Set;

public record AuditTrailQuery(
    int limit,
    int offset,
    Set<String> types,
    Instant startDate,
    Instant endDate,
    AuditSourceFilter source) {

  public static final int DEFAULT_LIMIT = 100;
  public static final int MAX_LIMIT = 500;

  public AuditTrailQuery {
    limit = limit <= 0 ? DEFAULT_LIMIT : Math.min(limit, MAX_LIMIT);
    offset = Math.max(offset, 0);
    types = types == null ? Set.of() : Set.copyOf(types);
    source = source == null ? AuditSourceFilter.ALL : source;
  }

  public static AuditTrailQuery defaults() {
    return new AuditTrailQuery(DEFAULT_LIMIT, 0, Set.of(), null, null, AuditSourceFilter.ALL);
  }

  public boolean matches(AuditEvent event) {
    if (!source.includes(event.source())) {
      return false;
    }
    if (!types.isEmpty() && !types.contains(event.eventType())) {
      return false;
    }
    if (startDate != null
        && (event.occurredAt() == null || event.occurredAt().isBefore(startDate))) {
      return false;
    }
    return endDate == null || (event.occurredAt() != null && !event.occurredAt().isAfter(endDate));
  }
}
