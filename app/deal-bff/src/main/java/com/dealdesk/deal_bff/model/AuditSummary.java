package com.dealdesk.deal_bff.model;

import java.time.Instant;
import java.util.Collections;
import java.util.Map;
import java.util.TreeMap;

public record AuditSummary(
    String dealId,
    SourceSummary local,
    SourceSummary authority,
    int combinedTotal,
    boolean authorityAvailable) {

  public record SourceSummary(int total, Map<String, Long> byType, Instant lastEventAt) {

    public SourceSummary {
      // 型名順で返し、応答の並びを安定させる
      byType = byType == null ? Map.of() : Collections.unmodifiableMap(new TreeMap<>(byType));
    }
  }
}
