package com.dealdesk.deal_bff.model;

import java.util.List;

public record AuditTrailPage(
    String dealId, List<AuditEvent> events, Pagination pagination, Integrity integrity) {

  public AuditTrailPage {
    events = events == null ? List.of() : List.copyOf(events);
  }

  public record Pagination(int total, int limit, int offset, boolean hasMore) {}

  public record Integrity(
      boolean localChainValid,
      boolean authorityChainValid,
      int localEventCount,
      int authorityEventCount,
      boolean authorityAvailable) {}
}
